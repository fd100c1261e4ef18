package com.dradmin.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dradmin.entity.Customer;
import com.dradmin.entity.Customer.CustomerStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDTO {
    private Long id;
    private Long referenceNumber;
    private String formattedReferenceNumber;
    private Long customerNumber;
    private String formattedCustomerNumber;
    private String name;
    private String email;
    private String phone;
    private String customerName;
    private String taxId;
    private String vatNumber;
    private String countryCode;
    private String stateCode;
    private boolean company;
    private boolean active;
    private CustomerStatus status;
    private BigDecimal balance;
    private BigDecimal creditLimit;
    private String notes;
    private String billingEmail;
    private String preferredPaymentMethod;
    private String preferredCurrency;
    private boolean allowCurrencyOverride;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CustomerDTO fromEntity(Customer customer) {
        return CustomerDTO.builder()
                .id(customer.getId())
                .referenceNumber(customer.getReferenceNumber())
                .customerNumber(customer.getCustomerNumber())
                .name(customer.getName())
                .email(customer.getEmail())
                .phone(customer.getPhone())
                .customerName(customer.getCustomerName())
                .taxId(customer.getTaxId())
                .vatNumber(customer.getVatNumber())
                .countryCode(customer.getCountryCode())
                .stateCode(customer.getStateCode())
                .company(customer.isCompany())
                .active(customer.isActive())
                .status(customer.getStatus())
                .balance(customer.getBalance())
                .creditLimit(customer.getCreditLimit())
                .notes(customer.getNotes())
                .billingEmail(customer.getBillingEmail())
                .preferredPaymentMethod(customer.getPreferredPaymentMethod())
                .preferredCurrency(customer.getPreferredCurrency())
                .allowCurrencyOverride(customer.isAllowCurrencyOverride())
                .createdAt(customer.getCreatedAt())
                .updatedAt(customer.getUpdatedAt())
                .build();
    }
}
