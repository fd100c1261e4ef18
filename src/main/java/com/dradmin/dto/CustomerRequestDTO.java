package com.dradmin.dto;

import java.math.BigDecimal;

import com.dradmin.entity.Customer.CustomerStatus;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of customer create and update requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRequestDTO {
    @NotBlank
    @Size(max = 200)
    private String name;

    @NotBlank
    @Email
    private String email;

    private String phone;
    private String customerName;
    private String taxId;
    private String vatNumber;

    @Pattern(regexp = "^[A-Za-z]{2}$", message = "Country code must be ISO 3166-1 alpha-2")
    private String countryCode;

    private String stateCode;
    private boolean company;
    private Boolean active;
    private CustomerStatus status;

    @DecimalMin("0.00")
    private BigDecimal creditLimit;

    private String notes;

    @Email
    private String billingEmail;

    private String preferredPaymentMethod;

    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be an ISO 4217 code")
    private String preferredCurrency;

    private boolean allowCurrencyOverride;
}
