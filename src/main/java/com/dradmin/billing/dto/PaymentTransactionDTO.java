package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dradmin.billing.entity.PaymentTransaction;
import com.dradmin.billing.entity.PaymentTransaction.PaymentGateway;
import com.dradmin.billing.entity.PaymentTransaction.PaymentStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionDTO {
    private Long id;
    private String transactionReference;
    private Long invoiceId;
    private String invoiceNumber;
    private PaymentGateway gateway;
    private String sessionId;
    private String paymentIntentId;
    private String checkoutUrl;
    private String customerEmail;
    private BigDecimal amount;
    private String currency;
    private PaymentStatus status;
    private String gatewayPaymentStatus;
    private LocalDateTime gatewayCreatedAt;
    private LocalDateTime gatewayExpiresAt;
    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static PaymentTransactionDTO fromEntity(PaymentTransaction tx) {
        return PaymentTransactionDTO.builder()
                .id(tx.getId())
                .transactionReference(tx.getTransactionReference())
                .invoiceId(tx.getInvoice().getId())
                .invoiceNumber(tx.getInvoice().getInvoiceNumber())
                .gateway(tx.getGateway())
                .sessionId(tx.getSessionId())
                .paymentIntentId(tx.getPaymentIntentId())
                .customerEmail(tx.getCustomerEmail())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .status(tx.getStatus())
                .gatewayPaymentStatus(tx.getGatewayPaymentStatus())
                .gatewayCreatedAt(tx.getGatewayCreatedAt())
                .gatewayExpiresAt(tx.getGatewayExpiresAt())
                .notes(tx.getNotes())
                .createdAt(tx.getCreatedAt())
                .updatedAt(tx.getUpdatedAt())
                .build();
    }
}
