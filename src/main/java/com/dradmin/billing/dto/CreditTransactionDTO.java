package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dradmin.billing.entity.CreditTransaction;
import com.dradmin.billing.entity.CreditTransaction.CreditTransactionType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditTransactionDTO {
    private Long id;
    private Long customerId;
    private CreditTransactionType type;
    private BigDecimal amount;
    private BigDecimal balanceAfter;
    private Long invoiceId;
    private String description;
    private String createdBy;
    private LocalDateTime createdAt;

    public static CreditTransactionDTO fromEntity(CreditTransaction tx) {
        return CreditTransactionDTO.builder()
                .id(tx.getId())
                .customerId(tx.getCustomer().getId())
                .type(tx.getType())
                .amount(tx.getAmount())
                .balanceAfter(tx.getBalanceAfter())
                .invoiceId(tx.getInvoice() != null ? tx.getInvoice().getId() : null)
                .description(tx.getDescription())
                .createdBy(tx.getCreatedBy())
                .createdAt(tx.getCreatedAt())
                .build();
    }
}
