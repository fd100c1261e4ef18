package com.dradmin.billing.dto;

import java.math.BigDecimal;

import com.dradmin.billing.entity.CreditTransaction.CreditTransactionType;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger entry request. For ADJUSTMENT the amount is signed; for other types its sign is implied by the type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditTransactionRequest {
    @NotNull
    private Long customerId;

    @NotNull
    private CreditTransactionType type;

    @NotNull
    private BigDecimal amount;

    private Long invoiceId;

    private String description;
}
