package com.dradmin.billing.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreditAmountRequest {
    @NotNull
    @DecimalMin("0.01")
    private BigDecimal amount;

    private Long invoiceId;

    private String description;
}
