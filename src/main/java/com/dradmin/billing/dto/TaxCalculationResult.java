package com.dradmin.billing.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaxCalculationResult {
    private BigDecimal taxAmount;
    private BigDecimal taxRate;
    private String taxName;
    private boolean reverseCharge;
}
