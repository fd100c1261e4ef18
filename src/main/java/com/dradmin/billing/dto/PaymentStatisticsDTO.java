package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.util.Map;

import com.dradmin.billing.entity.PaymentTransaction.PaymentStatus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStatisticsDTO {
    private long totalTransactions;
    private Map<PaymentStatus, Long> countsByStatus;
    private BigDecimal completedAmount;
}
