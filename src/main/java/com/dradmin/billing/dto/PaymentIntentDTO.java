package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentDTO {
    private Long id;
    private Long customerId;
    private Long invoiceId;
    private BigDecimal amount;
    private String currency;
    private String gatewayIntentId;
    private String status;
    private LocalDateTime createdAt;
}
