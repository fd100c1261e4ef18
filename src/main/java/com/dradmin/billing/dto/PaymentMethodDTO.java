package com.dradmin.billing.dto;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMethodDTO {
    private Long id;
    private Long customerId;
    private String type;
    private String last4;
    private String gatewayMethodId;
    private boolean defaultMethod;
    private LocalDateTime createdAt;
}
