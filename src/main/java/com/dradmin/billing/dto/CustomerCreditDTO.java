package com.dradmin.billing.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerCreditDTO {
    private Long customerId;
    private BigDecimal balance;
    private BigDecimal creditLimit;
    private BigDecimal available;
}
