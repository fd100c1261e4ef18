package com.dradmin.registrar.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrarCostPreviewDTO {
    private Long registrarId;
    private String registrarName;
    private String extension;
    private BigDecimal registrationCost;
    private BigDecimal renewalCost;
    private BigDecimal transferCost;
    private String currency;
}
