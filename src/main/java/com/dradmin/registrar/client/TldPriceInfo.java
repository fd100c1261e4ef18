package com.dradmin.registrar.client;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TldPriceInfo {
    private String extension;
    private BigDecimal registrationPrice;
    private BigDecimal renewalPrice;
    private BigDecimal transferPrice;
    private String currency;
    private Integer minYears;
    private Integer maxYears;

    public boolean hasAnyPrice() {
        return registrationPrice != null || renewalPrice != null || transferPrice != null;
    }
}
