package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dradmin.billing.entity.CurrencyExchangeRate;
import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeRateDTO {
    private Long id;

    @NotBlank
    @Pattern(regexp = "^[A-Za-z]{3}$")
    private String baseCurrency;

    @NotBlank
    @Pattern(regexp = "^[A-Za-z]{3}$")
    private String targetCurrency;

    @NotNull
    @DecimalMin(value = "0.00000001")
    private BigDecimal rate;

    private BigDecimal markup;
    private BigDecimal effectiveRate;
    private LocalDateTime effectiveDate;
    private LocalDateTime expiryDate;
    private RateSource source;

    @Builder.Default
    private boolean active = true;

    private String notes;

    public static ExchangeRateDTO fromEntity(CurrencyExchangeRate rate) {
        return ExchangeRateDTO.builder()
                .id(rate.getId())
                .baseCurrency(rate.getBaseCurrency())
                .targetCurrency(rate.getTargetCurrency())
                .rate(rate.getRate())
                .markup(rate.getMarkup())
                .effectiveRate(rate.getEffectiveRate())
                .effectiveDate(rate.getEffectiveDate())
                .expiryDate(rate.getExpiryDate())
                .source(rate.getSource())
                .active(rate.isActive())
                .notes(rate.getNotes())
                .build();
    }
}
