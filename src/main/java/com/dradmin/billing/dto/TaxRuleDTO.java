package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.dradmin.billing.entity.TaxRule;

import jakarta.validation.constraints.DecimalMax;
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
public class TaxRuleDTO {
    private Long id;

    @NotBlank
    @Pattern(regexp = "^[A-Za-z]{2}$")
    private String countryCode;

    private String stateCode;

    @NotBlank
    private String taxName;

    @NotNull
    @DecimalMin("0.000")
    @DecimalMax("100.000")
    private BigDecimal rate;

    @Builder.Default
    private boolean appliesToSetupFees = true;

    private boolean reverseCharge;
    private LocalDate effectiveFrom;
    private LocalDate effectiveUntil;

    @Builder.Default
    private boolean active = true;

    private int priority;

    public static TaxRuleDTO fromEntity(TaxRule rule) {
        return TaxRuleDTO.builder()
                .id(rule.getId())
                .countryCode(rule.getCountryCode())
                .stateCode(rule.getStateCode())
                .taxName(rule.getTaxName())
                .rate(rule.getRate())
                .appliesToSetupFees(rule.isAppliesToSetupFees())
                .reverseCharge(rule.isReverseCharge())
                .effectiveFrom(rule.getEffectiveFrom())
                .effectiveUntil(rule.getEffectiveUntil())
                .active(rule.isActive())
                .priority(rule.getPriority())
                .build();
    }
}
