package com.dradmin.billing.dto;

import java.math.BigDecimal;

import com.dradmin.billing.entity.QuoteLine;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteLineDTO {
    private Long id;

    @NotBlank
    private String description;

    @NotNull
    @DecimalMin("0.001")
    private BigDecimal quantity;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal unitPrice;

    @DecimalMin("0.00")
    private BigDecimal setupFee;

    @Builder.Default
    private boolean taxable = true;

    public static QuoteLineDTO fromEntity(QuoteLine line) {
        return QuoteLineDTO.builder()
                .id(line.getId())
                .description(line.getDescription())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .setupFee(line.getSetupFee())
                .taxable(line.isTaxable())
                .build();
    }
}
