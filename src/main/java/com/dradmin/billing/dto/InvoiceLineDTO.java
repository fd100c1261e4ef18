package com.dradmin.billing.dto;

import java.math.BigDecimal;

import com.dradmin.billing.entity.InvoiceLine;

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
public class InvoiceLineDTO {
    private Long id;

    @NotBlank
    private String description;

    @NotNull
    @DecimalMin(value = "0.001")
    private BigDecimal quantity;

    @NotNull
    private BigDecimal unitPrice;

    @DecimalMin("0.00")
    private BigDecimal discount;

    @Builder.Default
    private boolean taxable = true;

    private BigDecimal lineTotal;

    public static InvoiceLineDTO fromEntity(InvoiceLine line) {
        return InvoiceLineDTO.builder()
                .id(line.getId())
                .description(line.getDescription())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .discount(line.getDiscount())
                .taxable(line.isTaxable())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
