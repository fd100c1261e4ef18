package com.dradmin.billing.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
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
public class QuoteRequestDTO {
    @NotNull
    private Long customerId;

    private LocalDate validUntil;

    @Pattern(regexp = "^[A-Za-z]{3}$")
    private String currencyCode;

    private String couponCode;

    private String notes;

    @Valid
    @Builder.Default
    private List<QuoteLineDTO> lines = new ArrayList<>();
}
