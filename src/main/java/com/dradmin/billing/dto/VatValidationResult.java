package com.dradmin.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VatValidationResult {
    private String vatNumber;
    private String countryCode;
    private boolean valid;
    private String message;
}
