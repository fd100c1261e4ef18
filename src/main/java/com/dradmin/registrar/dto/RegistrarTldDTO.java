package com.dradmin.registrar.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.dradmin.registrar.entity.RegistrarTld;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
public class RegistrarTldDTO {
    private Long id;

    @NotNull
    private Long registrarId;
    private String registrarName;

    @NotNull
    private Long tldId;
    private String extension;

    @DecimalMin("0.00")
    private BigDecimal registrationCost;

    @DecimalMin("0.00")
    private BigDecimal renewalCost;

    @DecimalMin("0.00")
    private BigDecimal transferCost;

    @Pattern(regexp = "^[A-Za-z]{3}$")
    private String currency;

    @Builder.Default
    private boolean active = true;

    private boolean autoRenew;

    @Min(1)
    @Max(10)
    @Builder.Default
    private int minRegistrationYears = 1;

    @Min(1)
    @Max(10)
    @Builder.Default
    private int maxRegistrationYears = 10;

    private String notes;
    private LocalDateTime lastSyncedAt;

    public static RegistrarTldDTO fromEntity(RegistrarTld link) {
        return RegistrarTldDTO.builder()
                .id(link.getId())
                .registrarId(link.getRegistrar().getId())
                .registrarName(link.getRegistrar().getName())
                .tldId(link.getTld().getId())
                .extension(link.getTld().getExtension())
                .registrationCost(link.getRegistrationCost())
                .renewalCost(link.getRenewalCost())
                .transferCost(link.getTransferCost())
                .currency(link.getCurrency())
                .active(link.isActive())
                .autoRenew(link.isAutoRenew())
                .minRegistrationYears(link.getMinRegistrationYears())
                .maxRegistrationYears(link.getMaxRegistrationYears())
                .notes(link.getNotes())
                .lastSyncedAt(link.getLastSyncedAt())
                .build();
    }
}
