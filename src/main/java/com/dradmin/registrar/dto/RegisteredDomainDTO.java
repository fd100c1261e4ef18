package com.dradmin.registrar.dto;

import java.time.LocalDate;
import java.time.LocalDateTime;

import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisteredDomainDTO {
    private Long id;

    @NotBlank
    @Size(max = 253)
    private String name;

    @NotNull
    private Long customerId;
    private String customerName;

    // resolved from the name when omitted
    private Long tldId;
    private String extension;

    private Long registrarId;
    private String registrarName;

    private DomainStatus status;
    private LocalDate registrationDate;
    private LocalDate expirationDate;
    private boolean autoRenew;
    private boolean privacyProtection;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static RegisteredDomainDTO fromEntity(RegisteredDomain domain) {
        RegisteredDomainDTOBuilder builder = RegisteredDomainDTO.builder()
                .id(domain.getId())
                .name(domain.getName())
                .customerId(domain.getCustomer().getId())
                .customerName(domain.getCustomer().getName())
                .tldId(domain.getTld().getId())
                .extension(domain.getTld().getExtension())
                .status(domain.getStatus())
                .registrationDate(domain.getRegistrationDate())
                .expirationDate(domain.getExpirationDate())
                .autoRenew(domain.isAutoRenew())
                .privacyProtection(domain.isPrivacyProtection())
                .createdAt(domain.getCreatedAt())
                .updatedAt(domain.getUpdatedAt());
        if (domain.getRegistrar() != null) {
            builder.registrarId(domain.getRegistrar().getId())
                    .registrarName(domain.getRegistrar().getName());
        }
        return builder.build();
    }
}
