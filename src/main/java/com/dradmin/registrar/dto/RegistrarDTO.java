package com.dradmin.registrar.dto;

import java.time.LocalDateTime;

import com.dradmin.registrar.entity.Registrar;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrarDTO {
    private Long id;

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotBlank
    @Pattern(regexp = "^[A-Za-z0-9_-]{2,50}$")
    private String code;

    @Size(max = 500)
    private String apiUrl;

    @Builder.Default
    private boolean active = true;

    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static RegistrarDTO fromEntity(Registrar registrar) {
        return RegistrarDTO.builder()
                .id(registrar.getId())
                .name(registrar.getName())
                .code(registrar.getCode())
                .apiUrl(registrar.getApiUrl())
                .active(registrar.isActive())
                .notes(registrar.getNotes())
                .createdAt(registrar.getCreatedAt())
                .updatedAt(registrar.getUpdatedAt())
                .build();
    }
}
