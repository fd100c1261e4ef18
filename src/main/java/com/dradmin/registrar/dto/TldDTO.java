package com.dradmin.registrar.dto;

import com.dradmin.registrar.entity.Tld;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TldDTO {
    private Long id;

    @NotBlank
    @Pattern(regexp = "^\\.?[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*$")
    private String extension;

    private String description;

    @Builder.Default
    private boolean active = true;

    @Min(1)
    @Max(10)
    @Builder.Default
    private int defaultRegistrationYears = 1;

    public static TldDTO fromEntity(Tld tld) {
        return TldDTO.builder()
                .id(tld.getId())
                .extension(tld.getExtension())
                .description(tld.getDescription())
                .active(tld.isActive())
                .defaultRegistrationYears(tld.getDefaultRegistrationYears())
                .build();
    }
}
