package com.dradmin.dns.dto;

import com.dradmin.dns.entity.DnsRecordType;

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
public class DnsRecordTypeDTO {
    private Long id;

    @NotBlank
    @Pattern(regexp = "^[A-Za-z0-9]{1,10}$")
    private String type;

    private String description;
    private boolean hasPriority;
    private boolean hasWeight;
    private boolean hasPort;

    @Builder.Default
    private boolean editableByUser = true;

    @Builder.Default
    private boolean active = true;

    @Min(1)
    @Builder.Default
    private int defaultTtl = 3600;

    public static DnsRecordTypeDTO fromEntity(DnsRecordType type) {
        return DnsRecordTypeDTO.builder()
                .id(type.getId())
                .type(type.getType())
                .description(type.getDescription())
                .hasPriority(type.isHasPriority())
                .hasWeight(type.isHasWeight())
                .hasPort(type.isHasPort())
                .editableByUser(type.isEditableByUser())
                .active(type.isActive())
                .defaultTtl(type.getDefaultTtl())
                .build();
    }
}
