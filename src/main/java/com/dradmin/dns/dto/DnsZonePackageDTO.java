package com.dradmin.dns.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.dradmin.dns.entity.DnsZonePackage;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DnsZonePackageDTO {
    private Long id;

    @NotBlank
    @Size(max = 100)
    private String name;

    private String description;

    @Builder.Default
    private boolean active = true;

    private boolean defaultPackage;
    private int sortOrder;

    @Valid
    @Builder.Default
    private List<DnsZonePackageRecordDTO> records = new ArrayList<>();

    public static DnsZonePackageDTO summaryOf(DnsZonePackage zonePackage) {
        return DnsZonePackageDTO.builder()
                .id(zonePackage.getId())
                .name(zonePackage.getName())
                .description(zonePackage.getDescription())
                .active(zonePackage.isActive())
                .defaultPackage(zonePackage.isDefaultPackage())
                .sortOrder(zonePackage.getSortOrder())
                .build();
    }

    public static DnsZonePackageDTO fromEntity(DnsZonePackage zonePackage) {
        DnsZonePackageDTO dto = summaryOf(zonePackage);
        dto.setRecords(zonePackage.getRecords().stream()
                .map(DnsZonePackageRecordDTO::fromEntity)
                .collect(Collectors.toList()));
        return dto;
    }
}
