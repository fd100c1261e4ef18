package com.dradmin.dns.dto;

import com.dradmin.dns.entity.DnsZonePackageRecord;

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
public class DnsZonePackageRecordDTO {
    private Long id;

    @NotBlank
    private String type;

    @NotBlank
    @Size(max = 255)
    private String name;

    @NotBlank
    @Size(max = 4000)
    private String value;

    private int ttl;
    private Integer priority;
    private Integer weight;
    private Integer port;
    private String notes;

    public static DnsZonePackageRecordDTO fromEntity(DnsZonePackageRecord record) {
        return DnsZonePackageRecordDTO.builder()
                .id(record.getId())
                .type(record.getType().getType())
                .name(record.getName())
                .value(record.getValue())
                .ttl(record.getTtl())
                .priority(record.getPriority())
                .weight(record.getWeight())
                .port(record.getPort())
                .notes(record.getNotes())
                .build();
    }
}
