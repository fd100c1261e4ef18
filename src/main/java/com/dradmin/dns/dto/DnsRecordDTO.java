package com.dradmin.dns.dto;

import java.time.LocalDateTime;

import com.dradmin.dns.entity.DnsRecord;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
public class DnsRecordDTO {
    private Long id;

    @NotNull
    private Long domainId;
    private String domainName;

    @NotBlank
    private String type;

    @NotBlank
    @Size(max = 255)
    private String name;

    @NotBlank
    @Size(max = 4000)
    private String value;

    // 0 or less means the type's default
    private int ttl;

    @Min(0)
    @Max(65535)
    private Integer priority;

    @Min(0)
    @Max(65535)
    private Integer weight;

    @Min(0)
    @Max(65535)
    private Integer port;

    private boolean pendingSync;
    private boolean deleted;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static DnsRecordDTO fromEntity(DnsRecord record) {
        return DnsRecordDTO.builder()
                .id(record.getId())
                .domainId(record.getDomain().getId())
                .domainName(record.getDomain().getName())
                .type(record.getType().getType())
                .name(record.getName())
                .value(record.getValue())
                .ttl(record.getTtl())
                .priority(record.getPriority())
                .weight(record.getWeight())
                .port(record.getPort())
                .pendingSync(record.isPendingSync())
                .deleted(record.isDeleted())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
