package com.dradmin.hosting.dto;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.HostingDomain;
import com.dradmin.hosting.entity.HostingDomain.DomainType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostingDomainDTO {
    private Long id;
    private Long hostingAccountId;
    private String domainName;
    private DomainType domainType;
    private LocalDateTime lastSyncedAt;
    private SyncStatus syncStatus;

    public static HostingDomainDTO fromEntity(HostingDomain domain) {
        return HostingDomainDTO.builder()
                .id(domain.getId())
                .hostingAccountId(domain.getHostingAccount().getId())
                .domainName(domain.getDomainName())
                .domainType(domain.getDomainType())
                .lastSyncedAt(domain.getLastSyncedAt())
                .syncStatus(domain.getSyncStatus())
                .build();
    }
}
