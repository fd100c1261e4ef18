package com.dradmin.hosting.dto;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.dradmin.hosting.entity.HostingEmailAccount;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostingEmailAccountDTO {
    private Long id;
    private Long hostingAccountId;
    private String emailAddress;
    private String username;
    private Long quotaMb;
    private Long usageMb;
    private LocalDateTime lastSyncedAt;
    private SyncStatus syncStatus;

    public static HostingEmailAccountDTO fromEntity(HostingEmailAccount account) {
        return HostingEmailAccountDTO.builder()
                .id(account.getId())
                .hostingAccountId(account.getHostingAccount().getId())
                .emailAddress(account.getEmailAddress())
                .username(account.getUsername())
                .quotaMb(account.getQuotaMb())
                .usageMb(account.getUsageMb())
                .lastSyncedAt(account.getLastSyncedAt())
                .syncStatus(account.getSyncStatus())
                .build();
    }
}
