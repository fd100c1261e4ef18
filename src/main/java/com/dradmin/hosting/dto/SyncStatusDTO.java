package com.dradmin.hosting.dto;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.HostingAccount.SyncStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatusDTO {
    private Long hostingAccountId;
    private SyncStatus syncStatus;
    private String externalAccountId;
    private LocalDateTime lastSyncedAt;
}
