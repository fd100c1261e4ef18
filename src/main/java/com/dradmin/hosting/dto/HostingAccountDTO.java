package com.dradmin.hosting.dto;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.HostingAccount;
import com.dradmin.hosting.entity.HostingAccount.AccountStatus;
import com.dradmin.hosting.entity.HostingAccount.SyncStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class HostingAccountDTO {
    private Long id;

    @NotNull
    private Long customerId;
    private String customerName;

    private Long controlPanelId;
    private String controlPanelName;

    @Size(max = 100)
    private String externalAccountId;

    @NotBlank
    @Pattern(regexp = "^[a-z][a-z0-9]{0,15}$", message = "username must be lower-case alphanumeric, starting with a letter")
    private String username;

    // used only when the account is created on the panel
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @Size(max = 253)
    private String primaryDomain;

    @Size(max = 100)
    private String planName;

    private AccountStatus status;

    @Min(0)
    private Long diskUsageMb;
    @Min(0)
    private Long diskQuotaMb;
    @Min(0)
    private Long bandwidthUsageMb;
    @Min(0)
    private Long bandwidthLimitMb;

    @Min(0)
    private Integer maxEmailAccounts;
    @Min(0)
    private Integer maxDatabases;
    @Min(0)
    private Integer maxFtpAccounts;
    @Min(0)
    private Integer maxSubdomains;

    private LocalDateTime lastSyncedAt;
    private SyncStatus syncStatus;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static HostingAccountDTO fromEntity(HostingAccount account) {
        HostingAccountDTOBuilder builder = HostingAccountDTO.builder()
                .id(account.getId())
                .customerId(account.getCustomer().getId())
                .customerName(account.getCustomer().getName())
                .externalAccountId(account.getExternalAccountId())
                .username(account.getUsername())
                .primaryDomain(account.getPrimaryDomain())
                .planName(account.getPlanName())
                .status(account.getStatus())
                .diskUsageMb(account.getDiskUsageMb())
                .diskQuotaMb(account.getDiskQuotaMb())
                .bandwidthUsageMb(account.getBandwidthUsageMb())
                .bandwidthLimitMb(account.getBandwidthLimitMb())
                .maxEmailAccounts(account.getMaxEmailAccounts())
                .maxDatabases(account.getMaxDatabases())
                .maxFtpAccounts(account.getMaxFtpAccounts())
                .maxSubdomains(account.getMaxSubdomains())
                .lastSyncedAt(account.getLastSyncedAt())
                .syncStatus(account.getSyncStatus())
                .createdAt(account.getCreatedAt())
                .updatedAt(account.getUpdatedAt());
        if (account.getControlPanel() != null) {
            builder.controlPanelId(account.getControlPanel().getId())
                    .controlPanelName(account.getControlPanel().getName());
        }
        return builder.build();
    }
}
