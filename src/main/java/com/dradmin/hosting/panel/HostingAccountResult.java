package com.dradmin.hosting.panel;

import com.dradmin.hosting.entity.HostingAccount.AccountStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a panel call. Account fields are filled only where the call returns them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostingAccountResult {
    private boolean success;
    private String message;
    private String errorCode;

    private String accountId;
    private String username;
    private String domain;
    private String planName;
    private AccountStatus status;
    private Long diskUsageMb;
    private Long diskQuotaMb;
    private Long bandwidthUsageMb;
    private Long bandwidthLimitMb;

    public static HostingAccountResult failure(String errorCode, String message) {
        return HostingAccountResult.builder().success(false).errorCode(errorCode).message(message).build();
    }

    public static HostingAccountResult ok(String message) {
        return HostingAccountResult.builder().success(true).message(message).build();
    }
}
