package com.dradmin.hosting.panel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostingAccountRequest {
    private String username;
    private String password;
    private String domain;
    private String contactEmail;
    private String planName;
    private Long diskQuotaMb;
    private Long bandwidthLimitMb;
    private Integer maxEmailAccounts;
    private Integer maxDatabases;
    private Integer maxFtpAccounts;
    private Integer maxSubdomains;
}
