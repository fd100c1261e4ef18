package com.dradmin.hosting.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Disk and bandwidth usage of one account. Percentages are null when no quota is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsageDTO {
    private Long hostingAccountId;
    private Long diskUsageMb;
    private Long diskQuotaMb;
    private Double diskUsagePercent;
    private Long bandwidthUsageMb;
    private Long bandwidthLimitMb;
    private Double bandwidthUsagePercent;
}
