package com.dradmin.hosting.dto;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncComparisonDTO {
    private Long hostingAccountId;
    private boolean inSync;
    @Builder.Default
    private List<String> differences = new ArrayList<>();
    private String error;
    private LocalDateTime lastChecked;
}
