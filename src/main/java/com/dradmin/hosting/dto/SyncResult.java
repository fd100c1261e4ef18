package com.dradmin.hosting.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {
    private boolean success;
    private String message;
    private int recordsSynced;

    public static SyncResult failed(String message) {
        return new SyncResult(false, message, 0);
    }

    public static SyncResult ok(String message, int recordsSynced) {
        return new SyncResult(true, message, recordsSynced);
    }
}
