package com.dradmin.hosting.panel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mailbox as reported by the panel. A null quota means unlimited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PanelMailAccountInfo {
    private String emailAddress;
    private Long quotaMb;
    private Long usageMb;
}
