package com.dradmin.hosting.dto;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.entity.ServerControlPanel.PanelType;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerControlPanelDTO {
    private Long id;

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private PanelType panelType;

    @NotBlank
    @Size(max = 500)
    private String apiUrl;

    @Builder.Default
    @Min(1)
    @Max(65535)
    private int port = 2087;

    @Builder.Default
    private boolean useHttps = true;

    @Size(max = 100)
    private String username;

    // never echoed back
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String apiToken;

    @Builder.Default
    private boolean active = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ServerControlPanelDTO fromEntity(ServerControlPanel panel) {
        return ServerControlPanelDTO.builder()
                .id(panel.getId())
                .name(panel.getName())
                .panelType(panel.getPanelType())
                .apiUrl(panel.getApiUrl())
                .port(panel.getPort())
                .useHttps(panel.isUseHttps())
                .username(panel.getUsername())
                .active(panel.isActive())
                .createdAt(panel.getCreatedAt())
                .updatedAt(panel.getUpdatedAt())
                .build();
    }
}
