package com.dradmin.registrar.dto;

import java.time.LocalDateTime;

import com.dradmin.registrar.entity.RegistrarTldPriceDownloadSession;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceDownloadSessionDTO {
    private Long id;
    private Long registrarId;
    private String triggerSource;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private boolean success;
    private int tldsProcessed;
    private int priceChanges;
    private String message;
    private String errorMessage;

    public static PriceDownloadSessionDTO fromEntity(RegistrarTldPriceDownloadSession session) {
        return PriceDownloadSessionDTO.builder()
                .id(session.getId())
                .registrarId(session.getRegistrar().getId())
                .triggerSource(session.getTriggerSource())
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .success(session.isSuccess())
                .tldsProcessed(session.getTldsProcessed())
                .priceChanges(session.getPriceChanges())
                .message(session.getMessage())
                .errorMessage(session.getErrorMessage())
                .build();
    }
}
