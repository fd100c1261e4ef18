package com.dradmin.email.dto;

import java.time.LocalDateTime;

import com.dradmin.email.entity.SentEmail;
import com.dradmin.email.entity.SentEmail.EmailStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentEmailDTO {
    private Long id;
    private String from;
    private String to;
    private String cc;
    private String bcc;
    private String subject;
    private String bodyText;
    private String bodyHtml;
    private EmailStatus status;
    private int retryCount;
    private int maxRetries;
    private LocalDateTime nextAttemptAt;
    private String lastError;
    private String messageId;
    private LocalDateTime sentAt;
    private Long customerId;
    private String relatedEntityType;
    private Long relatedEntityId;
    private LocalDateTime createdAt;

    public static SentEmailDTO fromEntity(SentEmail email) {
        return SentEmailDTO.builder()
                .id(email.getId())
                .from(email.getFrom())
                .to(email.getTo())
                .cc(email.getCc())
                .bcc(email.getBcc())
                .subject(email.getSubject())
                .bodyText(email.getBodyText())
                .bodyHtml(email.getBodyHtml())
                .status(email.getStatus())
                .retryCount(email.getRetryCount())
                .maxRetries(email.getMaxRetries())
                .nextAttemptAt(email.getNextAttemptAt())
                .lastError(email.getLastError())
                .messageId(email.getMessageId())
                .sentAt(email.getSentAt())
                .customerId(email.getCustomerId())
                .relatedEntityType(email.getRelatedEntityType())
                .relatedEntityId(email.getRelatedEntityId())
                .createdAt(email.getCreatedAt())
                .build();
    }
}
