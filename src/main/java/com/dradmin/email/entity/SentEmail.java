package com.dradmin.email.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "sent_emails", indexes = @Index(name = "idx_sent_emails_status_next", columnList = "status,nextAttemptAt"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SentEmail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_address", nullable = false)
    private String from;

    @Column(name = "to_address", nullable = false, length = 1000)
    private String to;

    @Column(length = 1000)
    private String cc;

    @Column(length = 1000)
    private String bcc;

    @Column(nullable = false, length = 500)
    private String subject;

    @Lob
    private String bodyText;

    @Lob
    private String bodyHtml;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EmailStatus status = EmailStatus.PENDING;

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private int maxRetries = 3;

    private LocalDateTime nextAttemptAt;

    @Column(length = 2000)
    private String lastError;

    @Column(unique = true, length = 64)
    private String messageId;

    private LocalDateTime sentAt;

    private Long customerId;

    @Column(length = 50)
    private String relatedEntityType;

    private Long relatedEntityId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum EmailStatus {
        PENDING, IN_PROGRESS, SENT, FAILED
    }
}
