package com.dradmin.email.service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.email.dto.QueueEmailRequest;
import com.dradmin.email.dto.SentEmailDTO;
import com.dradmin.email.entity.SentEmail;
import com.dradmin.email.entity.SentEmail.EmailStatus;
import com.dradmin.email.repository.SentEmailRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Outbound mail queue. Emails are stored as {@code PENDING} and picked up by {@link EmailQueueProcessor}.
 * Failed sends are retried with an exponential delay of 2^retryCount minutes until {@code maxRetries}.
 */
@Slf4j
@Service
@Transactional
public class EmailQueueService {

    @Autowired
    private SentEmailRepository sentEmailRepository;

    @Value("${dradmin.email.from:no-reply@dradmin.local}")
    private String defaultFrom;

    public SentEmailDTO queueEmail(QueueEmailRequest request) {
        if ((request.getBodyText() == null || request.getBodyText().isBlank())
                && (request.getBodyHtml() == null || request.getBodyHtml().isBlank())) {
            throw new IllegalArgumentException("Email must have a text or HTML body");
        }
        SentEmail email = SentEmail.builder()
                .from(request.getFrom() != null && !request.getFrom().isBlank() ? request.getFrom() : defaultFrom)
                .to(request.getTo())
                .cc(request.getCc())
                .bcc(request.getBcc())
                .subject(request.getSubject())
                .bodyText(request.getBodyText())
                .bodyHtml(request.getBodyHtml())
                .status(EmailStatus.PENDING)
                .nextAttemptAt(LocalDateTime.now())
                .messageId(UUID.randomUUID().toString())
                .customerId(request.getCustomerId())
                .relatedEntityType(request.getRelatedEntityType())
                .relatedEntityId(request.getRelatedEntityId())
                .build();
        SentEmail saved = sentEmailRepository.save(email);
        log.info("Queued email {} to {}: {}", saved.getId(), saved.getTo(), saved.getSubject());
        return SentEmailDTO.fromEntity(saved);
    }

    @Transactional(readOnly = true)
    public SentEmailDTO getEmailById(Long id) {
        return SentEmailDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public SentEmail getEmailEntity(Long id) {
        return find(id);
    }

    @Transactional(readOnly = true)
    public List<SentEmailDTO> getEmails(EmailStatus status) {
        List<SentEmail> emails = status == null
                ? sentEmailRepository.findAllByOrderByCreatedAtDesc()
                : sentEmailRepository.findByStatusOrderByCreatedAtDesc(status);
        return emails.stream().map(SentEmailDTO::fromEntity).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<Long> getPendingEmailIds(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        return sentEmailRepository.findDueIds(LocalDateTime.now(), PageRequest.of(0, batchSize));
    }

    /**
     * @return false when the email is no longer pending, e.g. another worker took it
     */
    public boolean markInProgress(Long id) {
        return sentEmailRepository.claim(id, LocalDateTime.now()) == 1;
    }

    public void markSent(Long id) {
        SentEmail email = find(id);
        email.setStatus(EmailStatus.SENT);
        email.setSentAt(LocalDateTime.now());
        email.setNextAttemptAt(null);
        email.setLastError(null);
        sentEmailRepository.save(email);
        log.info("Email {} sent to {}", id, email.getTo());
    }

    public void markFailed(Long id, String error) {
        SentEmail email = find(id);
        email.setRetryCount(email.getRetryCount() + 1);
        email.setLastError(truncate(error));
        if (email.getRetryCount() >= email.getMaxRetries()) {
            email.setStatus(EmailStatus.FAILED);
            email.setNextAttemptAt(null);
            log.error("Email {} failed permanently after {} attempts: {}", id, email.getRetryCount(), error);
        } else {
            long delayMinutes = 1L << email.getRetryCount();
            email.setStatus(EmailStatus.PENDING);
            email.setNextAttemptAt(LocalDateTime.now().plusMinutes(delayMinutes));
            log.warn("Email {} failed (attempt {}), retrying in {} min: {}", id, email.getRetryCount(), delayMinutes, error);
        }
        sentEmailRepository.save(email);
    }

    public SentEmailDTO retryNow(Long id) {
        SentEmail email = find(id);
        if (email.getStatus() != EmailStatus.FAILED) {
            throw new BusinessRuleException("Only failed emails can be retried, email " + id + " is " + email.getStatus());
        }
        email.setStatus(EmailStatus.PENDING);
        email.setRetryCount(0);
        email.setNextAttemptAt(LocalDateTime.now());
        return SentEmailDTO.fromEntity(sentEmailRepository.save(email));
    }

    private String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 2000 ? error.substring(0, 2000) : error;
    }

    private SentEmail find(Long id) {
        return sentEmailRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Email", id));
    }
}
