package com.dradmin.email.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import com.dradmin.email.dto.QueueEmailRequest;
import com.dradmin.email.dto.SentEmailDTO;
import com.dradmin.email.entity.SentEmail;
import com.dradmin.email.entity.SentEmail.EmailStatus;
import com.dradmin.email.repository.SentEmailRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

@ExtendWith(MockitoExtension.class)
class EmailQueueServiceTest {

    @Mock
    private SentEmailRepository sentEmailRepository;

    @InjectMocks
    private EmailQueueService emailQueueService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(emailQueueService, "defaultFrom", "billing@example.net");
    }

    @Test
    void queueEmailUsesDefaultSenderAndIsDueImmediately() {
        when(sentEmailRepository.save(any(SentEmail.class))).thenAnswer(inv -> {
            SentEmail e = inv.getArgument(0);
            e.setId(7L);
            return e;
        });

        SentEmailDTO dto = emailQueueService.queueEmail(QueueEmailRequest.builder()
                .to("ola@example.no")
                .subject("Invoice INV-000001")
                .bodyText("Please pay")
                .build());

        ArgumentCaptor<SentEmail> captor = ArgumentCaptor.forClass(SentEmail.class);
        verify(sentEmailRepository).save(captor.capture());
        SentEmail saved = captor.getValue();
        assertThat(saved.getFrom()).isEqualTo("billing@example.net");
        assertThat(saved.getStatus()).isEqualTo(EmailStatus.PENDING);
        assertThat(saved.getNextAttemptAt()).isBeforeOrEqualTo(LocalDateTime.now());
        assertThat(saved.getMessageId()).isNotBlank();
        assertThat(dto.getId()).isEqualTo(7L);
    }

    @Test
    void queueEmailWithoutBodyIsRejected() {
        QueueEmailRequest request = QueueEmailRequest.builder().to("a@b.no").subject("Empty").bodyHtml("  ").build();

        assertThatThrownBy(() -> emailQueueService.queueEmail(request))
                .isInstanceOf(IllegalArgumentException.class);
        verify(sentEmailRepository, never()).save(any());
    }

    @Test
    void pendingIdsRequirePositiveBatch() {
        assertThatThrownBy(() -> emailQueueService.getPendingEmailIds(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pendingIdsAreLimitedToBatchSize() {
        when(sentEmailRepository.findDueIds(any(LocalDateTime.class), any(Pageable.class))).thenReturn(List.of(3L, 4L));

        assertThat(emailQueueService.getPendingEmailIds(2)).containsExactly(3L, 4L);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(sentEmailRepository).findDueIds(any(LocalDateTime.class), captor.capture());
        assertThat(captor.getValue().getPageSize()).isEqualTo(2);
    }

    @Test
    void markInProgressReportsLostClaim() {
        when(sentEmailRepository.claim(eq(5L), any(LocalDateTime.class))).thenReturn(0);

        assertThat(emailQueueService.markInProgress(5L)).isFalse();
    }

    @Test
    void firstFailureSchedulesRetryAfterTwoMinutes() {
        SentEmail email = SentEmail.builder().id(1L).to("a@b.no").status(EmailStatus.IN_PROGRESS).build();
        when(sentEmailRepository.findById(1L)).thenReturn(Optional.of(email));

        LocalDateTime before = LocalDateTime.now();
        emailQueueService.markFailed(1L, "Connection refused");

        assertThat(email.getRetryCount()).isEqualTo(1);
        assertThat(email.getStatus()).isEqualTo(EmailStatus.PENDING);
        assertThat(email.getLastError()).isEqualTo("Connection refused");
        assertThat(email.getNextAttemptAt()).isAfterOrEqualTo(before.plusMinutes(2));
        verify(sentEmailRepository).save(email);
    }

    @Test
    void lastAllowedFailureMarksEmailFailed() {
        SentEmail email = SentEmail.builder().id(1L).to("a@b.no").status(EmailStatus.IN_PROGRESS).retryCount(2).build();
        when(sentEmailRepository.findById(1L)).thenReturn(Optional.of(email));

        emailQueueService.markFailed(1L, "x".repeat(2500));

        assertThat(email.getStatus()).isEqualTo(EmailStatus.FAILED);
        assertThat(email.getNextAttemptAt()).isNull();
        assertThat(email.getLastError()).hasSize(2000);
    }

    @Test
    void markSentClearsError() {
        SentEmail email = SentEmail.builder().id(2L).to("a@b.no").status(EmailStatus.IN_PROGRESS).lastError("old").build();
        when(sentEmailRepository.findById(2L)).thenReturn(Optional.of(email));

        emailQueueService.markSent(2L);

        assertThat(email.getStatus()).isEqualTo(EmailStatus.SENT);
        assertThat(email.getSentAt()).isNotNull();
        assertThat(email.getLastError()).isNull();
    }

    @Test
    void retryNowOnlyAppliesToFailedEmails() {
        SentEmail sent = SentEmail.builder().id(3L).to("a@b.no").status(EmailStatus.SENT).build();
        when(sentEmailRepository.findById(3L)).thenReturn(Optional.of(sent));

        assertThatThrownBy(() -> emailQueueService.retryNow(3L)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void retryNowResetsFailedEmail() {
        SentEmail failed = SentEmail.builder().id(4L).to("a@b.no").status(EmailStatus.FAILED).retryCount(3).build();
        when(sentEmailRepository.findById(4L)).thenReturn(Optional.of(failed));
        when(sentEmailRepository.save(failed)).thenReturn(failed);

        SentEmailDTO dto = emailQueueService.retryNow(4L);

        assertThat(dto.getStatus()).isEqualTo(EmailStatus.PENDING);
        assertThat(failed.getRetryCount()).isZero();
    }

    @Test
    void unknownEmailIsNotFound() {
        when(sentEmailRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> emailQueueService.getEmailById(99L)).isInstanceOf(ResourceNotFoundException.class);
    }
}
