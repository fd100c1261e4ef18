package com.dradmin.email.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;

import com.dradmin.email.entity.SentEmail;

@ExtendWith(MockitoExtension.class)
class EmailQueueProcessorTest {

    @Mock
    private EmailQueueService emailQueueService;

    @Mock
    private JavaMailSender mailSender;

    @InjectMocks
    private EmailQueueProcessor processor;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(processor, "batchSize", 10);
        ReflectionTestUtils.setField(processor, "maxPerMinute", 0);
    }

    private SentEmail textEmail(Long id) {
        return SentEmail.builder()
                .id(id)
                .from("billing@example.net")
                .to("ola@example.no; kari@example.no")
                .subject("Reminder")
                .bodyText("Your invoice is due")
                .build();
    }

    @Test
    void sendsPlainTextEmailToEveryRecipient() {
        when(emailQueueService.markInProgress(1L)).thenReturn(true);
        when(emailQueueService.getEmailEntity(1L)).thenReturn(textEmail(1L));

        assertThat(processor.processOne(1L)).isTrue();

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().getTo()).containsExactly("ola@example.no", "kari@example.no");
        verify(emailQueueService).markSent(1L);
    }

    @Test
    void skipsEmailClaimedByAnotherWorker() {
        when(emailQueueService.markInProgress(2L)).thenReturn(false);

        assertThat(processor.processOne(2L)).isFalse();

        verify(emailQueueService, never()).getEmailEntity(anyLong());
        verify(mailSender, never()).send(any(SimpleMailMessage.class));
    }

    @Test
    void mailFailureIsRecordedForRetry() {
        when(emailQueueService.markInProgress(3L)).thenReturn(true);
        when(emailQueueService.getEmailEntity(3L)).thenReturn(textEmail(3L));
        doThrow(new MailSendException("SMTP down")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThat(processor.processOne(3L)).isFalse();

        verify(emailQueueService).markFailed(eq(3L), eq("SMTP down"));
        verify(emailQueueService, never()).markSent(anyLong());
    }

    @Test
    void processQueueHandlesEachDueEmail() {
        when(emailQueueService.getPendingEmailIds(10)).thenReturn(List.of(4L, 5L));
        when(emailQueueService.markInProgress(4L)).thenReturn(true);
        when(emailQueueService.markInProgress(5L)).thenReturn(false);
        when(emailQueueService.getEmailEntity(4L)).thenReturn(textEmail(4L));

        processor.processQueue();

        verify(emailQueueService).markSent(4L);
        verify(emailQueueService, never()).markSent(5L);
    }

    @Test
    void emptyQueueSendsNothing() {
        when(emailQueueService.getPendingEmailIds(10)).thenReturn(List.of());

        processor.processQueue();

        verify(emailQueueService, never()).markInProgress(anyLong());
    }

    @Test
    void unexpectedSendErrorMarksEmailFailedAndBatchContinues() {
        when(emailQueueService.getPendingEmailIds(10)).thenReturn(List.of(6L, 7L));
        when(emailQueueService.markInProgress(6L)).thenReturn(true);
        when(emailQueueService.markInProgress(7L)).thenReturn(true);
        SentEmail broken = textEmail(6L);
        broken.setTo(null);
        when(emailQueueService.getEmailEntity(6L)).thenReturn(broken);
        when(emailQueueService.getEmailEntity(7L)).thenReturn(textEmail(7L));

        processor.processQueue();

        verify(emailQueueService).markFailed(eq(6L), startsWith("NullPointerException"));
        verify(emailQueueService, never()).markSent(6L);
        verify(emailQueueService).markSent(7L);
    }
}
