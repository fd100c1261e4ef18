package com.dradmin.email.service;

import java.util.Arrays;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.dradmin.email.entity.SentEmail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class EmailQueueProcessor {

    private static final String ADDRESS_SEPARATOR = "[,;]";

    @Autowired
    private EmailQueueService emailQueueService;

    @Autowired
    private JavaMailSender mailSender;

    @Value("${dradmin.email.batch-size:10}")
    private int batchSize;

    @Value("${dradmin.email.max-per-minute:60}")
    private int maxPerMinute;

    @Scheduled(fixedDelayString = "${dradmin.email.poll-delay-ms:30000}")
    public void processQueue() {
        List<Long> ids = emailQueueService.getPendingEmailIds(batchSize);
        if (ids.isEmpty()) {
            return;
        }
        log.debug("Processing {} queued emails", ids.size());
        long pauseMs = maxPerMinute > 0 ? 60_000L / maxPerMinute : 0;
        int sent = 0;
        for (Long id : ids) {
            if (sent > 0 && pauseMs > 0 && !pause(pauseMs)) {
                return;
            }
            if (processOne(id)) {
                sent++;
            }
        }
        log.info("Email queue run finished, {} of {} sent", sent, ids.size());
    }

    /**
     * Claims, sends and records the outcome of a single email.
     *
     * @return true when the email was sent
     */
    public boolean processOne(Long id) {
        if (!emailQueueService.markInProgress(id)) {
            log.debug("Email {} already claimed, skipping", id);
            return false;
        }
        SentEmail email = emailQueueService.getEmailEntity(id);
        try {
            send(email);
            emailQueueService.markSent(id);
            return true;
        } catch (MailException | MessagingException e) {
            emailQueueService.markFailed(id, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error sending email {}", id, e);
            emailQueueService.markFailed(id, e.getClass().getSimpleName() + ": " + e.getMessage());
            return false;
        }
    }

    private void send(SentEmail email) throws MessagingException {
        if (email.getBodyHtml() != null && !email.getBodyHtml().isBlank()) {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(email.getFrom());
            helper.setTo(split(email.getTo()));
            if (email.getCc() != null && !email.getCc().isBlank()) {
                helper.setCc(split(email.getCc()));
            }
            if (email.getBcc() != null && !email.getBcc().isBlank()) {
                helper.setBcc(split(email.getBcc()));
            }
            helper.setSubject(email.getSubject());
            if (email.getBodyText() != null) {
                helper.setText(email.getBodyText(), email.getBodyHtml());
            } else {
                helper.setText(email.getBodyHtml(), true);
            }
            message.setHeader("Message-ID", "<" + email.getMessageId() + "@dradmin>");
            mailSender.send(message);
        } else {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(email.getFrom());
            message.setTo(split(email.getTo()));
            if (email.getCc() != null && !email.getCc().isBlank()) {
                message.setCc(split(email.getCc()));
            }
            if (email.getBcc() != null && !email.getBcc().isBlank()) {
                message.setBcc(split(email.getBcc()));
            }
            message.setSubject(email.getSubject());
            message.setText(email.getBodyText());
            mailSender.send(message);
        }
    }

    private String[] split(String addresses) {
        return Arrays.stream(addresses.split(ADDRESS_SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    private boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Email queue run interrupted");
            return false;
        }
    }
}
