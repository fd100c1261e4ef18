package com.dradmin.email.controller;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.email.dto.QueueEmailRequest;
import com.dradmin.email.dto.SentEmailDTO;
import com.dradmin.email.entity.SentEmail.EmailStatus;
import com.dradmin.email.service.EmailQueueProcessor;
import com.dradmin.email.service.EmailQueueService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/emails")
public class EmailQueueController {

    @Autowired
    private EmailQueueService emailQueueService;

    @Autowired
    private EmailQueueProcessor emailQueueProcessor;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<SentEmailDTO>> getEmails(@RequestParam(required = false) EmailStatus status) {
        return ResponseEntity.ok(emailQueueService.getEmails(status));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<SentEmailDTO> getEmailById(@PathVariable Long id) {
        return ResponseEntity.ok(emailQueueService.getEmailById(id));
    }

    @GetMapping("/pending-ids")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<Long>> getPendingIds(@RequestParam(defaultValue = "10") int batchSize) {
        return ResponseEntity.ok(emailQueueService.getPendingEmailIds(batchSize));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<SentEmailDTO> queueEmail(@Valid @RequestBody QueueEmailRequest request) {
        log.info("ADMIN {}: Queueing email to {}", SecurityUtils.currentAdmin(), request.getTo());
        return ResponseEntity.status(HttpStatus.CREATED).body(emailQueueService.queueEmail(request));
    }

    @PostMapping("/{id}/retry")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SentEmailDTO> retry(@PathVariable Long id) {
        log.info("ADMIN {}: Retrying email {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(emailQueueService.retryNow(id));
    }

    @PostMapping("/{id}/send-now")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Boolean>> sendNow(@PathVariable Long id) {
        log.info("ADMIN {}: Sending email {} immediately", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(Map.of("sent", emailQueueProcessor.processOne(id)));
    }
}
