package com.dradmin.billing.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.billing.dto.ManualPaymentRequest;
import com.dradmin.billing.dto.PaymentStatisticsDTO;
import com.dradmin.billing.dto.PaymentTransactionDTO;
import com.dradmin.billing.entity.PaymentTransaction.PaymentStatus;
import com.dradmin.billing.service.PaymentService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;

/**
 * Invoice payments. Everything except the gateway webhook requires an admin session.
 */
@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    @Autowired
    private PaymentService paymentService;

    @PostMapping("/invoices/{invoiceId}/checkout")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentTransactionDTO> createCheckout(@PathVariable Long invoiceId) {
        logger.info("ADMIN {}: Creating checkout session for invoice {}", SecurityUtils.currentAdmin(), invoiceId);
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentService.processInvoicePayment(invoiceId));
    }

    @PostMapping("/invoices/{invoiceId}/manual")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentTransactionDTO> recordManualPayment(@PathVariable Long invoiceId,
                                                                     @Valid @RequestBody ManualPaymentRequest request) {
        logger.info("ADMIN {}: Recording manual payment of {} on invoice {}", SecurityUtils.currentAdmin(),
                request.getAmount(), invoiceId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(paymentService.recordManualPayment(invoiceId, request.getAmount(), request.getReference()));
    }

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> handleWebhook(@RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("Missing Stripe-Signature header");
        }
        return ResponseEntity.ok(paymentService.handleWebhook(payload, signature));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentTransactionDTO>> getAll() {
        return ResponseEntity.ok(paymentService.getAllTransactions());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PaymentTransactionDTO> getById(@PathVariable Long id) {
        return ResponseEntity.ok(paymentService.getTransactionById(id));
    }

    @GetMapping("/session/{sessionId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PaymentTransactionDTO> getBySession(@PathVariable String sessionId) {
        return ResponseEntity.ok(paymentService.getBySessionId(sessionId));
    }

    @GetMapping("/invoice/{invoiceId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentTransactionDTO>> getByInvoice(@PathVariable Long invoiceId) {
        return ResponseEntity.ok(paymentService.getByInvoice(invoiceId));
    }

    @GetMapping("/customer/{email}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentTransactionDTO>> getByCustomer(@PathVariable String email) {
        return ResponseEntity.ok(paymentService.getByCustomerEmail(email));
    }

    @GetMapping("/status/{status}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentTransactionDTO>> getByStatus(@PathVariable PaymentStatus status) {
        return ResponseEntity.ok(paymentService.getByStatus(status));
    }

    @GetMapping("/expired")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentTransactionDTO>> getExpired() {
        return ResponseEntity.ok(paymentService.getExpiredPending());
    }

    @PostMapping("/expire-stale")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> expireStale() {
        logger.info("ADMIN {}: Expiring stale checkout sessions", SecurityUtils.currentAdmin());
        return ResponseEntity.ok(Map.of("expired", paymentService.markExpiredSessions()));
    }

    @GetMapping("/statistics")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PaymentStatisticsDTO> getStatistics() {
        return ResponseEntity.ok(paymentService.getStatistics());
    }
}
