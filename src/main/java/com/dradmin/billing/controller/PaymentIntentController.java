package com.dradmin.billing.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.billing.dto.PaymentIntentDTO;
import com.dradmin.billing.service.PaymentIntentService;

@RestController
@RequestMapping("/api/payment-intents")
public class PaymentIntentController {

    @Autowired
    private PaymentIntentService paymentIntentService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentIntentDTO>> getAll() {
        return ResponseEntity.ok(paymentIntentService.getAllPaymentIntents());
    }

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentIntentDTO>> getByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(paymentIntentService.getPaymentIntentsByCustomer(customerId));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PaymentIntentDTO> getById(@PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.getPaymentIntentById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentIntentDTO> create(@RequestBody PaymentIntentDTO request) {
        return ResponseEntity.ok(paymentIntentService.createPaymentIntent(request));
    }

    @PostMapping("/{id}/confirm")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentIntentDTO> confirm(@PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.confirmPaymentIntent(id));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentIntentDTO> cancel(@PathVariable Long id) {
        return ResponseEntity.ok(paymentIntentService.cancelPaymentIntent(id));
    }
}
