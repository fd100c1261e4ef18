package com.dradmin.billing.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.billing.dto.PaymentMethodDTO;
import com.dradmin.billing.service.CustomerPaymentMethodService;

@RestController
@RequestMapping("/api/payment-methods")
public class PaymentMethodController {

    @Autowired
    private CustomerPaymentMethodService paymentMethodService;

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PaymentMethodDTO>> getByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(paymentMethodService.getPaymentMethodsByCustomer(customerId));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PaymentMethodDTO> getById(@PathVariable Long id) {
        return ResponseEntity.ok(paymentMethodService.getPaymentMethodById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentMethodDTO> create(@RequestBody PaymentMethodDTO request) {
        return ResponseEntity.ok(paymentMethodService.createPaymentMethod(request));
    }

    @PostMapping("/customer/{customerId}/default/{paymentMethodId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PaymentMethodDTO> setDefault(@PathVariable Long customerId, @PathVariable Long paymentMethodId) {
        return ResponseEntity.ok(paymentMethodService.setDefaultPaymentMethod(customerId, paymentMethodId));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        paymentMethodService.deletePaymentMethod(id);
        return ResponseEntity.noContent().build();
    }
}
