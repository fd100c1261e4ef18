package com.dradmin.billing.controller;

import java.math.BigDecimal;
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

import com.dradmin.billing.dto.CreditAmountRequest;
import com.dradmin.billing.dto.CreditTransactionDTO;
import com.dradmin.billing.dto.CreditTransactionRequest;
import com.dradmin.billing.dto.CustomerCreditDTO;
import com.dradmin.billing.service.CreditService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/credits")
public class CreditController {

    @Autowired
    private CreditService creditService;

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<CustomerCreditDTO> getCustomerCredit(@PathVariable Long customerId) {
        return ResponseEntity.ok(creditService.getCustomerCredit(customerId));
    }

    @GetMapping("/customer/{customerId}/transactions")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<CreditTransactionDTO>> getTransactions(@PathVariable Long customerId) {
        return ResponseEntity.ok(creditService.getTransactions(customerId));
    }

    @GetMapping("/customer/{customerId}/sufficient")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<Map<String, Boolean>> hasSufficientCredit(@PathVariable Long customerId,
                                                                    @RequestParam BigDecimal amount) {
        return ResponseEntity.ok(Map.of("sufficient", creditService.hasSufficientCredit(customerId, amount)));
    }

    @PostMapping("/transactions")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<CreditTransactionDTO> createTransaction(@Valid @RequestBody CreditTransactionRequest request) {
        log.info("ADMIN {}: Recording {} of {} for customer {}", SecurityUtils.currentAdmin(),
                request.getType(), request.getAmount(), request.getCustomerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(creditService.createTransaction(request));
    }

    @PostMapping("/customer/{customerId}/add")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<CreditTransactionDTO> addCredit(@PathVariable Long customerId,
                                                          @Valid @RequestBody CreditAmountRequest request) {
        log.info("ADMIN {}: Adding credit {} for customer {}", SecurityUtils.currentAdmin(), request.getAmount(), customerId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(creditService.addCredit(customerId, request.getAmount(), request.getDescription()));
    }

    @PostMapping("/customer/{customerId}/deduct")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<CreditTransactionDTO> deductCredit(@PathVariable Long customerId,
                                                             @Valid @RequestBody CreditAmountRequest request) {
        log.info("ADMIN {}: Deducting credit {} for customer {}", SecurityUtils.currentAdmin(), request.getAmount(), customerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(creditService.deductCredit(customerId,
                request.getAmount(), request.getInvoiceId(), request.getDescription()));
    }
}
