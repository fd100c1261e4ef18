package com.dradmin.billing.controller;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.billing.dto.InvoiceDTO;
import com.dradmin.billing.dto.QuoteDTO;
import com.dradmin.billing.dto.QuoteLineDTO;
import com.dradmin.billing.dto.QuoteRequestDTO;
import com.dradmin.billing.service.QuoteService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

/**
 * Quote management. The {@code /public/{token}} endpoints are reachable without a session so the
 * customer can answer a quote from the link in the quote email.
 */
@Slf4j
@RestController
@RequestMapping("/api/quotes")
public class QuoteController {

    @Autowired
    private QuoteService quoteService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<QuoteDTO>> getAllQuotes() {
        return ResponseEntity.ok(quoteService.getAllQuotes());
    }

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<QuoteDTO>> getQuotesByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(quoteService.getQuotesByCustomer(customerId));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<QuoteDTO> getQuoteById(@PathVariable Long id) {
        return ResponseEntity.ok(quoteService.getQuoteById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> createQuote(@Valid @RequestBody QuoteRequestDTO request) {
        log.info("ADMIN {}: Creating quote for customer {}", SecurityUtils.currentAdmin(), request.getCustomerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(quoteService.createQuote(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> updateQuote(@PathVariable Long id, @Valid @RequestBody QuoteRequestDTO request) {
        log.info("ADMIN {}: Updating quote {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(quoteService.updateQuote(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteQuote(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting quote {}", SecurityUtils.currentAdmin(), id);
        quoteService.deleteQuote(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/lines")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> addLine(@PathVariable Long id, @Valid @RequestBody QuoteLineDTO line) {
        return ResponseEntity.ok(quoteService.addLine(id, line));
    }

    @DeleteMapping("/{id}/lines/{lineId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> removeLine(@PathVariable Long id, @PathVariable Long lineId) {
        return ResponseEntity.ok(quoteService.removeLine(id, lineId));
    }

    @PostMapping("/{id}/coupon/{code}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> applyCoupon(@PathVariable Long id, @PathVariable String code) {
        log.info("ADMIN {}: Applying coupon {} to quote {}", SecurityUtils.currentAdmin(), code, id);
        return ResponseEntity.ok(quoteService.applyCoupon(id, code));
    }

    @PostMapping("/{id}/send")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<QuoteDTO> sendQuote(@PathVariable Long id) {
        log.info("ADMIN {}: Sending quote {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(quoteService.sendQuote(id));
    }

    @PostMapping("/{id}/convert")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> convertToInvoice(@PathVariable Long id) {
        log.info("ADMIN {}: Converting quote {} to invoice", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(quoteService.convertToInvoice(id));
    }

    @PostMapping("/expire")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> expireQuotes() {
        return ResponseEntity.ok(Map.of("expired", quoteService.expireOutdatedQuotes()));
    }

    @PostMapping("/public/{token}/accept")
    public ResponseEntity<QuoteDTO> acceptQuote(@PathVariable String token) {
        log.info("Quote accepted through public link");
        return ResponseEntity.ok(quoteService.acceptQuote(token));
    }

    @PostMapping("/public/{token}/reject")
    public ResponseEntity<QuoteDTO> rejectQuote(@PathVariable String token,
                                                @RequestBody(required = false) Map<String, String> body) {
        String reason = body != null ? body.get("reason") : null;
        log.info("Quote rejected through public link");
        return ResponseEntity.ok(quoteService.rejectQuote(token, reason));
    }
}
