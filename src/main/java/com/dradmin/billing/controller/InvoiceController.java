package com.dradmin.billing.controller;

import java.math.BigDecimal;
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
import com.dradmin.billing.dto.InvoiceLineDTO;
import com.dradmin.billing.dto.InvoiceRequestDTO;
import com.dradmin.billing.entity.Invoice.InvoiceStatus;
import com.dradmin.billing.service.InvoiceService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    @Autowired
    private InvoiceService invoiceService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<InvoiceDTO>> getAllInvoices() {
        return ResponseEntity.ok(invoiceService.getAllInvoices());
    }

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<InvoiceDTO>> getInvoicesByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(invoiceService.getInvoicesByCustomer(customerId));
    }

    @GetMapping("/status/{status}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<InvoiceDTO>> getInvoicesByStatus(@PathVariable InvoiceStatus status) {
        return ResponseEntity.ok(invoiceService.getInvoicesByStatus(status));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<InvoiceDTO> getInvoiceById(@PathVariable Long id) {
        return ResponseEntity.ok(invoiceService.getInvoiceById(id));
    }

    @GetMapping("/{id}/amount-due")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<Map<String, BigDecimal>> getAmountDue(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("amountDue", invoiceService.getAmountDue(id)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> createInvoice(@Valid @RequestBody InvoiceRequestDTO request) {
        log.info("ADMIN {}: Creating invoice for customer {}", SecurityUtils.currentAdmin(), request.getCustomerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.createInvoice(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> updateInvoice(@PathVariable Long id, @Valid @RequestBody InvoiceRequestDTO request) {
        log.info("ADMIN {}: Updating invoice {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(invoiceService.updateInvoice(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteInvoice(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting invoice {}", SecurityUtils.currentAdmin(), id);
        invoiceService.deleteInvoice(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/lines")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> addLine(@PathVariable Long id, @Valid @RequestBody InvoiceLineDTO line) {
        return ResponseEntity.ok(invoiceService.addLine(id, line));
    }

    @PutMapping("/{id}/lines/{lineId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> updateLine(@PathVariable Long id, @PathVariable Long lineId,
                                                 @Valid @RequestBody InvoiceLineDTO line) {
        return ResponseEntity.ok(invoiceService.updateLine(id, lineId, line));
    }

    @DeleteMapping("/{id}/lines/{lineId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> removeLine(@PathVariable Long id, @PathVariable Long lineId) {
        return ResponseEntity.ok(invoiceService.removeLine(id, lineId));
    }

    @PostMapping("/{id}/issue")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> issueInvoice(@PathVariable Long id) {
        log.info("ADMIN {}: Issuing invoice {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(invoiceService.issueInvoice(id));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvoiceDTO> cancelInvoice(@PathVariable Long id) {
        log.info("ADMIN {}: Cancelling invoice {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(invoiceService.cancelInvoice(id));
    }

    @PostMapping("/mark-overdue")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> markOverdue() {
        log.info("ADMIN {}: Running overdue invoice check", SecurityUtils.currentAdmin());
        return ResponseEntity.ok(Map.of("updated", invoiceService.markOverdueInvoices()));
    }
}
