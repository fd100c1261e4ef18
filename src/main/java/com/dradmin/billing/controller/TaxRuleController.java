package com.dradmin.billing.controller;

import java.math.BigDecimal;
import java.util.List;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.billing.dto.TaxCalculationResult;
import com.dradmin.billing.dto.TaxRuleDTO;
import com.dradmin.billing.dto.VatValidationResult;
import com.dradmin.billing.service.TaxService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/tax-rules")
public class TaxRuleController {

    @Autowired
    private TaxService taxService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<TaxRuleDTO>> getAllTaxRules() {
        return ResponseEntity.ok(taxService.getAllTaxRules());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<TaxRuleDTO>> getActiveTaxRules() {
        return ResponseEntity.ok(taxService.getActiveTaxRules());
    }

    @GetMapping("/location")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<TaxRuleDTO>> getByLocation(@RequestParam String countryCode,
                                                          @RequestParam(required = false) String stateCode) {
        return ResponseEntity.ok(taxService.getTaxRulesByLocation(countryCode, stateCode));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<TaxRuleDTO> getTaxRuleById(@PathVariable Long id) {
        return ResponseEntity.ok(taxService.getTaxRuleById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<TaxRuleDTO> createTaxRule(@Valid @RequestBody TaxRuleDTO dto) {
        log.info("ADMIN {}: Creating tax rule {} for {}", SecurityUtils.currentAdmin(), dto.getTaxName(), dto.getCountryCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(taxService.createTaxRule(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<TaxRuleDTO> updateTaxRule(@PathVariable Long id, @Valid @RequestBody TaxRuleDTO dto) {
        log.info("ADMIN {}: Updating tax rule {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(taxService.updateTaxRule(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteTaxRule(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting tax rule {}", SecurityUtils.currentAdmin(), id);
        taxService.deleteTaxRule(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/calculate")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<TaxCalculationResult> calculateTax(@RequestParam Long customerId,
                                                             @RequestParam BigDecimal amount,
                                                             @RequestParam(defaultValue = "false") boolean setupFee) {
        return ResponseEntity.ok(taxService.calculateTax(customerId, amount, setupFee));
    }

    @GetMapping("/validate-vat")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<VatValidationResult> validateVat(@RequestParam String vatNumber,
                                                           @RequestParam String countryCode) {
        return ResponseEntity.ok(taxService.validateVatNumber(vatNumber, countryCode));
    }
}
