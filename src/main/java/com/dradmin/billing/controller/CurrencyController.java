package com.dradmin.billing.controller;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
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

import com.dradmin.billing.dto.ConversionResultDTO;
import com.dradmin.billing.dto.ExchangeRateDTO;
import com.dradmin.billing.entity.ExchangeRateDownloadLog;
import com.dradmin.billing.service.CurrencyService;
import com.dradmin.billing.service.ExchangeRateUpdateService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/currencies")
public class CurrencyController {

    @Autowired
    private CurrencyService currencyService;

    @Autowired
    private ExchangeRateUpdateService exchangeRateUpdateService;

    @GetMapping("/rates")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ExchangeRateDTO>> getAllRates() {
        return ResponseEntity.ok(currencyService.getAllRates());
    }

    @GetMapping("/rates/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ExchangeRateDTO>> getActiveRates() {
        return ResponseEntity.ok(currencyService.getActiveRates());
    }

    @GetMapping("/rates/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<ExchangeRateDTO> getRateById(@PathVariable Long id) {
        return ResponseEntity.ok(currencyService.getRateById(id));
    }

    @GetMapping("/rates/pair/{base}/{target}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ExchangeRateDTO>> getRatesForPair(@PathVariable String base, @PathVariable String target) {
        return ResponseEntity.ok(currencyService.getRatesForPair(base, target));
    }

    @GetMapping("/rate")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<ExchangeRateDTO> getExchangeRate(@RequestParam String from, @RequestParam String to,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        return ResponseEntity.ok(currencyService.getExchangeRate(from, to, at));
    }

    @GetMapping("/convert")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<ConversionResultDTO> convert(@RequestParam BigDecimal amount,
            @RequestParam String from, @RequestParam String to,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime at) {
        return ResponseEntity.ok(currencyService.convert(amount, from, to, at));
    }

    @PostMapping("/rates")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ExchangeRateDTO> createRate(@Valid @RequestBody ExchangeRateDTO dto) {
        log.info("ADMIN {}: Creating rate {}/{}", SecurityUtils.currentAdmin(), dto.getBaseCurrency(), dto.getTargetCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(currencyService.createRate(dto));
    }

    @PutMapping("/rates/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ExchangeRateDTO> updateRate(@PathVariable Long id, @Valid @RequestBody ExchangeRateDTO dto) {
        log.info("ADMIN {}: Updating rate {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(currencyService.updateRate(id, dto));
    }

    @DeleteMapping("/rates/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteRate(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting rate {}", SecurityUtils.currentAdmin(), id);
        currencyService.deleteRate(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rates/deactivate-expired")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> deactivateExpired() {
        return ResponseEntity.ok(Map.of("deactivated", currencyService.deactivateExpiredRates()));
    }

    @PostMapping("/rates/update-now")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ExchangeRateDownloadLog> updateNow() {
        log.info("ADMIN {}: Triggering exchange rate download", SecurityUtils.currentAdmin());
        return ResponseEntity.ok(exchangeRateUpdateService.updateRates());
    }

    @GetMapping("/download-logs")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ExchangeRateDownloadLog>> getDownloadLogs() {
        return ResponseEntity.ok(exchangeRateUpdateService.getRecentDownloadLogs());
    }
}
