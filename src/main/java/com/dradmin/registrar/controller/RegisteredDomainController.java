package com.dradmin.registrar.controller;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.registrar.dto.RegisteredDomainDTO;
import com.dradmin.registrar.service.DomainExpirationMonitor;
import com.dradmin.registrar.service.RegisteredDomainService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/domains")
public class RegisteredDomainController {

    @Autowired
    private RegisteredDomainService domainService;

    @Autowired
    private DomainExpirationMonitor expirationMonitor;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegisteredDomainDTO>> getAllDomains() {
        return ResponseEntity.ok(domainService.getAllDomains());
    }

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegisteredDomainDTO>> getDomainsByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(domainService.getDomainsByCustomer(customerId));
    }

    @GetMapping("/expiring")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegisteredDomainDTO>> getExpiringDomains(@RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(domainService.getDomainsExpiringWithin(days));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<RegisteredDomainDTO> getDomainById(@PathVariable Long id) {
        return ResponseEntity.ok(domainService.getDomainById(id));
    }

    @GetMapping("/name/{name}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<RegisteredDomainDTO> getDomainByName(@PathVariable String name) {
        return ResponseEntity.ok(domainService.getDomainByName(name));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegisteredDomainDTO> createDomain(@Valid @RequestBody RegisteredDomainDTO dto) {
        log.info("ADMIN {}: Creating domain {}", SecurityUtils.currentAdmin(), dto.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(domainService.createDomain(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegisteredDomainDTO> updateDomain(@PathVariable Long id, @Valid @RequestBody RegisteredDomainDTO dto) {
        log.info("ADMIN {}: Updating domain {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(domainService.updateDomain(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteDomain(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting domain {}", SecurityUtils.currentAdmin(), id);
        domainService.deleteDomain(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/check-expirations")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> checkExpirations() {
        log.info("ADMIN {}: Running domain expiration check", SecurityUtils.currentAdmin());
        int reminders = expirationMonitor.queueExpiryReminders();
        int expired = expirationMonitor.markExpiredDomains();
        return ResponseEntity.ok(Map.of("remindersQueued", reminders, "expired", expired));
    }
}
