package com.dradmin.hosting.controller;

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

import com.dradmin.hosting.dto.HostingAccountDTO;
import com.dradmin.hosting.dto.HostingDomainDTO;
import com.dradmin.hosting.dto.HostingEmailAccountDTO;
import com.dradmin.hosting.dto.ResourceUsageDTO;
import com.dradmin.hosting.dto.SyncStatusDTO;
import com.dradmin.hosting.service.HostingDomainService;
import com.dradmin.hosting.service.HostingEmailService;
import com.dradmin.hosting.service.HostingManagerService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/hosting-accounts")
public class HostingAccountController {

    @Autowired
    private HostingManagerService hostingManagerService;

    @Autowired
    private HostingDomainService hostingDomainService;

    @Autowired
    private HostingEmailService hostingEmailService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<HostingAccountDTO>> getAllAccounts() {
        return ResponseEntity.ok(hostingManagerService.getAllAccounts());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<HostingAccountDTO> getAccountById(@PathVariable Long id) {
        return ResponseEntity.ok(hostingManagerService.getAccountById(id));
    }

    @GetMapping("/customer/{customerId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<HostingAccountDTO>> getAccountsByCustomer(@PathVariable Long customerId) {
        return ResponseEntity.ok(hostingManagerService.getAccountsByCustomer(customerId));
    }

    @GetMapping("/panel/{panelId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<HostingAccountDTO>> getAccountsByPanel(@PathVariable Long panelId) {
        return ResponseEntity.ok(hostingManagerService.getAccountsByPanel(panelId));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<HostingAccountDTO> createAccount(@Valid @RequestBody HostingAccountDTO dto,
            @RequestParam(defaultValue = "false") boolean syncToServer) {
        log.info("ADMIN {}: Creating hosting account {} (syncToServer={})", SecurityUtils.currentAdmin(),
                dto.getUsername(), syncToServer);
        return ResponseEntity.status(HttpStatus.CREATED).body(hostingManagerService.createAccount(dto, syncToServer));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<HostingAccountDTO> updateAccount(@PathVariable Long id,
            @Valid @RequestBody HostingAccountDTO dto,
            @RequestParam(defaultValue = "false") boolean syncToServer) {
        log.info("ADMIN {}: Updating hosting account {} (syncToServer={})", SecurityUtils.currentAdmin(), id,
                syncToServer);
        return ResponseEntity.ok(hostingManagerService.updateAccount(id, dto, syncToServer));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteAccount(@PathVariable Long id,
            @RequestParam(defaultValue = "false") boolean deleteFromServer) {
        log.info("ADMIN {}: Deleting hosting account {} (deleteFromServer={})", SecurityUtils.currentAdmin(), id,
                deleteFromServer);
        hostingManagerService.deleteAccount(id, deleteFromServer);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/suspend")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<HostingAccountDTO> suspendAccount(@PathVariable Long id,
            @RequestBody(required = false) Map<String, String> body) {
        String reason = body != null ? body.getOrDefault("reason", "Suspended by administrator")
                : "Suspended by administrator";
        log.info("ADMIN {}: Suspending hosting account {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(hostingManagerService.suspendAccount(id, reason));
    }

    @PostMapping("/{id}/unsuspend")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<HostingAccountDTO> unsuspendAccount(@PathVariable Long id) {
        log.info("ADMIN {}: Unsuspending hosting account {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(hostingManagerService.unsuspendAccount(id));
    }

    @GetMapping("/{id}/sync-status")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<SyncStatusDTO> getSyncStatus(@PathVariable Long id) {
        return ResponseEntity.ok(hostingManagerService.getSyncStatus(id));
    }

    @GetMapping("/{id}/resource-usage")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<ResourceUsageDTO> getResourceUsage(@PathVariable Long id) {
        return ResponseEntity.ok(hostingManagerService.getResourceUsage(id));
    }

    @GetMapping("/{id}/domains")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<HostingDomainDTO>> getDomains(@PathVariable Long id) {
        return ResponseEntity.ok(hostingDomainService.getDomainsByAccount(id));
    }

    @GetMapping("/{id}/email-accounts")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<HostingEmailAccountDTO>> getEmailAccounts(@PathVariable Long id) {
        return ResponseEntity.ok(hostingEmailService.getEmailAccountsByAccount(id));
    }
}
