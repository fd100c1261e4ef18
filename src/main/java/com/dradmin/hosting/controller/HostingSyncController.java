package com.dradmin.hosting.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.hosting.dto.SyncComparisonDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.service.HostingDomainService;
import com.dradmin.hosting.service.HostingEmailService;
import com.dradmin.hosting.service.HostingManagerService;
import com.dradmin.security.SecurityUtils;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/hosting-sync")
public class HostingSyncController {

    @Autowired
    private HostingManagerService hostingManagerService;

    @Autowired
    private HostingDomainService hostingDomainService;

    @Autowired
    private HostingEmailService hostingEmailService;

    @PostMapping("/panels/{panelId}/accounts/{externalAccountId}/import")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> syncAccountFromServer(@PathVariable Long panelId,
            @PathVariable String externalAccountId) {
        log.info("ADMIN {}: Syncing account {} from control panel {}", SecurityUtils.currentAdmin(), externalAccountId,
                panelId);
        return ResponseEntity.ok(hostingManagerService.syncAccountFromServer(panelId, externalAccountId));
    }

    @PostMapping("/panels/{panelId}/import-all")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> syncAllFromServer(@PathVariable Long panelId) {
        log.info("ADMIN {}: Syncing all accounts from control panel {}", SecurityUtils.currentAdmin(), panelId);
        return ResponseEntity.ok(hostingManagerService.syncAllAccountsFromServer(panelId));
    }

    @PostMapping("/accounts/{id}/push")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> syncAccountToServer(@PathVariable Long id) {
        log.info("ADMIN {}: Pushing hosting account {} to its control panel", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(hostingManagerService.syncAccountToServer(id));
    }

    @GetMapping("/accounts/{id}/compare")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<SyncComparisonDTO> compare(@PathVariable Long id) {
        return ResponseEntity.ok(hostingManagerService.compareWithServer(id));
    }

    @PostMapping("/accounts/{id}/domains/import")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> syncDomainsFromServer(@PathVariable Long id) {
        log.info("ADMIN {}: Syncing domains of hosting account {} from its control panel",
                SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(hostingDomainService.syncDomainsFromServer(id));
    }

    @PostMapping("/accounts/{id}/email-accounts/import")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> syncEmailAccountsFromServer(@PathVariable Long id) {
        log.info("ADMIN {}: Syncing email accounts of hosting account {} from its control panel",
                SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(hostingEmailService.syncEmailAccountsFromServer(id));
    }
}
