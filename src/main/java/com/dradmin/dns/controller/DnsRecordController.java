package com.dradmin.dns.controller;

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

import com.dradmin.dns.dto.DnsRecordDTO;
import com.dradmin.dns.service.DnsRecordService;
import com.dradmin.dto.PagedResult;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/dns-records")
public class DnsRecordController {

    @Autowired
    private DnsRecordService recordService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordDTO>> getAllRecords() {
        return ResponseEntity.ok(recordService.getAllRecords());
    }

    @GetMapping("/paged")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<PagedResult<DnsRecordDTO>> getRecordsPaged(@RequestParam(defaultValue = "1") int page,
                                                                     @RequestParam(defaultValue = "25") int pageSize) {
        return ResponseEntity.ok(recordService.getRecordsPaged(page, pageSize));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordDTO> getRecordById(@PathVariable Long id) {
        return ResponseEntity.ok(recordService.getRecordById(id));
    }

    @GetMapping("/domain/{domainId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordDTO>> getRecordsByDomain(@PathVariable Long domainId) {
        return ResponseEntity.ok(recordService.getRecordsByDomain(domainId));
    }

    @GetMapping("/domain/{domainId}/pending-sync")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordDTO>> getPendingSync(@PathVariable Long domainId) {
        return ResponseEntity.ok(recordService.getPendingSyncRecords(domainId));
    }

    @GetMapping("/domain/{domainId}/deleted")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordDTO>> getDeleted(@PathVariable Long domainId) {
        return ResponseEntity.ok(recordService.getDeletedRecords(domainId));
    }

    @GetMapping("/type/{type}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordDTO>> getRecordsByType(@PathVariable String type) {
        return ResponseEntity.ok(recordService.getRecordsByType(type));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordDTO> createRecord(@Valid @RequestBody DnsRecordDTO dto) {
        log.info("ADMIN {}: Creating {} record on domain {}", SecurityUtils.currentAdmin(), dto.getType(), dto.getDomainId());
        return ResponseEntity.status(HttpStatus.CREATED).body(recordService.createRecord(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordDTO> updateRecord(@PathVariable Long id, @Valid @RequestBody DnsRecordDTO dto) {
        log.info("ADMIN {}: Updating DNS record {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(recordService.updateRecord(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordDTO> softDeleteRecord(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting DNS record {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(recordService.softDeleteRecord(id));
    }

    @DeleteMapping("/{id}/hard")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> hardDeleteRecord(@PathVariable Long id) {
        log.info("ADMIN {}: Purging DNS record {}", SecurityUtils.currentAdmin(), id);
        recordService.hardDeleteRecord(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/restore")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordDTO> restoreRecord(@PathVariable Long id) {
        log.info("ADMIN {}: Restoring DNS record {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(recordService.restoreRecord(id));
    }

    @PostMapping("/{id}/mark-synced")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsRecordDTO> markSynced(@PathVariable Long id) {
        return ResponseEntity.ok(recordService.markSynced(id));
    }
}
