package com.dradmin.dns.controller;

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

import com.dradmin.dns.dto.DnsRecordTypeDTO;
import com.dradmin.dns.service.DnsRecordTypeService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/dns-record-types")
public class DnsRecordTypeController {

    @Autowired
    private DnsRecordTypeService recordTypeService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordTypeDTO>> getAllRecordTypes() {
        return ResponseEntity.ok(recordTypeService.getAllRecordTypes());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsRecordTypeDTO>> getActiveRecordTypes() {
        return ResponseEntity.ok(recordTypeService.getActiveRecordTypes());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordTypeDTO> getRecordTypeById(@PathVariable Long id) {
        return ResponseEntity.ok(recordTypeService.getRecordTypeById(id));
    }

    @GetMapping("/type/{type}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsRecordTypeDTO> getRecordTypeByType(@PathVariable String type) {
        return ResponseEntity.ok(recordTypeService.getRecordTypeByType(type));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsRecordTypeDTO> createRecordType(@Valid @RequestBody DnsRecordTypeDTO dto) {
        log.info("ADMIN {}: Creating DNS record type {}", SecurityUtils.currentAdmin(), dto.getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(recordTypeService.createRecordType(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsRecordTypeDTO> updateRecordType(@PathVariable Long id, @Valid @RequestBody DnsRecordTypeDTO dto) {
        log.info("ADMIN {}: Updating DNS record type {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(recordTypeService.updateRecordType(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteRecordType(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting DNS record type {}", SecurityUtils.currentAdmin(), id);
        recordTypeService.deleteRecordType(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/seed")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> seedDefaults() {
        log.info("ADMIN {}: Seeding standard DNS record types", SecurityUtils.currentAdmin());
        return ResponseEntity.ok(Map.of("created", recordTypeService.seedDefaults()));
    }
}
