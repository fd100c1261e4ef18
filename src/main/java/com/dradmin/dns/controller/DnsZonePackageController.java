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

import com.dradmin.dns.dto.DnsZonePackageDTO;
import com.dradmin.dns.dto.DnsZonePackageRecordDTO;
import com.dradmin.dns.service.DnsZonePackageService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/dns-zone-packages")
public class DnsZonePackageController {

    @Autowired
    private DnsZonePackageService packageService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsZonePackageDTO>> getAllPackages() {
        return ResponseEntity.ok(packageService.getAllPackages());
    }

    @GetMapping("/with-records")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsZonePackageDTO>> getAllPackagesWithRecords() {
        return ResponseEntity.ok(packageService.getAllPackagesWithRecords());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<DnsZonePackageDTO>> getActivePackages() {
        return ResponseEntity.ok(packageService.getActivePackages());
    }

    @GetMapping("/default")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsZonePackageDTO> getDefaultPackage() {
        return ResponseEntity.ok(packageService.getDefaultPackage());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<DnsZonePackageDTO> getPackageById(@PathVariable Long id) {
        return ResponseEntity.ok(packageService.getPackageById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsZonePackageDTO> createPackage(@Valid @RequestBody DnsZonePackageDTO dto) {
        log.info("ADMIN {}: Creating DNS zone package {}", SecurityUtils.currentAdmin(), dto.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(packageService.createPackage(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsZonePackageDTO> updatePackage(@PathVariable Long id, @Valid @RequestBody DnsZonePackageDTO dto) {
        log.info("ADMIN {}: Updating DNS zone package {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(packageService.updatePackage(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deletePackage(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting DNS zone package {}", SecurityUtils.currentAdmin(), id);
        packageService.deletePackage(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/default")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsZonePackageDTO> setDefault(@PathVariable Long id) {
        log.info("ADMIN {}: Setting DNS zone package {} as default", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(packageService.setDefaultPackage(id));
    }

    @PostMapping("/{id}/records")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsZonePackageDTO> addRecord(@PathVariable Long id, @Valid @RequestBody DnsZonePackageRecordDTO dto) {
        return ResponseEntity.ok(packageService.addRecord(id, dto));
    }

    @DeleteMapping("/{id}/records/{recordId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DnsZonePackageDTO> removeRecord(@PathVariable Long id, @PathVariable Long recordId) {
        return ResponseEntity.ok(packageService.removeRecord(id, recordId));
    }

    @PostMapping("/{id}/apply/{domainId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<Map<String, Integer>> applyToDomain(@PathVariable Long id, @PathVariable Long domainId) {
        log.info("ADMIN {}: Applying DNS zone package {} to domain {}", SecurityUtils.currentAdmin(), id, domainId);
        return ResponseEntity.ok(Map.of("recordsCreated", packageService.applyPackageToDomain(id, domainId)));
    }
}
