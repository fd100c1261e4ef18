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
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.registrar.dto.PriceDownloadSessionDTO;
import com.dradmin.registrar.dto.RegistrarDTO;
import com.dradmin.registrar.service.RegistrarService;
import com.dradmin.registrar.service.RegistrarTldPriceSyncService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/registrars")
public class RegistrarController {

    @Autowired
    private RegistrarService registrarService;

    @Autowired
    private RegistrarTldPriceSyncService priceSyncService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarDTO>> getAllRegistrars() {
        return ResponseEntity.ok(registrarService.getAllRegistrars());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarDTO>> getActiveRegistrars() {
        return ResponseEntity.ok(registrarService.getActiveRegistrars());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<RegistrarDTO> getRegistrarById(@PathVariable Long id) {
        return ResponseEntity.ok(registrarService.getRegistrarById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegistrarDTO> createRegistrar(@Valid @RequestBody RegistrarDTO dto) {
        log.info("ADMIN {}: Creating registrar {}", SecurityUtils.currentAdmin(), dto.getCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(registrarService.createRegistrar(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegistrarDTO> updateRegistrar(@PathVariable Long id, @Valid @RequestBody RegistrarDTO dto) {
        log.info("ADMIN {}: Updating registrar {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(registrarService.updateRegistrar(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteRegistrar(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting registrar {}", SecurityUtils.currentAdmin(), id);
        registrarService.deleteRegistrar(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/sync-prices")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PriceDownloadSessionDTO> syncPrices(@PathVariable Long id) {
        log.info("ADMIN {}: Syncing TLD prices for registrar {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(priceSyncService.syncRegistrar(id, RegistrarTldPriceSyncService.TRIGGER_MANUAL));
    }

    @PostMapping("/sync-missing-today")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> syncMissingToday() {
        log.info("ADMIN {}: Syncing registrars without a price download today", SecurityUtils.currentAdmin());
        return ResponseEntity.ok(Map.of("synced",
                priceSyncService.syncRegistrarsMissingToday(RegistrarTldPriceSyncService.TRIGGER_MANUAL)));
    }

    @GetMapping("/{id}/download-sessions")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<PriceDownloadSessionDTO>> getDownloadSessions(@PathVariable Long id) {
        return ResponseEntity.ok(priceSyncService.getDownloadSessions(id));
    }
}
