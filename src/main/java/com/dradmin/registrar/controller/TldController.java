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

import com.dradmin.registrar.dto.RegistrarCostPreviewDTO;
import com.dradmin.registrar.dto.TldDTO;
import com.dradmin.registrar.service.RegistrarTldPriceSyncService;
import com.dradmin.registrar.service.TldService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/tlds")
public class TldController {

    @Autowired
    private TldService tldService;

    @Autowired
    private RegistrarTldPriceSyncService priceSyncService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<TldDTO>> getAllTlds() {
        return ResponseEntity.ok(tldService.getAllTlds());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<TldDTO>> getActiveTlds() {
        return ResponseEntity.ok(tldService.getActiveTlds());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<TldDTO> getTldById(@PathVariable Long id) {
        return ResponseEntity.ok(tldService.getTldById(id));
    }

    @GetMapping("/extension/{extension}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<TldDTO> getTldByExtension(@PathVariable String extension) {
        return ResponseEntity.ok(tldService.getTldByExtension(extension));
    }

    @GetMapping("/extension/{extension}/registrar-costs")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarCostPreviewDTO>> previewRegistrarCosts(@PathVariable String extension) {
        return ResponseEntity.ok(priceSyncService.previewRegistrarCostsByExtension(extension));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<TldDTO> createTld(@Valid @RequestBody TldDTO dto) {
        log.info("ADMIN {}: Creating TLD {}", SecurityUtils.currentAdmin(), dto.getExtension());
        return ResponseEntity.status(HttpStatus.CREATED).body(tldService.createTld(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<TldDTO> updateTld(@PathVariable Long id, @Valid @RequestBody TldDTO dto) {
        log.info("ADMIN {}: Updating TLD {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(tldService.updateTld(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteTld(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting TLD {}", SecurityUtils.currentAdmin(), id);
        tldService.deleteTld(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/sync-prices")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Integer>> syncRegistrarPrices(@PathVariable Long id) {
        log.info("ADMIN {}: Syncing registrar prices for TLD {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(Map.of("synced",
                priceSyncService.syncRegistrarsForTld(id, RegistrarTldPriceSyncService.TRIGGER_MANUAL)));
    }
}
