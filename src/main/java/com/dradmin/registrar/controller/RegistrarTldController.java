package com.dradmin.registrar.controller;

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
import org.springframework.web.bind.annotation.RestController;

import com.dradmin.registrar.dto.RegistrarTldDTO;
import com.dradmin.registrar.service.RegistrarTldService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/registrar-tlds")
public class RegistrarTldController {

    @Autowired
    private RegistrarTldService registrarTldService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarTldDTO>> getAll() {
        return ResponseEntity.ok(registrarTldService.getAllRegistrarTlds());
    }

    @GetMapping("/registrar/{registrarId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarTldDTO>> getByRegistrar(@PathVariable Long registrarId) {
        return ResponseEntity.ok(registrarTldService.getByRegistrar(registrarId));
    }

    @GetMapping("/tld/{tldId}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<RegistrarTldDTO>> getByTld(@PathVariable Long tldId) {
        return ResponseEntity.ok(registrarTldService.getByTld(tldId));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<RegistrarTldDTO> getById(@PathVariable Long id) {
        return ResponseEntity.ok(registrarTldService.getRegistrarTldById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegistrarTldDTO> create(@Valid @RequestBody RegistrarTldDTO dto) {
        log.info("ADMIN {}: Linking registrar {} to TLD {}", SecurityUtils.currentAdmin(), dto.getRegistrarId(), dto.getTldId());
        return ResponseEntity.status(HttpStatus.CREATED).body(registrarTldService.createRegistrarTld(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RegistrarTldDTO> update(@PathVariable Long id, @Valid @RequestBody RegistrarTldDTO dto) {
        log.info("ADMIN {}: Updating registrar TLD {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(registrarTldService.updateRegistrarTld(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting registrar TLD {}", SecurityUtils.currentAdmin(), id);
        registrarTldService.deleteRegistrarTld(id);
        return ResponseEntity.noContent().build();
    }
}
