package com.dradmin.controller;

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

import com.dradmin.dto.SystemSettingDTO;
import com.dradmin.security.SecurityUtils;
import com.dradmin.service.SystemSettingService;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/system-settings")
@PreAuthorize("hasRole('ADMIN')")
public class SystemSettingController {

    @Autowired
    private SystemSettingService settingService;

    @GetMapping
    public ResponseEntity<List<SystemSettingDTO>> getAll() {
        return ResponseEntity.ok(settingService.getAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SystemSettingDTO> getById(@PathVariable Long id) {
        return ResponseEntity.ok(settingService.getById(id));
    }

    @GetMapping("/key/{key}")
    public ResponseEntity<SystemSettingDTO> getByKey(@PathVariable String key) {
        return ResponseEntity.ok(settingService.getByKey(key));
    }

    @PostMapping
    public ResponseEntity<SystemSettingDTO> create(@Valid @RequestBody SystemSettingDTO dto) {
        log.info("ADMIN {}: Creating system setting {}", SecurityUtils.currentAdmin(), dto.getKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(settingService.create(dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<SystemSettingDTO> update(@PathVariable Long id, @Valid @RequestBody SystemSettingDTO dto) {
        log.info("ADMIN {}: Updating system setting {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(settingService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting system setting {}", SecurityUtils.currentAdmin(), id);
        settingService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
