package com.dradmin.hosting.controller;

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

import com.dradmin.hosting.dto.ServerControlPanelDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.service.ServerControlPanelService;
import com.dradmin.security.SecurityUtils;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/server-control-panels")
public class ServerControlPanelController {

    @Autowired
    private ServerControlPanelService panelService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ServerControlPanelDTO>> getAllPanels() {
        return ResponseEntity.ok(panelService.getAllPanels());
    }

    @GetMapping("/active")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<List<ServerControlPanelDTO>> getActivePanels() {
        return ResponseEntity.ok(panelService.getActivePanels());
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN','SUPPORT')")
    public ResponseEntity<ServerControlPanelDTO> getPanelById(@PathVariable Long id) {
        return ResponseEntity.ok(panelService.getPanelById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ServerControlPanelDTO> createPanel(@Valid @RequestBody ServerControlPanelDTO dto) {
        log.info("ADMIN {}: Creating control panel {}", SecurityUtils.currentAdmin(), dto.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(panelService.createPanel(dto));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ServerControlPanelDTO> updatePanel(@PathVariable Long id,
            @Valid @RequestBody ServerControlPanelDTO dto) {
        log.info("ADMIN {}: Updating control panel {}", SecurityUtils.currentAdmin(), id);
        return ResponseEntity.ok(panelService.updatePanel(id, dto));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deletePanel(@PathVariable Long id) {
        log.info("ADMIN {}: Deleting control panel {}", SecurityUtils.currentAdmin(), id);
        panelService.deletePanel(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/test-connection")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<SyncResult> testConnection(@PathVariable Long id) {
        return ResponseEntity.ok(panelService.testConnection(id));
    }
}
