package com.dradmin.hosting.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.ExternalServiceException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.hosting.dto.ServerControlPanelDTO;
import com.dradmin.hosting.dto.SyncResult;
import com.dradmin.hosting.entity.ServerControlPanel;
import com.dradmin.hosting.panel.HostingPanelFactory;
import com.dradmin.hosting.repository.ServerControlPanelRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class ServerControlPanelService {

    @Autowired
    private ServerControlPanelRepository panelRepository;

    @Autowired
    private HostingPanelFactory panelFactory;

    @Transactional(readOnly = true)
    public List<ServerControlPanelDTO> getAllPanels() {
        return panelRepository.findAllByOrderByNameAsc().stream()
                .map(ServerControlPanelDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<ServerControlPanelDTO> getActivePanels() {
        return panelRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(ServerControlPanelDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ServerControlPanelDTO getPanelById(Long id) {
        return ServerControlPanelDTO.fromEntity(getPanelEntity(id));
    }

    @Transactional(readOnly = true)
    public ServerControlPanel getPanelEntity(Long id) {
        return panelRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("ServerControlPanel", id));
    }

    public ServerControlPanelDTO createPanel(ServerControlPanelDTO dto) {
        ServerControlPanel panel = new ServerControlPanel();
        apply(panel, dto);
        panel.setApiToken(dto.getApiToken());
        ServerControlPanel saved = panelRepository.save(panel);
        log.info("Created {} control panel {} ({})", saved.getPanelType(), saved.getName(), saved.getId());
        return ServerControlPanelDTO.fromEntity(saved);
    }

    /**
     * A blank token in the update keeps the stored one.
     */
    public ServerControlPanelDTO updatePanel(Long id, ServerControlPanelDTO dto) {
        ServerControlPanel panel = getPanelEntity(id);
        apply(panel, dto);
        if (dto.getApiToken() != null && !dto.getApiToken().isBlank()) {
            panel.setApiToken(dto.getApiToken());
        }
        log.info("Updated control panel {}", id);
        return ServerControlPanelDTO.fromEntity(panelRepository.save(panel));
    }

    public void deletePanel(Long id) {
        panelRepository.delete(getPanelEntity(id));
        log.info("Deleted control panel {}", id);
    }

    /**
     * Lists the panel's accounts as a connectivity check.
     */
    @Transactional(readOnly = true)
    public SyncResult testConnection(Long id) {
        ServerControlPanel panel = getPanelEntity(id);
        try {
            int count = panelFactory.create(panel).listAccounts().size();
            return SyncResult.ok("Connected to " + panel.getName() + ", " + count + " accounts visible", count);
        } catch (ExternalServiceException e) {
            log.warn("Connection test for control panel {} failed: {}", id, e.getMessage());
            return SyncResult.failed(e.getMessage());
        }
    }

    private void apply(ServerControlPanel panel, ServerControlPanelDTO dto) {
        panel.setName(dto.getName().trim());
        panel.setPanelType(dto.getPanelType());
        panel.setApiUrl(dto.getApiUrl().trim());
        panel.setPort(dto.getPort());
        panel.setUseHttps(dto.isUseHttps());
        panel.setUsername(dto.getUsername());
        panel.setActive(dto.isActive());
    }
}
