package com.dradmin.registrar.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.dto.RegistrarDTO;
import com.dradmin.registrar.entity.Registrar;
import com.dradmin.registrar.repository.RegistrarRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class RegistrarService {

    @Autowired
    private RegistrarRepository registrarRepository;

    @Transactional(readOnly = true)
    public List<RegistrarDTO> getAllRegistrars() {
        return registrarRepository.findAllByOrderByNameAsc().stream()
                .map(RegistrarDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegistrarDTO> getActiveRegistrars() {
        return registrarRepository.findByActiveTrueOrderByNameAsc().stream()
                .map(RegistrarDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public RegistrarDTO getRegistrarById(Long id) {
        return RegistrarDTO.fromEntity(getRegistrarEntity(id));
    }

    @Transactional(readOnly = true)
    public Registrar getRegistrarEntity(Long id) {
        return registrarRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Registrar", id));
    }

    public RegistrarDTO createRegistrar(RegistrarDTO dto) {
        if (registrarRepository.existsByCodeIgnoreCase(dto.getCode().trim())) {
            throw new BusinessRuleException("Registrar code already exists: " + dto.getCode());
        }
        Registrar registrar = new Registrar();
        apply(registrar, dto);
        Registrar saved = registrarRepository.save(registrar);
        log.info("Created registrar {} ({})", saved.getName(), saved.getCode());
        return RegistrarDTO.fromEntity(saved);
    }

    public RegistrarDTO updateRegistrar(Long id, RegistrarDTO dto) {
        Registrar registrar = getRegistrarEntity(id);
        if (!registrar.getCode().equalsIgnoreCase(dto.getCode().trim())
                && registrarRepository.existsByCodeIgnoreCase(dto.getCode().trim())) {
            throw new BusinessRuleException("Registrar code already exists: " + dto.getCode());
        }
        apply(registrar, dto);
        log.info("Updated registrar {}", id);
        return RegistrarDTO.fromEntity(registrarRepository.save(registrar));
    }

    public void deleteRegistrar(Long id) {
        registrarRepository.delete(getRegistrarEntity(id));
        log.info("Deleted registrar {}", id);
    }

    private void apply(Registrar registrar, RegistrarDTO dto) {
        registrar.setName(dto.getName().trim());
        registrar.setCode(dto.getCode().trim().toLowerCase());
        registrar.setApiUrl(dto.getApiUrl());
        registrar.setActive(dto.isActive());
        registrar.setNotes(dto.getNotes());
    }
}
