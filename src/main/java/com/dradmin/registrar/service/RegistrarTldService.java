package com.dradmin.registrar.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.dto.RegistrarTldDTO;
import com.dradmin.registrar.entity.RegistrarTld;
import com.dradmin.registrar.repository.RegistrarTldRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class RegistrarTldService {

    @Autowired
    private RegistrarTldRepository registrarTldRepository;

    @Autowired
    private RegistrarService registrarService;

    @Autowired
    private TldService tldService;

    @Transactional(readOnly = true)
    public List<RegistrarTldDTO> getAllRegistrarTlds() {
        return registrarTldRepository.findAllWithRegistrarAndTld().stream()
                .map(RegistrarTldDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegistrarTldDTO> getByRegistrar(Long registrarId) {
        return registrarTldRepository.findByRegistrarId(registrarId).stream()
                .map(RegistrarTldDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegistrarTldDTO> getByTld(Long tldId) {
        return registrarTldRepository.findByTldId(tldId).stream()
                .map(RegistrarTldDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public RegistrarTldDTO getRegistrarTldById(Long id) {
        return RegistrarTldDTO.fromEntity(find(id));
    }

    public RegistrarTldDTO createRegistrarTld(RegistrarTldDTO dto) {
        if (registrarTldRepository.existsByRegistrarIdAndTldId(dto.getRegistrarId(), dto.getTldId())) {
            throw new BusinessRuleException("Registrar " + dto.getRegistrarId() + " already offers TLD " + dto.getTldId());
        }
        RegistrarTld link = new RegistrarTld();
        link.setRegistrar(registrarService.getRegistrarEntity(dto.getRegistrarId()));
        link.setTld(tldService.getTldEntity(dto.getTldId()));
        apply(link, dto);
        RegistrarTld saved = registrarTldRepository.save(link);
        log.info("Linked registrar {} to .{}", saved.getRegistrar().getCode(), saved.getTld().getExtension());
        return RegistrarTldDTO.fromEntity(saved);
    }

    public RegistrarTldDTO updateRegistrarTld(Long id, RegistrarTldDTO dto) {
        RegistrarTld link = find(id);
        apply(link, dto);
        log.info("Updated registrar TLD {}", id);
        return RegistrarTldDTO.fromEntity(registrarTldRepository.save(link));
    }

    public void deleteRegistrarTld(Long id) {
        registrarTldRepository.delete(find(id));
        log.info("Deleted registrar TLD {}", id);
    }

    private void apply(RegistrarTld link, RegistrarTldDTO dto) {
        if (dto.getMinRegistrationYears() > dto.getMaxRegistrationYears()) {
            throw new IllegalArgumentException("minRegistrationYears must not exceed maxRegistrationYears");
        }
        link.setRegistrationCost(dto.getRegistrationCost());
        link.setRenewalCost(dto.getRenewalCost());
        link.setTransferCost(dto.getTransferCost());
        if (dto.getCurrency() != null) {
            link.setCurrency(dto.getCurrency().toUpperCase());
        }
        link.setActive(dto.isActive());
        link.setAutoRenew(dto.isAutoRenew());
        link.setMinRegistrationYears(dto.getMinRegistrationYears());
        link.setMaxRegistrationYears(dto.getMaxRegistrationYears());
        link.setNotes(dto.getNotes());
    }

    private RegistrarTld find(Long id) {
        return registrarTldRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Registrar TLD", id));
    }
}
