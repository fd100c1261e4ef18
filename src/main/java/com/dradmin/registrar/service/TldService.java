package com.dradmin.registrar.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.dto.TldDTO;
import com.dradmin.registrar.entity.Tld;
import com.dradmin.registrar.repository.TldRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class TldService {

    @Autowired
    private TldRepository tldRepository;

    @Transactional(readOnly = true)
    public List<TldDTO> getAllTlds() {
        return tldRepository.findAllByOrderByExtensionAsc().stream().map(TldDTO::fromEntity).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TldDTO> getActiveTlds() {
        return tldRepository.findByActiveTrueOrderByExtensionAsc().stream().map(TldDTO::fromEntity).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TldDTO getTldById(Long id) {
        return TldDTO.fromEntity(getTldEntity(id));
    }

    @Transactional(readOnly = true)
    public TldDTO getTldByExtension(String extension) {
        String normalized = Tld.normalize(extension);
        return tldRepository.findByExtension(normalized)
                .map(TldDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("TLD not found: " + normalized));
    }

    @Transactional(readOnly = true)
    public Tld getTldEntity(Long id) {
        return tldRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("TLD", id));
    }

    public TldDTO createTld(TldDTO dto) {
        String extension = Tld.normalize(dto.getExtension());
        if (tldRepository.existsByExtension(extension)) {
            throw new BusinessRuleException("TLD already exists: " + extension);
        }
        Tld tld = new Tld();
        apply(tld, dto);
        Tld saved = tldRepository.save(tld);
        log.info("Created TLD .{}", saved.getExtension());
        return TldDTO.fromEntity(saved);
    }

    public TldDTO updateTld(Long id, TldDTO dto) {
        Tld tld = getTldEntity(id);
        String extension = Tld.normalize(dto.getExtension());
        if (!tld.getExtension().equals(extension) && tldRepository.existsByExtension(extension)) {
            throw new BusinessRuleException("TLD already exists: " + extension);
        }
        apply(tld, dto);
        log.info("Updated TLD {}", id);
        return TldDTO.fromEntity(tldRepository.save(tld));
    }

    public void deleteTld(Long id) {
        tldRepository.delete(getTldEntity(id));
        log.info("Deleted TLD {}", id);
    }

    private void apply(Tld tld, TldDTO dto) {
        tld.setExtension(Tld.normalize(dto.getExtension()));
        tld.setDescription(dto.getDescription());
        tld.setActive(dto.isActive());
        tld.setDefaultRegistrationYears(dto.getDefaultRegistrationYears());
    }
}
