package com.dradmin.dns.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dns.dto.DnsRecordTypeDTO;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.repository.DnsRecordTypeRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class DnsRecordTypeService {

    private static final List<DnsRecordType> STANDARD_TYPES = List.of(
            standard("A", "IPv4 address record", false, false, false, true, 3600),
            standard("AAAA", "IPv6 address record", false, false, false, true, 3600),
            standard("CNAME", "Canonical name record, an alias for another name", false, false, false, true, 3600),
            standard("MX", "Mail exchange record", true, false, false, true, 3600),
            standard("TXT", "Text record (SPF, DKIM, verification)", false, false, false, true, 3600),
            standard("NS", "Name server record", false, false, false, false, 86400),
            standard("SRV", "Service locator record", true, true, true, true, 3600),
            standard("CAA", "Certification Authority Authorization record", false, false, false, true, 3600),
            standard("PTR", "Pointer record for reverse lookups", false, false, false, true, 86400),
            standard("SOA", "Start of authority record", false, false, false, false, 3600));

    @Autowired
    private DnsRecordTypeRepository recordTypeRepository;

    @Transactional(readOnly = true)
    public List<DnsRecordTypeDTO> getAllRecordTypes() {
        return recordTypeRepository.findAllByOrderByTypeAsc().stream()
                .map(DnsRecordTypeDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<DnsRecordTypeDTO> getActiveRecordTypes() {
        return recordTypeRepository.findByActiveTrueOrderByTypeAsc().stream()
                .map(DnsRecordTypeDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DnsRecordTypeDTO getRecordTypeById(Long id) {
        return DnsRecordTypeDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public DnsRecordTypeDTO getRecordTypeByType(String type) {
        return DnsRecordTypeDTO.fromEntity(getRecordTypeEntity(type));
    }

    @Transactional(readOnly = true)
    public DnsRecordType getRecordTypeEntity(String type) {
        return recordTypeRepository.findByTypeIgnoreCase(type.trim())
                .orElseThrow(() -> new ResourceNotFoundException("DNS record type not found: " + type));
    }

    public DnsRecordTypeDTO createRecordType(DnsRecordTypeDTO dto) {
        if (recordTypeRepository.existsByTypeIgnoreCase(dto.getType().trim())) {
            throw new BusinessRuleException("DNS record type already exists: " + dto.getType());
        }
        DnsRecordType type = new DnsRecordType();
        apply(type, dto);
        DnsRecordType saved = recordTypeRepository.save(type);
        log.info("Created DNS record type {}", saved.getType());
        return DnsRecordTypeDTO.fromEntity(saved);
    }

    public DnsRecordTypeDTO updateRecordType(Long id, DnsRecordTypeDTO dto) {
        DnsRecordType type = find(id);
        if (!type.getType().equalsIgnoreCase(dto.getType().trim())
                && recordTypeRepository.existsByTypeIgnoreCase(dto.getType().trim())) {
            throw new BusinessRuleException("DNS record type already exists: " + dto.getType());
        }
        apply(type, dto);
        log.info("Updated DNS record type {}", type.getType());
        return DnsRecordTypeDTO.fromEntity(recordTypeRepository.save(type));
    }

    public void deleteRecordType(Long id) {
        recordTypeRepository.delete(find(id));
        log.info("Deleted DNS record type {}", id);
    }

    /**
     * Inserts the standard record types that are missing. Existing rows are left untouched.
     *
     * @return number of types created
     */
    public int seedDefaults() {
        int created = 0;
        for (DnsRecordType template : STANDARD_TYPES) {
            if (recordTypeRepository.existsByTypeIgnoreCase(template.getType())) {
                continue;
            }
            recordTypeRepository.save(DnsRecordType.builder()
                    .type(template.getType())
                    .description(template.getDescription())
                    .hasPriority(template.isHasPriority())
                    .hasWeight(template.isHasWeight())
                    .hasPort(template.isHasPort())
                    .editableByUser(template.isEditableByUser())
                    .active(true)
                    .defaultTtl(template.getDefaultTtl())
                    .build());
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} DNS record types", created);
        }
        return created;
    }

    private static DnsRecordType standard(String type, String description, boolean priority, boolean weight,
                                          boolean port, boolean editable, int ttl) {
        return DnsRecordType.builder()
                .type(type)
                .description(description)
                .hasPriority(priority)
                .hasWeight(weight)
                .hasPort(port)
                .editableByUser(editable)
                .defaultTtl(ttl)
                .build();
    }

    private void apply(DnsRecordType type, DnsRecordTypeDTO dto) {
        type.setType(dto.getType().trim().toUpperCase());
        type.setDescription(dto.getDescription());
        type.setHasPriority(dto.isHasPriority());
        type.setHasWeight(dto.isHasWeight());
        type.setHasPort(dto.isHasPort());
        type.setEditableByUser(dto.isEditableByUser());
        type.setActive(dto.isActive());
        type.setDefaultTtl(dto.getDefaultTtl());
    }

    private DnsRecordType find(Long id) {
        return recordTypeRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("DNS record type", id));
    }
}
