package com.dradmin.dns.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dns.dto.DnsRecordDTO;
import com.dradmin.dns.entity.DnsRecord;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.repository.DnsRecordRepository;
import com.dradmin.dto.PagedResult;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.service.RegisteredDomainService;

import lombok.extern.slf4j.Slf4j;

/**
 * Zone records. Every change flags the record as pending sync; deletion is soft until purged.
 */
@Slf4j
@Service
@Transactional
public class DnsRecordService {

    @Autowired
    private DnsRecordRepository recordRepository;

    @Autowired
    private DnsRecordTypeService recordTypeService;

    @Autowired
    private RegisteredDomainService domainService;

    @Transactional(readOnly = true)
    public List<DnsRecordDTO> getAllRecords() {
        return map(recordRepository.findByDeletedFalseOrderByIdAsc());
    }

    @Transactional(readOnly = true)
    public PagedResult<DnsRecordDTO> getRecordsPaged(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be 1 or greater");
        }
        if (pageSize < 1 || pageSize > 500) {
            throw new IllegalArgumentException("Page size must be between 1 and 500");
        }
        return PagedResult.of(recordRepository.findByDeletedFalse(PageRequest.of(page - 1, pageSize, Sort.by("id"))),
                DnsRecordDTO::fromEntity);
    }

    @Transactional(readOnly = true)
    public DnsRecordDTO getRecordById(Long id) {
        return DnsRecordDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public List<DnsRecordDTO> getRecordsByDomain(Long domainId) {
        return map(recordRepository.findByDomainIdAndDeletedFalseOrderByIdAsc(domainId));
    }

    @Transactional(readOnly = true)
    public List<DnsRecordDTO> getRecordsByType(String type) {
        return map(recordRepository.findActiveByTypeName(type.trim()));
    }

    @Transactional(readOnly = true)
    public List<DnsRecordDTO> getPendingSyncRecords(Long domainId) {
        return map(recordRepository.findByDomainIdAndPendingSyncTrueOrderByIdAsc(domainId));
    }

    @Transactional(readOnly = true)
    public List<DnsRecordDTO> getDeletedRecords(Long domainId) {
        return map(recordRepository.findByDomainIdAndDeletedTrueOrderByIdAsc(domainId));
    }

    public DnsRecordDTO createRecord(DnsRecordDTO dto) {
        RegisteredDomain domain = domainService.getDomainEntity(dto.getDomainId());
        DnsRecordType type = activeType(dto.getType());
        DnsRecord record = new DnsRecord();
        record.setDomain(domain);
        apply(record, type, dto);
        record.setPendingSync(true);
        DnsRecord saved = recordRepository.save(record);
        log.info("Created {} record {} for {}", type.getType(), saved.getName(), domain.getName());
        return DnsRecordDTO.fromEntity(saved);
    }

    public DnsRecordDTO updateRecord(Long id, DnsRecordDTO dto) {
        DnsRecord record = find(id);
        if (record.isDeleted()) {
            throw new BusinessRuleException("DNS record " + id + " is deleted, restore it first");
        }
        if (dto.getDomainId() != null && !dto.getDomainId().equals(record.getDomain().getId())) {
            record.setDomain(domainService.getDomainEntity(dto.getDomainId()));
        }
        apply(record, activeType(dto.getType()), dto);
        record.setPendingSync(true);
        log.info("Updated DNS record {}", id);
        return DnsRecordDTO.fromEntity(recordRepository.save(record));
    }

    public DnsRecordDTO softDeleteRecord(Long id) {
        DnsRecord record = find(id);
        record.setDeleted(true);
        record.setPendingSync(true);
        log.info("Soft-deleted DNS record {}", id);
        return DnsRecordDTO.fromEntity(recordRepository.save(record));
    }

    public void hardDeleteRecord(Long id) {
        recordRepository.delete(find(id));
        log.info("Purged DNS record {}", id);
    }

    public DnsRecordDTO restoreRecord(Long id) {
        DnsRecord record = find(id);
        if (!record.isDeleted()) {
            throw new BusinessRuleException("DNS record " + id + " is not deleted");
        }
        record.setDeleted(false);
        record.setPendingSync(true);
        log.info("Restored DNS record {}", id);
        return DnsRecordDTO.fromEntity(recordRepository.save(record));
    }

    public DnsRecordDTO markSynced(Long id) {
        DnsRecord record = find(id);
        record.setPendingSync(false);
        return DnsRecordDTO.fromEntity(recordRepository.save(record));
    }

    DnsRecordType activeType(String typeName) {
        DnsRecordType type = recordTypeService.getRecordTypeEntity(typeName);
        if (!type.isActive()) {
            throw new BusinessRuleException("DNS record type " + type.getType() + " is not active");
        }
        return type;
    }

    /**
     * Checks the fields the record type requires and falls back to the type's default TTL.
     */
    static void validateFields(DnsRecordType type, Integer priority, Integer weight, Integer port) {
        if (type.isHasPriority() && priority == null) {
            throw new IllegalArgumentException(type.getType() + " records require a priority");
        }
        if (type.isHasWeight() && weight == null) {
            throw new IllegalArgumentException(type.getType() + " records require a weight");
        }
        if (type.isHasPort() && port == null) {
            throw new IllegalArgumentException(type.getType() + " records require a port");
        }
    }

    static int effectiveTtl(DnsRecordType type, int ttl) {
        return ttl > 0 ? ttl : type.getDefaultTtl();
    }

    private void apply(DnsRecord record, DnsRecordType type, DnsRecordDTO dto) {
        validateFields(type, dto.getPriority(), dto.getWeight(), dto.getPort());
        record.setType(type);
        record.setName(dto.getName().trim());
        record.setValue(dto.getValue().trim());
        record.setTtl(effectiveTtl(type, dto.getTtl()));
        record.setPriority(type.isHasPriority() ? dto.getPriority() : null);
        record.setWeight(type.isHasWeight() ? dto.getWeight() : null);
        record.setPort(type.isHasPort() ? dto.getPort() : null);
    }

    private List<DnsRecordDTO> map(List<DnsRecord> records) {
        return records.stream().map(DnsRecordDTO::fromEntity).collect(Collectors.toList());
    }

    private DnsRecord find(Long id) {
        return recordRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("DNS record", id));
    }
}
