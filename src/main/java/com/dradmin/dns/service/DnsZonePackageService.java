package com.dradmin.dns.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.dns.dto.DnsZonePackageDTO;
import com.dradmin.dns.dto.DnsZonePackageRecordDTO;
import com.dradmin.dns.entity.DnsRecord;
import com.dradmin.dns.entity.DnsRecordType;
import com.dradmin.dns.entity.DnsZonePackage;
import com.dradmin.dns.entity.DnsZonePackageRecord;
import com.dradmin.dns.repository.DnsRecordRepository;
import com.dradmin.dns.repository.DnsZonePackageRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.service.RegisteredDomainService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class DnsZonePackageService {

    public static final String DOMAIN_PLACEHOLDER = "{domain}";

    @Autowired
    private DnsZonePackageRepository packageRepository;

    @Autowired
    private DnsRecordRepository recordRepository;

    @Autowired
    private DnsRecordService recordService;

    @Autowired
    private RegisteredDomainService domainService;

    @Transactional(readOnly = true)
    public List<DnsZonePackageDTO> getAllPackages() {
        return packageRepository.findAllByOrderBySortOrderAscNameAsc().stream()
                .map(DnsZonePackageDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<DnsZonePackageDTO> getAllPackagesWithRecords() {
        return packageRepository.findAllWithRecords().stream()
                .map(DnsZonePackageDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<DnsZonePackageDTO> getActivePackages() {
        return packageRepository.findByActiveTrueOrderBySortOrderAscNameAsc().stream()
                .map(DnsZonePackageDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public DnsZonePackageDTO getPackageById(Long id) {
        return DnsZonePackageDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public DnsZonePackageDTO getDefaultPackage() {
        DnsZonePackage zonePackage = packageRepository.findFirstByDefaultPackageTrue()
                .orElseThrow(() -> new ResourceNotFoundException("No default DNS zone package configured"));
        return DnsZonePackageDTO.fromEntity(zonePackage);
    }

    public DnsZonePackageDTO createPackage(DnsZonePackageDTO dto) {
        DnsZonePackage zonePackage = new DnsZonePackage();
        apply(zonePackage, dto);
        if (dto.getRecords() != null) {
            for (DnsZonePackageRecordDTO recordDto : dto.getRecords()) {
                zonePackage.addRecord(toRecord(recordDto));
            }
        }
        DnsZonePackage saved = packageRepository.save(zonePackage);
        if (saved.isDefaultPackage()) {
            clearOtherDefaults(saved.getId());
        }
        log.info("Created DNS zone package {} with {} records", saved.getName(), saved.getRecords().size());
        return DnsZonePackageDTO.fromEntity(saved);
    }

    public DnsZonePackageDTO updatePackage(Long id, DnsZonePackageDTO dto) {
        DnsZonePackage zonePackage = find(id);
        apply(zonePackage, dto);
        if (zonePackage.isDefaultPackage()) {
            clearOtherDefaults(id);
        }
        log.info("Updated DNS zone package {}", id);
        return DnsZonePackageDTO.fromEntity(packageRepository.save(zonePackage));
    }

    public void deletePackage(Long id) {
        packageRepository.delete(find(id));
        log.info("Deleted DNS zone package {}", id);
    }

    public DnsZonePackageDTO setDefaultPackage(Long id) {
        DnsZonePackage zonePackage = find(id);
        zonePackage.setDefaultPackage(true);
        clearOtherDefaults(id);
        return DnsZonePackageDTO.fromEntity(packageRepository.save(zonePackage));
    }

    public DnsZonePackageDTO addRecord(Long packageId, DnsZonePackageRecordDTO dto) {
        DnsZonePackage zonePackage = find(packageId);
        zonePackage.addRecord(toRecord(dto));
        return DnsZonePackageDTO.fromEntity(packageRepository.save(zonePackage));
    }

    public DnsZonePackageDTO removeRecord(Long packageId, Long recordId) {
        DnsZonePackage zonePackage = find(packageId);
        boolean removed = zonePackage.getRecords().removeIf(r -> r.getId().equals(recordId));
        if (!removed) {
            throw new ResourceNotFoundException("DNS zone package record", recordId);
        }
        return DnsZonePackageDTO.fromEntity(packageRepository.save(zonePackage));
    }

    /**
     * Copies the package's template records into the domain's zone as pending-sync records.
     *
     * @return number of records created
     */
    public int applyPackageToDomain(Long packageId, Long domainId) {
        DnsZonePackage zonePackage = find(packageId);
        if (!zonePackage.isActive()) {
            throw new BusinessRuleException("DNS zone package " + zonePackage.getName() + " is not active");
        }
        RegisteredDomain domain = domainService.getDomainEntity(domainId);
        int created = 0;
        for (DnsZonePackageRecord template : zonePackage.getRecords()) {
            DnsRecord record = DnsRecord.builder()
                    .domain(domain)
                    .type(template.getType())
                    .name(template.getName())
                    .value(template.getValue().replace(DOMAIN_PLACEHOLDER, domain.getName()))
                    .ttl(DnsRecordService.effectiveTtl(template.getType(), template.getTtl()))
                    .priority(template.getPriority())
                    .weight(template.getWeight())
                    .port(template.getPort())
                    .pendingSync(true)
                    .deleted(false)
                    .build();
            recordRepository.save(record);
            created++;
        }
        log.info("Applied DNS zone package {} to {}: {} records", zonePackage.getName(), domain.getName(), created);
        return created;
    }

    private void clearOtherDefaults(Long keepId) {
        for (DnsZonePackage other : packageRepository.findByDefaultPackageTrue()) {
            if (!other.getId().equals(keepId)) {
                other.setDefaultPackage(false);
                packageRepository.save(other);
            }
        }
    }

    private DnsZonePackageRecord toRecord(DnsZonePackageRecordDTO dto) {
        DnsRecordType type = recordService.activeType(dto.getType());
        DnsRecordService.validateFields(type, dto.getPriority(), dto.getWeight(), dto.getPort());
        return DnsZonePackageRecord.builder()
                .type(type)
                .name(dto.getName().trim())
                .value(dto.getValue().trim())
                .ttl(DnsRecordService.effectiveTtl(type, dto.getTtl()))
                .priority(dto.getPriority())
                .weight(dto.getWeight())
                .port(dto.getPort())
                .notes(dto.getNotes())
                .build();
    }

    private void apply(DnsZonePackage zonePackage, DnsZonePackageDTO dto) {
        zonePackage.setName(dto.getName().trim());
        zonePackage.setDescription(dto.getDescription());
        zonePackage.setActive(dto.isActive());
        zonePackage.setDefaultPackage(dto.isDefaultPackage());
        zonePackage.setSortOrder(dto.getSortOrder());
    }

    private DnsZonePackage find(Long id) {
        return packageRepository.findWithRecordsById(id)
                .orElseThrow(() -> new ResourceNotFoundException("DNS zone package", id));
    }
}
