package com.dradmin.registrar.service;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.registrar.dto.RegisteredDomainDTO;
import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;
import com.dradmin.registrar.entity.Tld;
import com.dradmin.registrar.repository.RegisteredDomainRepository;
import com.dradmin.registrar.repository.TldRepository;
import com.dradmin.service.CustomerService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class RegisteredDomainService {

    @Autowired
    private RegisteredDomainRepository domainRepository;

    @Autowired
    private TldRepository tldRepository;

    @Autowired
    private TldService tldService;

    @Autowired
    private RegistrarService registrarService;

    @Autowired
    private CustomerService customerService;

    @Transactional(readOnly = true)
    public List<RegisteredDomainDTO> getAllDomains() {
        return domainRepository.findAllByOrderByNameAsc().stream()
                .map(RegisteredDomainDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegisteredDomainDTO> getDomainsByCustomer(Long customerId) {
        return domainRepository.findByCustomerIdOrderByNameAsc(customerId).stream()
                .map(RegisteredDomainDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<RegisteredDomainDTO> getDomainsExpiringWithin(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative");
        }
        LocalDate today = LocalDate.now();
        return domainRepository.findExpiringBetween(DomainStatus.ACTIVE, today, today.plusDays(days)).stream()
                .map(RegisteredDomainDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public RegisteredDomainDTO getDomainById(Long id) {
        return RegisteredDomainDTO.fromEntity(getDomainEntity(id));
    }

    @Transactional(readOnly = true)
    public RegisteredDomainDTO getDomainByName(String name) {
        return domainRepository.findByNameIgnoreCase(name.trim())
                .map(RegisteredDomainDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("Domain not found: " + name));
    }

    @Transactional(readOnly = true)
    public RegisteredDomain getDomainEntity(Long id) {
        return domainRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Domain", id));
    }

    public RegisteredDomainDTO createDomain(RegisteredDomainDTO dto) {
        String name = normalizeName(dto.getName());
        if (domainRepository.existsByNameIgnoreCase(name)) {
            throw new BusinessRuleException("Domain already exists: " + name);
        }
        RegisteredDomain domain = new RegisteredDomain();
        domain.setName(name);
        domain.setStatus(dto.getStatus() != null ? dto.getStatus() : DomainStatus.PENDING);
        apply(domain, dto);
        RegisteredDomain saved = domainRepository.save(domain);
        log.info("Created domain {} for customer {}", saved.getName(), saved.getCustomer().getId());
        return RegisteredDomainDTO.fromEntity(saved);
    }

    public RegisteredDomainDTO updateDomain(Long id, RegisteredDomainDTO dto) {
        RegisteredDomain domain = getDomainEntity(id);
        String name = normalizeName(dto.getName());
        if (!domain.getName().equals(name)) {
            throw new BusinessRuleException("Domain name cannot be changed");
        }
        if (dto.getStatus() != null) {
            domain.setStatus(dto.getStatus());
        }
        apply(domain, dto);
        log.info("Updated domain {}", domain.getName());
        return RegisteredDomainDTO.fromEntity(domainRepository.save(domain));
    }

    public void deleteDomain(Long id) {
        RegisteredDomain domain = getDomainEntity(id);
        domainRepository.delete(domain);
        log.info("Deleted domain {}", domain.getName());
    }

    private void apply(RegisteredDomain domain, RegisteredDomainDTO dto) {
        domain.setCustomer(customerService.getCustomerEntity(dto.getCustomerId()));
        domain.setTld(dto.getTldId() != null ? tldService.getTldEntity(dto.getTldId()) : resolveTld(domain.getName()));
        if (!domain.getName().endsWith("." + domain.getTld().getExtension())) {
            throw new IllegalArgumentException("Domain " + domain.getName() + " does not end with ." + domain.getTld().getExtension());
        }
        domain.setRegistrar(dto.getRegistrarId() != null ? registrarService.getRegistrarEntity(dto.getRegistrarId()) : null);
        if (dto.getRegistrationDate() != null && dto.getExpirationDate() != null
                && dto.getExpirationDate().isBefore(dto.getRegistrationDate())) {
            throw new IllegalArgumentException("expirationDate must not be before registrationDate");
        }
        domain.setRegistrationDate(dto.getRegistrationDate());
        domain.setExpirationDate(dto.getExpirationDate());
        domain.setAutoRenew(dto.isAutoRenew());
        domain.setPrivacyProtection(dto.isPrivacyProtection());
    }

    /**
     * Longest known extension wins, so "example.co.uk" resolves to "co.uk" before "uk".
     */
    Tld resolveTld(String name) {
        String candidate = name;
        int dot;
        while ((dot = candidate.indexOf('.')) > 0) {
            candidate = candidate.substring(dot + 1);
            Tld tld = tldRepository.findByExtension(candidate).orElse(null);
            if (tld != null) {
                return tld;
            }
        }
        throw new BusinessRuleException("No TLD configured for domain " + name);
    }

    private String normalizeName(String name) {
        String value = name.trim().toLowerCase();
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        if (!value.matches("^([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z0-9-]{2,63}$")) {
            throw new IllegalArgumentException("Invalid domain name: " + name);
        }
        return value;
    }
}
