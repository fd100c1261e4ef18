package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.TaxCalculationResult;
import com.dradmin.billing.dto.TaxRuleDTO;
import com.dradmin.billing.dto.VatValidationResult;
import com.dradmin.billing.entity.TaxRule;
import com.dradmin.billing.repository.TaxRuleRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.service.CustomerService;

import lombok.extern.slf4j.Slf4j;

/**
 * Tax rules by location and the tax calculation used by invoices and quotes.
 */
@Slf4j
@Service
@Transactional
public class TaxService {

    private static final Pattern VAT_BODY = Pattern.compile("^[A-Z0-9]{2,13}$");

    @Autowired
    private TaxRuleRepository taxRuleRepository;

    @Autowired
    private CustomerService customerService;

    @Transactional(readOnly = true)
    public List<TaxRuleDTO> getAllTaxRules() {
        return taxRuleRepository.findAllByOrderByCountryCodeAscPriorityDesc().stream()
                .map(TaxRuleDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TaxRuleDTO> getActiveTaxRules() {
        LocalDate today = LocalDate.now();
        return taxRuleRepository.findByActiveTrueOrderByCountryCodeAscPriorityDesc().stream()
                .filter(rule -> rule.isEffectiveOn(today))
                .map(TaxRuleDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TaxRuleDTO> getTaxRulesByLocation(String countryCode, String stateCode) {
        return taxRuleRepository.findByCountryCodeIgnoreCase(countryCode).stream()
                .filter(rule -> stateCode == null || stateCode.isBlank()
                        || rule.getStateCode() == null || rule.getStateCode().equalsIgnoreCase(stateCode))
                .sorted(Comparator.comparingInt(TaxRule::getPriority).reversed())
                .map(TaxRuleDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TaxRuleDTO getTaxRuleById(Long id) {
        return TaxRuleDTO.fromEntity(find(id));
    }

    public TaxRuleDTO createTaxRule(TaxRuleDTO dto) {
        validateWindow(dto);
        TaxRule rule = new TaxRule();
        apply(rule, dto);
        TaxRule saved = taxRuleRepository.save(rule);
        log.info("Created tax rule {} {} {}%", saved.getCountryCode(), saved.getTaxName(), saved.getRate());
        return TaxRuleDTO.fromEntity(saved);
    }

    public TaxRuleDTO updateTaxRule(Long id, TaxRuleDTO dto) {
        validateWindow(dto);
        TaxRule rule = find(id);
        apply(rule, dto);
        log.info("Updated tax rule {}", id);
        return TaxRuleDTO.fromEntity(taxRuleRepository.save(rule));
    }

    public void deleteTaxRule(Long id) {
        taxRuleRepository.delete(find(id));
        log.info("Deleted tax rule {}", id);
    }

    @Transactional(readOnly = true)
    public TaxCalculationResult calculateTax(Long customerId, BigDecimal amount, boolean isSetupFee) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return calculateTax(customerService.getCustomerEntity(customerId), amount, isSetupFee);
    }

    /**
     * Tax on {@code amount} for the customer. Rate is zero when no rule applies, when a setup fee is not
     * covered by the rule, or when the rule is reverse charge and the customer is a VAT-registered company.
     */
    @Transactional(readOnly = true)
    public TaxCalculationResult calculateTax(Customer customer, BigDecimal amount, boolean isSetupFee) {
        Optional<TaxRule> ruleOpt = findApplicableRule(customer);
        if (ruleOpt.isEmpty()) {
            return new TaxCalculationResult(Money.round(BigDecimal.ZERO), BigDecimal.ZERO, null, false);
        }
        TaxRule rule = ruleOpt.get();
        if (isReverseCharge(rule, customer)) {
            return new TaxCalculationResult(Money.round(BigDecimal.ZERO), BigDecimal.ZERO, rule.getTaxName(), true);
        }
        if (isSetupFee && !rule.isAppliesToSetupFees()) {
            return new TaxCalculationResult(Money.round(BigDecimal.ZERO), BigDecimal.ZERO, rule.getTaxName(), false);
        }
        return new TaxCalculationResult(Money.percentOf(amount, rule.getRate()), rule.getRate(), rule.getTaxName(), false);
    }

    /**
     * Most specific active rule for the customer's location: a state rule beats a country-wide one,
     * then the highest priority wins.
     */
    @Transactional(readOnly = true)
    public Optional<TaxRule> findApplicableRule(Customer customer) {
        if (customer.getCountryCode() == null) {
            return Optional.empty();
        }
        LocalDate today = LocalDate.now();
        String state = customer.getStateCode();
        return taxRuleRepository.findByCountryCodeIgnoreCaseAndActiveTrue(customer.getCountryCode()).stream()
                .filter(rule -> rule.isEffectiveOn(today))
                .filter(rule -> rule.getStateCode() == null
                        || (state != null && rule.getStateCode().equalsIgnoreCase(state)))
                .max(Comparator.comparingInt((TaxRule rule) -> rule.getStateCode() != null ? 1 : 0)
                        .thenComparingInt(TaxRule::getPriority));
    }

    public boolean isReverseCharge(TaxRule rule, Customer customer) {
        return rule.isReverseCharge() && customer.isCompany()
                && customer.getVatNumber() != null && !customer.getVatNumber().isBlank();
    }

    /**
     * Format check only: country prefix (EL for Greece) followed by 2 to 13 letters or digits.
     */
    public VatValidationResult validateVatNumber(String vatNumber, String countryCode) {
        if (vatNumber == null || vatNumber.isBlank() || countryCode == null || countryCode.isBlank()) {
            return new VatValidationResult(vatNumber, countryCode, false, "VAT number and country code are required");
        }
        String normalized = vatNumber.replaceAll("\\s+", "").toUpperCase();
        String country = countryCode.trim().toUpperCase();
        String prefix = "GR".equals(country) ? "EL" : country;
        if (!normalized.startsWith(prefix)) {
            return new VatValidationResult(normalized, country, false, "VAT number must start with " + prefix);
        }
        boolean valid = VAT_BODY.matcher(normalized.substring(prefix.length())).matches();
        return new VatValidationResult(normalized, country, valid,
                valid ? "VAT number format is valid" : "VAT number format is invalid");
    }

    private void validateWindow(TaxRuleDTO dto) {
        if (dto.getEffectiveFrom() != null && dto.getEffectiveUntil() != null
                && dto.getEffectiveUntil().isBefore(dto.getEffectiveFrom())) {
            throw new IllegalArgumentException("effectiveUntil must not be before effectiveFrom");
        }
    }

    private void apply(TaxRule rule, TaxRuleDTO dto) {
        rule.setCountryCode(dto.getCountryCode().toUpperCase());
        rule.setStateCode(dto.getStateCode() == null || dto.getStateCode().isBlank() ? null : dto.getStateCode().toUpperCase());
        rule.setTaxName(dto.getTaxName());
        rule.setRate(dto.getRate());
        rule.setAppliesToSetupFees(dto.isAppliesToSetupFees());
        rule.setReverseCharge(dto.isReverseCharge());
        rule.setEffectiveFrom(dto.getEffectiveFrom());
        rule.setEffectiveUntil(dto.getEffectiveUntil());
        rule.setActive(dto.isActive());
        rule.setPriority(dto.getPriority());
    }

    private TaxRule find(Long id) {
        return taxRuleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tax rule", id));
    }
}
