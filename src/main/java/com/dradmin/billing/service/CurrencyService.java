package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.ConversionResultDTO;
import com.dradmin.billing.dto.ExchangeRateDTO;
import com.dradmin.billing.entity.CurrencyExchangeRate;
import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;
import com.dradmin.billing.repository.CurrencyExchangeRateRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class CurrencyService {

    @Autowired
    private CurrencyExchangeRateRepository rateRepository;

    @Transactional(readOnly = true)
    public List<ExchangeRateDTO> getAllRates() {
        return rateRepository.findAllByOrderByEffectiveDateDesc().stream()
                .map(ExchangeRateDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<ExchangeRateDTO> getActiveRates() {
        return rateRepository.findActive(LocalDateTime.now()).stream()
                .map(ExchangeRateDTO::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ExchangeRateDTO getRateById(Long id) {
        return ExchangeRateDTO.fromEntity(find(id));
    }

    @Transactional(readOnly = true)
    public List<ExchangeRateDTO> getRatesForPair(String base, String target) {
        return rateRepository.findByBaseCurrencyAndTargetCurrencyOrderByEffectiveDateDesc(
                        base.toUpperCase(), target.toUpperCase()).stream()
                .map(ExchangeRateDTO::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * Latest active rate for the pair effective at {@code at}. Same-currency pairs yield a synthetic rate of 1.
     */
    @Transactional(readOnly = true)
    public ExchangeRateDTO getExchangeRate(String from, String to, LocalDateTime at) {
        String base = from.trim().toUpperCase();
        String target = to.trim().toUpperCase();
        LocalDateTime when = at != null ? at : LocalDateTime.now();
        if (base.equals(target)) {
            return ExchangeRateDTO.builder()
                    .baseCurrency(base)
                    .targetCurrency(target)
                    .rate(BigDecimal.ONE)
                    .markup(BigDecimal.ZERO)
                    .effectiveRate(BigDecimal.ONE)
                    .effectiveDate(when)
                    .source(RateSource.MANUAL)
                    .active(true)
                    .build();
        }
        return rateRepository.findLatestApplicable(base, target, when)
                .map(ExchangeRateDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No exchange rate found for " + base + " to " + target + " at " + when));
    }

    @Transactional(readOnly = true)
    public ConversionResultDTO convert(BigDecimal amount, String from, String to, LocalDateTime at) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        ExchangeRateDTO rate;
        try {
            rate = getExchangeRate(from, to, at);
        } catch (ResourceNotFoundException e) {
            throw new BusinessRuleException(e.getMessage());
        }
        BigDecimal converted = Money.round(amount.multiply(rate.getEffectiveRate()));
        return new ConversionResultDTO(amount, rate.getBaseCurrency(), converted, rate.getTargetCurrency(),
                rate.getEffectiveRate(), rate.getEffectiveDate());
    }

    public ExchangeRateDTO createRate(ExchangeRateDTO dto) {
        validatePair(dto);
        CurrencyExchangeRate rate = new CurrencyExchangeRate();
        apply(rate, dto);
        rate.setSource(dto.getSource() != null ? dto.getSource() : RateSource.MANUAL);
        CurrencyExchangeRate saved = rateRepository.save(rate);
        log.info("Created exchange rate {}->{} {}", saved.getBaseCurrency(), saved.getTargetCurrency(), saved.getRate());
        return ExchangeRateDTO.fromEntity(saved);
    }

    public ExchangeRateDTO updateRate(Long id, ExchangeRateDTO dto) {
        validatePair(dto);
        CurrencyExchangeRate rate = find(id);
        apply(rate, dto);
        rate.recalculateEffectiveRate();
        log.info("Updated exchange rate {}", id);
        return ExchangeRateDTO.fromEntity(rateRepository.save(rate));
    }

    public void deleteRate(Long id) {
        rateRepository.delete(find(id));
        log.info("Deleted exchange rate {}", id);
    }

    /**
     * @return number of active rates whose expiry has passed and that were switched off
     */
    public int deactivateExpiredRates() {
        List<CurrencyExchangeRate> expired = rateRepository.findActiveExpired(LocalDateTime.now());
        expired.forEach(rate -> {
            rate.setActive(false);
            rateRepository.save(rate);
        });
        log.info("Deactivated {} expired exchange rates", expired.size());
        return expired.size();
    }

    private void validatePair(ExchangeRateDTO dto) {
        if (dto.getBaseCurrency().equalsIgnoreCase(dto.getTargetCurrency())) {
            throw new IllegalArgumentException("Base and target currency must differ");
        }
        if (dto.getExpiryDate() != null && dto.getEffectiveDate() != null
                && !dto.getExpiryDate().isAfter(dto.getEffectiveDate())) {
            throw new IllegalArgumentException("expiryDate must be after effectiveDate");
        }
    }

    private void apply(CurrencyExchangeRate rate, ExchangeRateDTO dto) {
        rate.setBaseCurrency(dto.getBaseCurrency().toUpperCase());
        rate.setTargetCurrency(dto.getTargetCurrency().toUpperCase());
        rate.setRate(dto.getRate());
        rate.setMarkup(dto.getMarkup() != null ? dto.getMarkup() : BigDecimal.ZERO);
        rate.setEffectiveDate(dto.getEffectiveDate() != null ? dto.getEffectiveDate() : LocalDateTime.now());
        rate.setExpiryDate(dto.getExpiryDate());
        rate.setActive(dto.isActive());
        rate.setNotes(dto.getNotes());
    }

    private CurrencyExchangeRate find(Long id) {
        return rateRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Exchange rate", id));
    }
}
