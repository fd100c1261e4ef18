package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.entity.CurrencyExchangeRate;
import com.dradmin.billing.entity.ExchangeRateDownloadLog;
import com.dradmin.billing.repository.CurrencyExchangeRateRepository;
import com.dradmin.billing.repository.ExchangeRateDownloadLogRepository;
import com.dradmin.exception.ExternalServiceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Downloads provider rates on a schedule, replaces the previous provider rate of each pair and
 * writes a download log either way.
 */
@Slf4j
@Service
public class ExchangeRateUpdateService {

    @Autowired
    private ExchangeRateProvider rateProvider;

    @Autowired
    private CurrencyExchangeRateRepository rateRepository;

    @Autowired
    private ExchangeRateDownloadLogRepository downloadLogRepository;

    @Value("${dradmin.exchange-rates.base-currency:EUR}")
    private String baseCurrency;

    @Value("${dradmin.exchange-rates.targets:USD,GBP}")
    private String targets;

    @Value("${dradmin.exchange-rates.default-markup:0}")
    private BigDecimal defaultMarkup;

    @Scheduled(cron = "${dradmin.exchange-rates.cron:0 0 6 * * *}")
    @Transactional(noRollbackFor = ExternalServiceException.class)
    public void scheduledUpdate() {
        try {
            updateRates();
        } catch (ExternalServiceException e) {
            log.error("Scheduled exchange rate update failed: {}", e.getMessage());
        }
    }

    @Transactional(noRollbackFor = ExternalServiceException.class)
    public ExchangeRateDownloadLog updateRates() {
        String base = baseCurrency.trim().toUpperCase();
        List<String> targetList = Arrays.stream(targets.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(String::toUpperCase)
                .filter(code -> !code.equals(base))
                .collect(Collectors.toList());

        ExchangeRateDownloadLog downloadLog = ExchangeRateDownloadLog.builder()
                .source(rateProvider.source())
                .baseCurrency(base)
                .startedAt(LocalDateTime.now())
                .build();

        try {
            Map<String, BigDecimal> rates = rateProvider.fetchLatestRates(base, targetList);
            LocalDateTime now = LocalDateTime.now();
            int updated = 0;
            for (Map.Entry<String, BigDecimal> entry : rates.entrySet()) {
                for (CurrencyExchangeRate previous : rateRepository
                        .findByBaseCurrencyAndTargetCurrencyAndSourceAndActiveTrue(base, entry.getKey(), rateProvider.source())) {
                    previous.setActive(false);
                    previous.setExpiryDate(now);
                    rateRepository.save(previous);
                }
                rateRepository.save(CurrencyExchangeRate.builder()
                        .baseCurrency(base)
                        .targetCurrency(entry.getKey())
                        .rate(entry.getValue())
                        .markup(defaultMarkup)
                        .effectiveRate(entry.getValue())
                        .effectiveDate(now)
                        .source(rateProvider.source())
                        .active(true)
                        .build());
                updated++;
            }
            downloadLog.setSuccess(true);
            downloadLog.setRatesUpdated(updated);
            log.info("Updated {} exchange rates for base {}", updated, base);
        } catch (ExternalServiceException e) {
            downloadLog.setSuccess(false);
            downloadLog.setErrorMessage(e.getMessage());
            downloadLog.setCompletedAt(LocalDateTime.now());
            downloadLogRepository.save(downloadLog);
            throw e;
        }
        downloadLog.setCompletedAt(LocalDateTime.now());
        return downloadLogRepository.save(downloadLog);
    }

    @Transactional(readOnly = true)
    public List<ExchangeRateDownloadLog> getRecentDownloadLogs() {
        return downloadLogRepository.findTop50ByOrderByStartedAtDesc();
    }
}
