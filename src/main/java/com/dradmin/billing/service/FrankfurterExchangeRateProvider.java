package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;
import com.dradmin.exception.ExternalServiceException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads ECB reference rates from the Frankfurter API ({@code GET /latest?from=EUR&to=USD,GBP}).
 */
@Slf4j
@Component
public class FrankfurterExchangeRateProvider implements ExchangeRateProvider {

    @Autowired
    private RestTemplate restTemplate;

    @Value("${dradmin.exchange-rates.provider-url:https://api.frankfurter.app}")
    private String baseUrl;

    @Override
    public RateSource source() {
        return RateSource.FRANKFURTER;
    }

    @Override
    public Map<String, BigDecimal> fetchLatestRates(String baseCurrency, Collection<String> targetCurrencies) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/latest")
                .queryParam("from", baseCurrency)
                .queryParam("to", String.join(",", targetCurrencies))
                .toUriString();
        log.info("Fetching exchange rates from {}", url);
        FrankfurterResponse response;
        try {
            response = restTemplate.getForObject(url, FrankfurterResponse.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException("Exchange rate download failed: " + e.getMessage(), e);
        }
        if (response == null || response.getRates() == null) {
            throw new ExternalServiceException("Exchange rate provider returned no rates");
        }
        Map<String, BigDecimal> rates = new TreeMap<>();
        response.getRates().forEach((code, rate) -> rates.put(code.toUpperCase(), rate));
        return rates;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class FrankfurterResponse {
        private BigDecimal amount;
        private String base;
        private String date;
        private Map<String, BigDecimal> rates;
    }
}
