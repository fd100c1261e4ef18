package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;

public interface ExchangeRateProvider {

    RateSource source();

    /**
     * Latest rates from {@code baseCurrency} to each target, keyed by upper-case target code.
     */
    Map<String, BigDecimal> fetchLatestRates(String baseCurrency, Collection<String> targetCurrencies);
}
