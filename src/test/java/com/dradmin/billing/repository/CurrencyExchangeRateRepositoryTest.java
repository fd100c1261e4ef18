package com.dradmin.billing.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import com.dradmin.billing.entity.CurrencyExchangeRate;

@DataJpaTest
class CurrencyExchangeRateRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private CurrencyExchangeRateRepository rateRepository;

    private CurrencyExchangeRate rate(String rate, LocalDateTime effective, LocalDateTime expiry, boolean active) {
        return entityManager.persistAndFlush(CurrencyExchangeRate.builder()
                .baseCurrency("eur")
                .targetCurrency("nok")
                .rate(new BigDecimal(rate))
                .effectiveDate(effective)
                .expiryDate(expiry)
                .active(active)
                .build());
    }

    @Test
    void latestApplicableRateWins() {
        LocalDateTime now = LocalDateTime.now();
        rate("11.20", now.minusDays(10), null, true);
        rate("11.50", now.minusDays(1), null, true);
        rate("11.90", now.plusDays(1), null, true);
        rate("12.00", now.minusHours(1), null, false);

        CurrencyExchangeRate latest = rateRepository.findLatestApplicable("EUR", "NOK", now).orElseThrow();

        assertThat(latest.getRate()).isEqualByComparingTo("11.50");
    }

    @Test
    void expiredRateIsNotApplicable() {
        LocalDateTime now = LocalDateTime.now();
        rate("11.20", now.minusDays(10), now.minusDays(2), true);

        assertThat(rateRepository.findLatestApplicable("EUR", "NOK", now)).isEmpty();
        assertThat(rateRepository.findActiveExpired(now)).hasSize(1);
    }

    @Test
    void effectiveRateIncludesMarkupOnSave() {
        CurrencyExchangeRate saved = entityManager.persistFlushFind(CurrencyExchangeRate.builder()
                .baseCurrency("usd")
                .targetCurrency("eur")
                .rate(new BigDecimal("0.92"))
                .markup(new BigDecimal("2"))
                .effectiveDate(LocalDateTime.now())
                .build());

        assertThat(saved.getBaseCurrency()).isEqualTo("USD");
        assertThat(saved.getEffectiveRate()).isEqualByComparingTo("0.9384");
    }
}
