package com.dradmin.billing.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.CurrencyExchangeRate;
import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;

@Repository
public interface CurrencyExchangeRateRepository extends JpaRepository<CurrencyExchangeRate, Long> {

    List<CurrencyExchangeRate> findAllByOrderByEffectiveDateDesc();

    @Query("SELECT r FROM CurrencyExchangeRate r WHERE r.active = true "
            + "AND (r.expiryDate IS NULL OR r.expiryDate > :now) ORDER BY r.baseCurrency, r.targetCurrency")
    List<CurrencyExchangeRate> findActive(@Param("now") LocalDateTime now);

    @Query("SELECT r FROM CurrencyExchangeRate r WHERE r.baseCurrency = :base AND r.targetCurrency = :target "
            + "AND r.active = true AND r.effectiveDate <= :at AND (r.expiryDate IS NULL OR r.expiryDate > :at) "
            + "ORDER BY r.effectiveDate DESC")
    List<CurrencyExchangeRate> findApplicable(@Param("base") String base, @Param("target") String target,
                                              @Param("at") LocalDateTime at);

    List<CurrencyExchangeRate> findByBaseCurrencyAndTargetCurrencyOrderByEffectiveDateDesc(String base, String target);

    List<CurrencyExchangeRate> findByBaseCurrencyAndTargetCurrencyAndSourceAndActiveTrue(String base, String target,
                                                                                       RateSource source);

    @Query("SELECT r FROM CurrencyExchangeRate r WHERE r.active = true AND r.expiryDate IS NOT NULL AND r.expiryDate <= :now")
    List<CurrencyExchangeRate> findActiveExpired(@Param("now") LocalDateTime now);

    default Optional<CurrencyExchangeRate> findLatestApplicable(String base, String target, LocalDateTime at) {
        return findApplicable(base, target, at).stream().findFirst();
    }
}
