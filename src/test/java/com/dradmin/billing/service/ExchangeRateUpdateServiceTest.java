package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.entity.CurrencyExchangeRate;
import com.dradmin.billing.entity.CurrencyExchangeRate.RateSource;
import com.dradmin.billing.entity.ExchangeRateDownloadLog;
import com.dradmin.billing.repository.CurrencyExchangeRateRepository;
import com.dradmin.billing.repository.ExchangeRateDownloadLogRepository;
import com.dradmin.exception.ExternalServiceException;

@ExtendWith(MockitoExtension.class)
class ExchangeRateUpdateServiceTest {

    @Mock
    private ExchangeRateProvider rateProvider;

    @Mock
    private CurrencyExchangeRateRepository rateRepository;

    @Mock
    private ExchangeRateDownloadLogRepository downloadLogRepository;

    @InjectMocks
    private ExchangeRateUpdateService updateService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(updateService, "baseCurrency", "eur");
        ReflectionTestUtils.setField(updateService, "targets", "usd, EUR ,gbp,");
        ReflectionTestUtils.setField(updateService, "defaultMarkup", BigDecimal.ZERO);
        lenient().when(rateProvider.source()).thenReturn(RateSource.FRANKFURTER);
        lenient().when(downloadLogRepository.save(any(ExchangeRateDownloadLog.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @SuppressWarnings("unchecked")
    @Test
    void replacesPreviousProviderRateAndLogsSuccess() {
        when(rateProvider.fetchLatestRates(eq("EUR"), anyCollection()))
                .thenReturn(Map.of("USD", new BigDecimal("1.08"), "GBP", new BigDecimal("0.85")));
        CurrencyExchangeRate previousUsd = CurrencyExchangeRate.builder().baseCurrency("EUR").targetCurrency("USD")
                .rate(new BigDecimal("1.07")).source(RateSource.FRANKFURTER).build();
        when(rateRepository.findByBaseCurrencyAndTargetCurrencyAndSourceAndActiveTrue("EUR", "USD", RateSource.FRANKFURTER))
                .thenReturn(List.of(previousUsd));
        when(rateRepository.findByBaseCurrencyAndTargetCurrencyAndSourceAndActiveTrue("EUR", "GBP", RateSource.FRANKFURTER))
                .thenReturn(List.of());

        ExchangeRateDownloadLog log = updateService.updateRates();

        ArgumentCaptor<Collection<String>> targets = ArgumentCaptor.forClass(Collection.class);
        verify(rateProvider).fetchLatestRates(eq("EUR"), targets.capture());
        assertThat(targets.getValue()).containsExactly("USD", "GBP");
        assertThat(previousUsd.isActive()).isFalse();
        assertThat(previousUsd.getExpiryDate()).isNotNull();
        verify(rateRepository, times(3)).save(any(CurrencyExchangeRate.class));
        assertThat(log.isSuccess()).isTrue();
        assertThat(log.getRatesUpdated()).isEqualTo(2);
    }

    @Test
    void providerFailureIsLoggedAndRethrown() {
        when(rateProvider.fetchLatestRates(eq("EUR"), anyCollection()))
                .thenThrow(new ExternalServiceException("provider down"));

        assertThatThrownBy(() -> updateService.updateRates()).isInstanceOf(ExternalServiceException.class);

        ArgumentCaptor<ExchangeRateDownloadLog> saved = ArgumentCaptor.forClass(ExchangeRateDownloadLog.class);
        verify(downloadLogRepository).save(saved.capture());
        assertThat(saved.getValue().isSuccess()).isFalse();
        assertThat(saved.getValue().getErrorMessage()).isEqualTo("provider down");
    }

    @Test
    void scheduledFailureIsSwallowedAndStillLogged() {
        when(rateProvider.fetchLatestRates(eq("EUR"), anyCollection()))
                .thenThrow(new ExternalServiceException("provider down"));

        updateService.scheduledUpdate();

        ArgumentCaptor<ExchangeRateDownloadLog> saved = ArgumentCaptor.forClass(ExchangeRateDownloadLog.class);
        verify(downloadLogRepository).save(saved.capture());
        assertThat(saved.getValue().isSuccess()).isFalse();
    }

    @Test
    void scheduledRunCommitsFailureLog() throws NoSuchMethodException {
        Transactional tx = AnnotationUtils.findAnnotation(
                ExchangeRateUpdateService.class.getMethod("scheduledUpdate"), Transactional.class);

        assertThat(tx).isNotNull();
        assertThat(tx.noRollbackFor()).contains(ExternalServiceException.class);
    }
}
