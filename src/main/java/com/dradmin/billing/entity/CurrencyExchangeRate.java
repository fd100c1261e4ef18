package com.dradmin.billing.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "currency_exchange_rates",
       indexes = @Index(name = "idx_rate_pair", columnList = "baseCurrency,targetCurrency,effectiveDate"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrencyExchangeRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 3)
    private String baseCurrency;

    @Column(nullable = false, length = 3)
    private String targetCurrency;

    @Column(nullable = false, precision = 18, scale = 8)
    private BigDecimal rate;

    @Column(nullable = false, precision = 6, scale = 3)
    @Builder.Default
    private BigDecimal markup = BigDecimal.ZERO;

    @Column(nullable = false, precision = 18, scale = 8)
    private BigDecimal effectiveRate;

    @Column(nullable = false)
    private LocalDateTime effectiveDate;

    private LocalDateTime expiryDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private RateSource source = RateSource.MANUAL;

    @Builder.Default
    private boolean active = true;

    @Column(length = 1000)
    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        normalize();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        normalize();
    }

    private void normalize() {
        baseCurrency = baseCurrency.toUpperCase();
        targetCurrency = targetCurrency.toUpperCase();
        recalculateEffectiveRate();
    }

    /**
     * effectiveRate = rate * (1 + markup / 100)
     */
    public void recalculateEffectiveRate() {
        BigDecimal m = markup == null ? BigDecimal.ZERO : markup;
        effectiveRate = rate.multiply(BigDecimal.ONE.add(m.divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP)))
                .setScale(8, RoundingMode.HALF_UP);
    }

    public boolean isValidAt(LocalDateTime at) {
        return active && !effectiveDate.isAfter(at) && (expiryDate == null || expiryDate.isAfter(at));
    }

    public enum RateSource {
        MANUAL,
        FRANKFURTER
    }
}
