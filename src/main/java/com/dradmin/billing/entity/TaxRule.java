package com.dradmin.billing.entity;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tax_rules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaxRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2)
    private String countryCode;

    // null means the whole country
    @Column(length = 10)
    private String stateCode;

    @Column(nullable = false, length = 50)
    private String taxName;

    @Column(nullable = false, precision = 6, scale = 3)
    private BigDecimal rate;

    @Builder.Default
    private boolean appliesToSetupFees = true;

    private boolean reverseCharge;

    private LocalDate effectiveFrom;

    private LocalDate effectiveUntil;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int priority = 0;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isEffectiveOn(LocalDate date) {
        return active
                && (effectiveFrom == null || !effectiveFrom.isAfter(date))
                && (effectiveUntil == null || !effectiveUntil.isBefore(date));
    }
}
