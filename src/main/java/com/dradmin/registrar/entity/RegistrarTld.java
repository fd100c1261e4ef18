package com.dradmin.registrar.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "registrar_tlds", uniqueConstraints = @UniqueConstraint(columnNames = {"registrar_id", "tld_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrarTld {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "registrar_id", nullable = false)
    private Registrar registrar;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tld_id", nullable = false)
    private Tld tld;

    @Column(precision = 12, scale = 2)
    private BigDecimal registrationCost;

    @Column(precision = 12, scale = 2)
    private BigDecimal renewalCost;

    @Column(precision = 12, scale = 2)
    private BigDecimal transferCost;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    @Builder.Default
    private boolean active = true;

    private boolean autoRenew;

    @Builder.Default
    private int minRegistrationYears = 1;

    @Builder.Default
    private int maxRegistrationYears = 10;

    @Column(length = 500)
    private String notes;

    private LocalDateTime lastSyncedAt;

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
}
