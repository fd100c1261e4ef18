package com.dradmin.hosting.entity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import com.dradmin.entity.Customer;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
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
@Table(name = "hosting_accounts",
        uniqueConstraints = @UniqueConstraint(columnNames = {"control_panel_id", "external_account_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HostingAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "control_panel_id")
    private ServerControlPanel controlPanel;

    // account id on the panel; for cPanel this is the account user name
    @Column(name = "external_account_id", length = 100)
    private String externalAccountId;

    @Column(nullable = false, length = 50)
    private String username;

    @Column(length = 253)
    private String primaryDomain;

    @Column(length = 100)
    private String planName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AccountStatus status = AccountStatus.PENDING;

    private Long diskUsageMb;

    private Long diskQuotaMb;

    private Long bandwidthUsageMb;

    private Long bandwidthLimitMb;

    private Integer maxEmailAccounts;

    private Integer maxDatabases;

    private Integer maxFtpAccounts;

    private Integer maxSubdomains;

    private LocalDateTime lastSyncedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SyncStatus syncStatus = SyncStatus.NOT_SYNCED;

    @OneToMany(mappedBy = "hostingAccount", cascade = CascadeType.REMOVE)
    @Builder.Default
    private List<HostingDomain> domains = new ArrayList<>();

    @OneToMany(mappedBy = "hostingAccount", cascade = CascadeType.REMOVE)
    @Builder.Default
    private List<HostingEmailAccount> emailAccounts = new ArrayList<>();

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

    public enum AccountStatus {
        PENDING, ACTIVE, SUSPENDED, TERMINATED
    }

    public enum SyncStatus {
        NOT_SYNCED, SYNCED, ERROR
    }
}
