package com.dradmin.hosting.entity;

import java.time.LocalDateTime;

import com.dradmin.hosting.entity.HostingAccount.SyncStatus;

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
@Table(name = "hosting_email_accounts",
        uniqueConstraints = @UniqueConstraint(columnNames = {"hosting_account_id", "email_address"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HostingEmailAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "hosting_account_id", nullable = false)
    private HostingAccount hostingAccount;

    @Column(name = "email_address", nullable = false, length = 254)
    private String emailAddress;

    @Column(nullable = false, length = 64)
    private String username;

    // null is unlimited
    private Long quotaMb;

    private Long usageMb;

    private LocalDateTime lastSyncedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SyncStatus syncStatus = SyncStatus.NOT_SYNCED;

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

    /**
     * Part after the {@code @}, lower-cased.
     */
    public String getDomainPart() {
        int at = emailAddress.lastIndexOf('@');
        return at < 0 ? "" : emailAddress.substring(at + 1).toLowerCase();
    }
}
