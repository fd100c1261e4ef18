package com.dradmin.dns.entity;

import java.time.LocalDateTime;

import com.dradmin.registrar.entity.RegisteredDomain;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A record in a domain zone. Changes are flagged with {@code pendingSync} until pushed to the name servers;
 * deletes are soft until the deletion has been synced.
 */
@Entity
@Table(name = "dns_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DnsRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "domain_id", nullable = false)
    private RegisteredDomain domain;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "record_type_id", nullable = false)
    private DnsRecordType type;

    // "@" for the zone apex
    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "record_value", nullable = false, length = 4000)
    private String value;

    private int ttl;

    private Integer priority;

    private Integer weight;

    private Integer port;

    @Builder.Default
    private boolean pendingSync = true;

    private boolean deleted;

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
