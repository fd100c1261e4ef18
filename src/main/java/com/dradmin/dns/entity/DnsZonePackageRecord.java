package com.dradmin.dns.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Template record. {@code {domain}} in the value is replaced with the domain name when applied.
 */
@Entity
@Table(name = "dns_zone_package_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DnsZonePackageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "zone_package_id", nullable = false)
    private DnsZonePackage zonePackage;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "record_type_id", nullable = false)
    private DnsRecordType type;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "record_value", nullable = false, length = 4000)
    private String value;

    private int ttl;

    private Integer priority;

    private Integer weight;

    private Integer port;

    @Column(length = 255)
    private String notes;
}
