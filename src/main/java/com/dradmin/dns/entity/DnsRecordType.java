package com.dradmin.dns.entity;

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
@Table(name = "dns_record_types")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DnsRecordType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 10)
    private String type;

    @Column(length = 255)
    private String description;

    private boolean hasPriority;

    private boolean hasWeight;

    private boolean hasPort;

    @Builder.Default
    private boolean editableByUser = true;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int defaultTtl = 3600;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        type = type.trim().toUpperCase();
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        type = type.trim().toUpperCase();
        updatedAt = LocalDateTime.now();
    }
}
