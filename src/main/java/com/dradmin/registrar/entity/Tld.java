package com.dradmin.registrar.entity;

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
@Table(name = "tlds")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Tld {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // stored without the leading dot, e.g. "com" or "co.uk"
    @Column(nullable = false, unique = true, length = 63)
    private String extension;

    @Column(length = 255)
    private String description;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int defaultRegistrationYears = 1;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        extension = normalize(extension);
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        extension = normalize(extension);
        updatedAt = LocalDateTime.now();
    }

    public static String normalize(String extension) {
        if (extension == null) {
            return null;
        }
        String value = extension.trim().toLowerCase();
        while (value.startsWith(".")) {
            value = value.substring(1);
        }
        return value;
    }
}
