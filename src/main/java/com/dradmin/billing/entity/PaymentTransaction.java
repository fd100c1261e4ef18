package com.dradmin.billing.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One payment attempt against an invoice, through a checkout session, a manual booking or customer credit.
 */
@Entity
@Table(name = "payment_transactions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 40)
    private String transactionReference;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id")
    private Invoice invoice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentGateway gateway;

    @Column(unique = true, length = 500)
    private String sessionId;

    @Column(length = 500)
    private String paymentIntentId;

    private String customerEmail;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(length = 3, nullable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    // gateway's own payment_status string
    @Column(length = 50)
    private String gatewayPaymentStatus;

    private LocalDateTime gatewayCreatedAt;

    private LocalDateTime gatewayExpiresAt;

    @Column(length = 500)
    private String notes;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
        if (status == null) {
            status = PaymentStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Maps a checkout session status reported by the gateway onto our status.
     */
    public void updateFromGatewayStatus(String paymentIntentId, String gatewayStatus) {
        if (paymentIntentId != null) {
            this.paymentIntentId = paymentIntentId;
        }
        switch (gatewayStatus == null ? "" : gatewayStatus.toLowerCase()) {
            case "complete":
            case "paid":
                this.status = PaymentStatus.COMPLETED;
                break;
            case "expired":
                this.status = PaymentStatus.EXPIRED;
                break;
            case "canceled":
            case "cancelled":
                this.status = PaymentStatus.CANCELLED;
                break;
            case "failed":
                this.status = PaymentStatus.FAILED;
                break;
            default:
                this.status = PaymentStatus.PENDING;
        }
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }

    public boolean isCompleted() {
        return status == PaymentStatus.COMPLETED;
    }

    public enum PaymentStatus {
        PENDING,
        COMPLETED,
        FAILED,
        CANCELLED,
        EXPIRED
    }

    public enum PaymentGateway {
        STRIPE,
        MANUAL,
        CREDIT
    }
}
