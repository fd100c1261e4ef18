package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hosted checkout provider used to collect invoice payments.
 */
public interface CheckoutGateway {

    CheckoutSession createCheckoutSession(CheckoutRequest request);

    /**
     * Verifies the signature of a webhook delivery and extracts the fields we act on.
     *
     * @throws IllegalArgumentException when the signature or payload is invalid
     */
    GatewayEvent parseWebhookEvent(String payload, String signatureHeader);

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class CheckoutRequest {
        private String description;
        private BigDecimal amount;
        private String currency;
        private String customerEmail;
        private String clientReference;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class CheckoutSession {
        private String sessionId;
        private String url;
        private String paymentIntentId;
        private String status;
        private String paymentStatus;
        private LocalDateTime createdAt;
        private LocalDateTime expiresAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class GatewayEvent {
        private String type;
        private String sessionId;
        private String paymentIntentId;
        private String status;
        private String paymentStatus;
    }
}
