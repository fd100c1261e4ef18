package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.dradmin.exception.ExternalServiceException;
import com.google.gson.JsonSyntaxException;
import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.PaymentIntent;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class StripeCheckoutGateway implements CheckoutGateway {

    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of("JPY", "KRW");

    @Value("${stripe.api.secret.key}")
    private String secretKey;

    @Value("${stripe.webhook.secret}")
    private String webhookSecret;

    @Value("${stripe.success-url}")
    private String successUrl;

    @Value("${stripe.cancel-url}")
    private String cancelUrl;

    @Override
    public CheckoutSession createCheckoutSession(CheckoutRequest request) {
        long unitAmount = toMinorUnits(request.getAmount(), request.getCurrency());
        SessionCreateParams params = SessionCreateParams.builder()
                .addPaymentMethodType(SessionCreateParams.PaymentMethodType.CARD)
                .addLineItem(
                    SessionCreateParams.LineItem.builder()
                        .setPriceData(
                            SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(request.getCurrency().toLowerCase())
                                .setUnitAmount(unitAmount)
                                .setProductData(
                                    SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                        .setName(request.getDescription())
                                        .build()
                                )
                                .build()
                        )
                        .setQuantity(1L)
                        .build()
                )
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(successUrl)
                .setCancelUrl(cancelUrl)
                .setCustomerEmail(request.getCustomerEmail())
                .setClientReferenceId(request.getClientReference())
                .build();

        try {
            Session session = Session.create(params, RequestOptions.builder().setApiKey(secretKey).build());
            log.info("Created Stripe checkout session {} for {}", session.getId(), request.getClientReference());
            return CheckoutSession.builder()
                    .sessionId(session.getId())
                    .url(session.getUrl())
                    .paymentIntentId(session.getPaymentIntent())
                    .status(session.getStatus())
                    .paymentStatus(session.getPaymentStatus())
                    .createdAt(fromEpoch(session.getCreated()))
                    .expiresAt(fromEpoch(session.getExpiresAt()))
                    .build();
        } catch (StripeException e) {
            log.error("Stripe checkout session creation failed: {}", e.getMessage(), e);
            throw new ExternalServiceException("Error creating checkout session: " + e.getMessage(), e);
        }
    }

    @Override
    public GatewayEvent parseWebhookEvent(String payload, String signatureHeader) {
        Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            throw new IllegalArgumentException("Webhook signature verification failed: " + e.getMessage(), e);
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Invalid webhook payload: " + e.getMessage(), e);
        }

        GatewayEvent.GatewayEventBuilder result = GatewayEvent.builder().type(event.getType());
        StripeObject object = dataObject(event);
        if (object instanceof Session) {
            Session session = (Session) object;
            result.sessionId(session.getId())
                  .paymentIntentId(session.getPaymentIntent())
                  .status(session.getStatus())
                  .paymentStatus(session.getPaymentStatus());
        } else if (object instanceof PaymentIntent) {
            PaymentIntent intent = (PaymentIntent) object;
            result.paymentIntentId(intent.getId()).status(intent.getStatus());
        }
        return result.build();
    }

    private StripeObject dataObject(Event event) {
        if (event.getDataObjectDeserializer().getObject().isPresent()) {
            return event.getDataObjectDeserializer().getObject().get();
        }
        try {
            // API version of the event differs from the SDK's pinned version
            return event.getDataObjectDeserializer().deserializeUnsafe();
        } catch (EventDataObjectDeserializationException e) {
            log.warn("Could not deserialize data object of Stripe event {}: {}", event.getId(), e.getMessage());
            return null;
        }
    }

    static long toMinorUnits(BigDecimal amount, String currency) {
        if (ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
            return amount.setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        return amount.multiply(BigDecimal.valueOf(100)).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Stripe timestamps in the JVM zone, like every other timestamp the application stores.
     */
    static LocalDateTime fromEpoch(Long epochSeconds) {
        return epochSeconds == null ? null : LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneId.systemDefault());
    }
}
