package com.dradmin.billing.service;

import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dradmin.billing.dto.PaymentIntentDTO;
import com.dradmin.exception.NotImplementedFeatureException;

/**
 * Placeholder for direct payment intents; invoice payments go through checkout sessions in {@link PaymentService}.
 */
@Service
public class PaymentIntentService {

    public List<PaymentIntentDTO> getAllPaymentIntents() {
        return Collections.emptyList();
    }

    public List<PaymentIntentDTO> getPaymentIntentsByCustomer(Long customerId) {
        return Collections.emptyList();
    }

    public PaymentIntentDTO getPaymentIntentById(Long id) {
        throw new NotImplementedFeatureException("Payment intent lookup");
    }

    public PaymentIntentDTO createPaymentIntent(PaymentIntentDTO request) {
        throw new NotImplementedFeatureException("Payment intent creation");
    }

    public PaymentIntentDTO confirmPaymentIntent(Long id) {
        throw new NotImplementedFeatureException("Payment intent confirmation");
    }

    public PaymentIntentDTO cancelPaymentIntent(Long id) {
        throw new NotImplementedFeatureException("Payment intent cancellation");
    }

    public void handleWebhook(String payload, String signature) {
        throw new NotImplementedFeatureException("Payment intent webhook");
    }
}
