package com.dradmin.billing.service;

import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dradmin.billing.dto.PaymentMethodDTO;
import com.dradmin.exception.NotImplementedFeatureException;

@Service
public class CustomerPaymentMethodService {

    public List<PaymentMethodDTO> getPaymentMethodsByCustomer(Long customerId) {
        return Collections.emptyList();
    }

    public PaymentMethodDTO getPaymentMethodById(Long id) {
        throw new NotImplementedFeatureException("Payment method lookup");
    }

    public PaymentMethodDTO createPaymentMethod(PaymentMethodDTO request) {
        throw new NotImplementedFeatureException("Stored payment methods");
    }

    public PaymentMethodDTO setDefaultPaymentMethod(Long customerId, Long paymentMethodId) {
        throw new NotImplementedFeatureException("Default payment method");
    }

    public void deletePaymentMethod(Long id) {
        throw new NotImplementedFeatureException("Payment method deletion");
    }
}
