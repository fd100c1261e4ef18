package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.dradmin.billing.dto.PaymentIntentDTO;
import com.dradmin.billing.dto.PaymentMethodDTO;
import com.dradmin.billing.dto.RefundDTO;
import com.dradmin.exception.NotImplementedFeatureException;

class PlaceholderServicesTest {

    private final RefundService refundService = new RefundService();
    private final PaymentIntentService paymentIntentService = new PaymentIntentService();
    private final CustomerPaymentMethodService paymentMethodService = new CustomerPaymentMethodService();

    @Test
    void listingsAreEmpty() {
        assertThat(refundService.getAllRefunds()).isEmpty();
        assertThat(refundService.getRefundsByInvoice(1L)).isEmpty();
        assertThat(paymentIntentService.getAllPaymentIntents()).isEmpty();
        assertThat(paymentIntentService.getPaymentIntentsByCustomer(1L)).isEmpty();
        assertThat(paymentMethodService.getPaymentMethodsByCustomer(1L)).isEmpty();
    }

    @Test
    void refundOperationsAreNotImplemented() {
        assertThatThrownBy(() -> refundService.getRefundById(1L)).isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> refundService.createRefund(new RefundDTO()))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> refundService.processRefund(1L)).isInstanceOf(NotImplementedFeatureException.class);
    }

    @Test
    void paymentIntentOperationsAreNotImplemented() {
        assertThatThrownBy(() -> paymentIntentService.createPaymentIntent(new PaymentIntentDTO()))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> paymentIntentService.confirmPaymentIntent(1L))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> paymentIntentService.cancelPaymentIntent(1L))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> paymentIntentService.handleWebhook("{}", "t=1,v1=abc"))
                .isInstanceOf(NotImplementedFeatureException.class);
    }

    @Test
    void storedPaymentMethodsAreNotImplemented() {
        assertThatThrownBy(() -> paymentMethodService.createPaymentMethod(new PaymentMethodDTO()))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> paymentMethodService.setDefaultPaymentMethod(1L, 2L))
                .isInstanceOf(NotImplementedFeatureException.class);
        assertThatThrownBy(() -> paymentMethodService.deletePaymentMethod(2L))
                .isInstanceOf(NotImplementedFeatureException.class);
    }
}
