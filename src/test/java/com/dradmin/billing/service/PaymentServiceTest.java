package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.billing.dto.PaymentTransactionDTO;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.Invoice.InvoiceStatus;
import com.dradmin.billing.entity.PaymentTransaction;
import com.dradmin.billing.entity.PaymentTransaction.PaymentGateway;
import com.dradmin.billing.entity.PaymentTransaction.PaymentStatus;
import com.dradmin.billing.repository.PaymentTransactionRepository;
import com.dradmin.billing.service.CheckoutGateway.CheckoutRequest;
import com.dradmin.billing.service.CheckoutGateway.CheckoutSession;
import com.dradmin.billing.service.CheckoutGateway.GatewayEvent;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    @Mock
    private PaymentTransactionRepository transactionRepository;

    @Mock
    private InvoiceService invoiceService;

    @Mock
    private CheckoutGateway checkoutGateway;

    @InjectMocks
    private PaymentService paymentService;

    private Invoice invoice;

    @BeforeEach
    void setUp() {
        Customer customer = Customer.builder().id(3L).email("ops@acme.test").billingEmail("ap@acme.test").build();
        invoice = Invoice.builder().id(10L).invoiceNumber("INV-000010").customer(customer).currencyCode("EUR")
                .status(InvoiceStatus.ISSUED).totalAmount(new BigDecimal("120.00"))
                .amountPaid(new BigDecimal("20.00")).build();
    }

    @Test
    void checkoutIsOpenedForAmountDue() {
        when(invoiceService.getInvoiceEntity(10L)).thenReturn(invoice);
        when(checkoutGateway.createCheckoutSession(any())).thenReturn(CheckoutSession.builder()
                .sessionId("cs_test_1").url("https://checkout.test/cs_test_1")
                .expiresAt(LocalDateTime.now().plusHours(1)).build());
        when(transactionRepository.save(any(PaymentTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        PaymentTransactionDTO dto = paymentService.processInvoicePayment(10L);

        ArgumentCaptor<CheckoutRequest> request = ArgumentCaptor.forClass(CheckoutRequest.class);
        verify(checkoutGateway).createCheckoutSession(request.capture());
        assertThat(request.getValue().getAmount()).isEqualByComparingTo("100.00");
        assertThat(request.getValue().getCustomerEmail()).isEqualTo("ap@acme.test");
        assertThat(dto.getCheckoutUrl()).isEqualTo("https://checkout.test/cs_test_1");
        assertThat(dto.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(dto.getTransactionReference()).matches("TXN-\\d{14}-[0-9A-F]{8}");
    }

    @Test
    void draftInvoiceCannotBePaid() {
        invoice.setStatus(InvoiceStatus.DRAFT);
        when(invoiceService.getInvoiceEntity(10L)).thenReturn(invoice);

        assertThatThrownBy(() -> paymentService.processInvoicePayment(10L)).isInstanceOf(BusinessRuleException.class);
        verify(checkoutGateway, never()).createCheckoutSession(any());
    }

    @Test
    void completedSessionAppliesPaymentOnce() {
        PaymentTransaction tx = PaymentTransaction.builder().id(5L).invoice(invoice).sessionId("cs_1")
                .amount(new BigDecimal("100.00")).status(PaymentStatus.PENDING).build();
        when(checkoutGateway.parseWebhookEvent("{}", "sig")).thenReturn(GatewayEvent.builder()
                .type("checkout.session.completed").sessionId("cs_1").paymentIntentId("pi_1").paymentStatus("paid")
                .build());
        when(transactionRepository.findBySessionId("cs_1")).thenReturn(Optional.of(tx));

        Map<String, Object> first = paymentService.handleWebhook("{}", "sig");
        Map<String, Object> second = paymentService.handleWebhook("{}", "sig");

        assertThat(first).containsEntry("status", "COMPLETED");
        assertThat(second).containsEntry("message", "Already processed");
        assertThat(tx.getPaymentIntentId()).isEqualTo("pi_1");
        verify(invoiceService).applyPayment(10L, new BigDecimal("100.00"));
    }

    @Test
    void completedSessionForCancelledInvoiceIsKeptForReconciliation() {
        invoice.setStatus(InvoiceStatus.CANCELLED);
        PaymentTransaction tx = PaymentTransaction.builder().id(6L).invoice(invoice).sessionId("cs_2")
                .amount(new BigDecimal("100.00")).status(PaymentStatus.PENDING).build();
        when(checkoutGateway.parseWebhookEvent("{}", "sig")).thenReturn(GatewayEvent.builder()
                .type("checkout.session.completed").sessionId("cs_2").paymentStatus("paid").build());
        when(transactionRepository.findBySessionId("cs_2")).thenReturn(Optional.of(tx));

        Map<String, Object> response = paymentService.handleWebhook("{}", "sig");

        assertThat(response).containsEntry("received", true).containsEntry("status", "COMPLETED");
        assertThat(response.get("message")).asString().contains("manual reconciliation");
        assertThat(tx.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        verify(transactionRepository).save(tx);
        verify(invoiceService, never()).applyPayment(any(), any());
    }

    @Test
    void unknownEventTypeIsAcknowledged() {
        when(checkoutGateway.parseWebhookEvent("{}", "sig"))
                .thenReturn(GatewayEvent.builder().type("customer.created").build());

        assertThat(paymentService.handleWebhook("{}", "sig")).containsEntry("received", true);
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void failedIntentMarksPendingTransactionsFailed() {
        PaymentTransaction pending = PaymentTransaction.builder().id(1L).status(PaymentStatus.PENDING).build();
        PaymentTransaction done = PaymentTransaction.builder().id(2L).status(PaymentStatus.COMPLETED).build();
        when(checkoutGateway.parseWebhookEvent("{}", "sig")).thenReturn(GatewayEvent.builder()
                .type("payment_intent.payment_failed").paymentIntentId("pi_9").build());
        when(transactionRepository.findByPaymentIntentId("pi_9")).thenReturn(List.of(pending, done));

        paymentService.handleWebhook("{}", "sig");

        assertThat(pending.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(done.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
    }

    @Test
    void manualPaymentIsRecordedAsCompleted() {
        when(invoiceService.applyPayment(10L, new BigDecimal("50"))).thenReturn(invoice);
        when(transactionRepository.save(any(PaymentTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

        PaymentTransactionDTO dto = paymentService.recordManualPayment(10L, new BigDecimal("50"), "bank ref 77");

        assertThat(dto.getGateway()).isEqualTo(PaymentGateway.MANUAL);
        assertThat(dto.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(dto.getAmount()).isEqualByComparingTo("50.00");
    }

    @Test
    void expiredPendingSessionsAreClosed() {
        PaymentTransaction stale = PaymentTransaction.builder().id(1L).status(PaymentStatus.PENDING)
                .gatewayExpiresAt(LocalDateTime.now().minusMinutes(5)).build();
        when(transactionRepository.findExpiredPending(any(LocalDateTime.class))).thenReturn(List.of(stale));

        assertThat(paymentService.markExpiredSessions()).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(PaymentStatus.EXPIRED);
    }
}
