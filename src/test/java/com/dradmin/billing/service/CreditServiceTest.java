package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.billing.dto.CreditTransactionDTO;
import com.dradmin.billing.dto.CreditTransactionRequest;
import com.dradmin.billing.entity.CreditTransaction;
import com.dradmin.billing.entity.CreditTransaction.CreditTransactionType;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.PaymentTransaction.PaymentGateway;
import com.dradmin.billing.repository.CreditTransactionRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.repository.ICustomerRepo;

@ExtendWith(MockitoExtension.class)
class CreditServiceTest {

    @Mock
    private CreditTransactionRepository creditTransactionRepository;

    @Mock
    private ICustomerRepo customerRepo;

    @Mock
    private InvoiceService invoiceService;

    @Mock
    private PaymentService paymentService;

    @InjectMocks
    private CreditService creditService;

    private Customer customer;

    @BeforeEach
    void setUp() {
        customer = Customer.builder().id(1L).name("Acme").balance(new BigDecimal("30.00"))
                .creditLimit(new BigDecimal("20.00")).build();
    }

    private void ledgerSavesEcho() {
        when(creditTransactionRepository.save(any(CreditTransaction.class))).thenAnswer(inv -> {
            CreditTransaction tx = inv.getArgument(0);
            tx.setId(99L);
            return tx;
        });
    }

    @Test
    void depositRaisesBalanceAndRecordsBalanceAfter() {
        when(customerRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        ledgerSavesEcho();

        CreditTransactionDTO tx = creditService.addCredit(1L, new BigDecimal("12.5"), "Top up");

        assertThat(tx.getType()).isEqualTo(CreditTransactionType.DEPOSIT);
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("42.50");
        assertThat(customer.getBalance()).isEqualByComparingTo("42.50");
    }

    @Test
    void deductionMayUseCreditLimit() {
        when(customerRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        ledgerSavesEcho();

        CreditTransactionDTO tx = creditService.deductCredit(1L, new BigDecimal("50.00"), null, "Renewal");

        assertThat(tx.getAmount()).isEqualByComparingTo("-50.00");
        assertThat(customer.getBalance()).isEqualByComparingTo("-20.00");
    }

    @Test
    void deductionBeyondAvailableIsRejected() {
        when(customerRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));

        assertThatThrownBy(() -> creditService.deductCredit(1L, new BigDecimal("50.01"), null, null))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("Insufficient credit");
        verify(creditTransactionRepository, never()).save(any());
    }

    @Test
    void deductionAgainstInvoiceBooksCreditPayment() {
        Invoice invoice = Invoice.builder().id(5L).invoiceNumber("INV-000005").customer(customer).build();
        when(invoiceService.getInvoiceEntity(5L)).thenReturn(invoice);
        when(customerRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        ledgerSavesEcho();

        creditService.deductCredit(1L, new BigDecimal("10"), 5L, "Invoice payment");

        verify(paymentService).recordCompletedPayment(eq(5L), eq(new BigDecimal("10")), eq(PaymentGateway.CREDIT),
                anyString());
    }

    @Test
    void invoiceOfAnotherCustomerIsRejected() {
        Customer other = Customer.builder().id(2L).build();
        when(invoiceService.getInvoiceEntity(5L))
                .thenReturn(Invoice.builder().id(5L).invoiceNumber("INV-000005").customer(other).build());

        assertThatThrownBy(() -> creditService.deductCredit(1L, BigDecimal.ONE, 5L, null))
                .isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void zeroAmountTransactionIsInvalid() {
        CreditTransactionRequest request = CreditTransactionRequest.builder().customerId(1L)
                .type(CreditTransactionType.ADJUSTMENT).amount(BigDecimal.ZERO).build();

        assertThatThrownBy(() -> creditService.createTransaction(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refundIsAlwaysCredited() {
        when(customerRepo.findByIdForUpdate(1L)).thenReturn(Optional.of(customer));
        ledgerSavesEcho();

        CreditTransactionDTO tx = creditService.createTransaction(CreditTransactionRequest.builder().customerId(1L)
                .type(CreditTransactionType.REFUND).amount(new BigDecimal("-5")).build());

        assertThat(tx.getAmount()).isEqualByComparingTo("5.00");
    }

    @Test
    void sufficientCreditCountsCreditLimit() {
        when(customerRepo.findById(1L)).thenReturn(Optional.of(customer));

        assertThat(creditService.hasSufficientCredit(1L, new BigDecimal("50"))).isTrue();
        assertThat(creditService.hasSufficientCredit(1L, new BigDecimal("50.01"))).isFalse();
    }
}
