package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.billing.dto.InvoiceDTO;
import com.dradmin.billing.dto.InvoiceLineDTO;
import com.dradmin.billing.dto.InvoiceRequestDTO;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.Invoice.InvoiceStatus;
import com.dradmin.billing.entity.InvoiceLine;
import com.dradmin.billing.entity.TaxRule;
import com.dradmin.billing.repository.InvoiceRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.service.CustomerService;
import com.dradmin.service.SystemSettingService;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private CustomerService customerService;

    @Mock
    private SystemSettingService settingService;

    @Mock
    private TaxService taxService;

    @InjectMocks
    private InvoiceService invoiceService;

    private Customer customer;

    @BeforeEach
    void setUp() {
        customer = Customer.builder().id(7L).name("Acme").email("billing@acme.test").countryCode("NO")
                .preferredCurrency("NOK").build();
    }

    private Invoice draft(InvoiceLine... lines) {
        Invoice invoice = Invoice.builder().id(1L).invoiceNumber("INV-000001").customer(customer).build();
        for (InvoiceLine line : lines) {
            invoice.addLine(line);
        }
        invoiceService.recalculateTotals(invoice);
        return invoice;
    }

    private static InvoiceLine line(String qty, String price, boolean taxable) {
        return InvoiceLine.builder().description("item").quantity(new BigDecimal(qty))
                .unitPrice(new BigDecimal(price)).taxable(taxable).build();
    }

    @Test
    void createInvoiceNumbersFromSequenceAndDefaultsCurrencyToCustomer() {
        when(customerService.getCustomerEntity(7L)).thenReturn(customer);
        when(settingService.nextSequenceValue(SystemSettingService.INVOICE_SEQUENCE, 1L)).thenReturn(42L);
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        InvoiceRequestDTO request = InvoiceRequestDTO.builder()
                .customerId(7L)
                .lines(List.of(InvoiceLineDTO.builder().description("Hosting").quantity(new BigDecimal("2"))
                        .unitPrice(new BigDecimal("10.00")).taxable(true).build()))
                .build();

        InvoiceDTO created = invoiceService.createInvoice(request);

        assertThat(created.getInvoiceNumber()).isEqualTo("INV-000042");
        assertThat(created.getCurrencyCode()).isEqualTo("NOK");
        assertThat(created.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
        assertThat(created.getSubTotal()).isEqualByComparingTo("20.00");
    }

    @Test
    void issueAppliesTaxToTaxableLinesOnly() {
        Invoice invoice = draft(line("1", "100", true), line("1", "50", false));
        TaxRule mva = TaxRule.builder().countryCode("NO").taxName("MVA").rate(new BigDecimal("25")).build();
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(invoice));
        when(taxService.findApplicableRule(customer)).thenReturn(Optional.of(mva));
        when(taxService.isReverseCharge(mva, customer)).thenReturn(false);
        when(customerService.ensureCustomerNumber(customer)).thenReturn(customer);
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        InvoiceDTO issued = invoiceService.issueInvoice(1L);

        assertThat(issued.getStatus()).isEqualTo(InvoiceStatus.ISSUED);
        assertThat(issued.getSubTotal()).isEqualByComparingTo("150.00");
        assertThat(issued.getTaxAmount()).isEqualByComparingTo("25.00");
        assertThat(issued.getTotalAmount()).isEqualByComparingTo("175.00");
        assertThat(issued.getIssueDate()).isEqualTo(LocalDate.now());
        assertThat(issued.getDueDate()).isEqualTo(LocalDate.now().plusDays(InvoiceService.DEFAULT_PAYMENT_TERM_DAYS));
    }

    @Test
    void cannotIssueEmptyInvoice() {
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(draft()));

        assertThatThrownBy(() -> invoiceService.issueInvoice(1L)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void issuedInvoiceLinesAreLocked() {
        Invoice invoice = draft(line("1", "10", true));
        invoice.setStatus(InvoiceStatus.ISSUED);
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(invoice));

        assertThatThrownBy(() -> invoiceService.addLine(1L, InvoiceLineDTO.builder().description("x")
                .quantity(BigDecimal.ONE).unitPrice(BigDecimal.TEN).build()))
                .isInstanceOf(BusinessRuleException.class);
        verify(invoiceRepository, never()).save(any());
    }

    @Test
    void discountedLineIsFlooredAtZeroButCreditLineStaysNegative() {
        InvoiceLine discounted = line("1", "10", true);
        discounted.setDiscount(new BigDecimal("15"));
        Invoice invoice = draft(discounted, line("1", "-5", false));

        assertThat(discounted.getLineTotal()).isEqualByComparingTo("0.00");
        assertThat(invoice.getSubTotal()).isEqualByComparingTo("-5.00");
    }

    @Test
    void paymentMarksInvoicePaidWhenNothingDue() {
        Invoice invoice = draft(line("1", "40", false));
        invoice.setStatus(InvoiceStatus.ISSUED);
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(invoice));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        invoiceService.applyPayment(1L, new BigDecimal("15"));
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.ISSUED);
        assertThat(invoice.getAmountDue()).isEqualByComparingTo("25.00");

        invoiceService.applyPayment(1L, new BigDecimal("25"));
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
        assertThat(invoice.getPaidAt()).isNotNull();
    }

    @Test
    void paymentOnDraftIsRejected() {
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(draft(line("1", "40", false))));

        assertThatThrownBy(() -> invoiceService.applyPayment(1L, BigDecimal.ONE))
                .isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void nonPositivePaymentIsRejected() {
        assertThatThrownBy(() -> invoiceService.applyPayment(1L, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        verify(invoiceRepository, never()).findWithLinesById(anyLong());
    }

    @Test
    void paidInvoiceCannotBeCancelledOrDeleted() {
        Invoice invoice = draft(line("1", "10", true));
        invoice.setStatus(InvoiceStatus.PAID);
        when(invoiceRepository.findWithLinesById(1L)).thenReturn(Optional.of(invoice));

        assertThatThrownBy(() -> invoiceService.cancelInvoice(1L)).isInstanceOf(BusinessRuleException.class);
        assertThatThrownBy(() -> invoiceService.deleteInvoice(1L)).isInstanceOf(BusinessRuleException.class);
    }

    @Test
    void markOverdueUpdatesIssuedPastDue() {
        Invoice late = draft(line("1", "10", true));
        late.setStatus(InvoiceStatus.ISSUED);
        when(invoiceRepository.findIssuedPastDue(eq(LocalDate.now()))).thenReturn(List.of(late));

        assertThat(invoiceService.markOverdueInvoices()).isEqualTo(1);
        assertThat(late.getStatus()).isEqualTo(InvoiceStatus.OVERDUE);
    }
}
