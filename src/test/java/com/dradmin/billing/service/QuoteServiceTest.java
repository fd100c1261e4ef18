package com.dradmin.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
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
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.dradmin.billing.dto.QuoteDTO;
import com.dradmin.billing.dto.TaxCalculationResult;
import com.dradmin.billing.entity.Coupon;
import com.dradmin.billing.entity.Coupon.DiscountType;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.InvoiceLine;
import com.dradmin.billing.entity.Quote;
import com.dradmin.billing.entity.Quote.QuoteStatus;
import com.dradmin.billing.entity.QuoteLine;
import com.dradmin.billing.repository.QuoteRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.service.CustomerService;
import com.dradmin.service.SystemSettingService;

@ExtendWith(MockitoExtension.class)
class QuoteServiceTest {

    @Mock
    private QuoteRepository quoteRepository;

    @Mock
    private CustomerService customerService;

    @Mock
    private SystemSettingService settingService;

    @Mock
    private CouponService couponService;

    @Mock
    private TaxService taxService;

    @Mock
    private InvoiceService invoiceService;

    @InjectMocks
    private QuoteService quoteService;

    private Customer customer;

    @BeforeEach
    void setUp() {
        customer = Customer.builder().id(4L).name("Globex").countryCode("NO").build();
        // flat 25% on whatever base is passed in
        lenient().when(taxService.calculateTax(any(Customer.class), any(BigDecimal.class), anyBoolean()))
                .thenAnswer(inv -> new TaxCalculationResult(Money.percentOf(inv.getArgument(1), new BigDecimal("25")),
                        new BigDecimal("25"), "MVA", false));
        lenient().when(quoteRepository.save(any(Quote.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Quote quote(Coupon coupon) {
        Quote quote = Quote.builder().id(1L).quoteNumber("QUO-000001").customer(customer).coupon(coupon)
                .validUntil(LocalDate.now().plusDays(10)).build();
        quote.addLine(QuoteLine.builder().description("VPS").quantity(new BigDecimal("2"))
                .unitPrice(new BigDecimal("50")).setupFee(new BigDecimal("20")).build());
        quoteService.recalculateTotals(quote);
        return quote;
    }

    @Test
    void discountReducesTaxBaseProportionally() {
        Coupon tenPercent = Coupon.builder().code("TEN").discountType(DiscountType.PERCENTAGE)
                .value(new BigDecimal("10")).build();

        Quote quote = quote(tenPercent);

        assertThat(quote.getSubTotal()).isEqualByComparingTo("100.00");
        assertThat(quote.getTotalSetupFee()).isEqualByComparingTo("20.00");
        assertThat(quote.getDiscountAmount()).isEqualByComparingTo("12.00");
        assertThat(quote.getTaxAmount()).isEqualByComparingTo("27.00");
        assertThat(quote.getTotalAmount()).isEqualByComparingTo("135.00");
    }

    @Test
    void sendIssuesAcceptanceToken() {
        Quote quote = quote(null);
        when(quoteRepository.findWithLinesById(1L)).thenReturn(Optional.of(quote));

        QuoteDTO sent = quoteService.sendQuote(1L);

        assertThat(sent.getStatus()).isEqualTo(QuoteStatus.SENT);
        assertThat(quote.getAcceptanceToken()).hasSize(32);
    }

    @Test
    void acceptCountsCouponUse() {
        Coupon coupon = Coupon.builder().code("TEN").discountType(DiscountType.PERCENTAGE).value(BigDecimal.TEN).build();
        Quote quote = quote(coupon);
        quote.setStatus(QuoteStatus.SENT);
        when(quoteRepository.findByAcceptanceToken("tok")).thenReturn(Optional.of(quote));

        quoteService.acceptQuote("tok");

        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.ACCEPTED);
        verify(couponService).registerUse(coupon);
    }

    @Test
    void acceptWithExhaustedCouponLeavesQuoteSent() {
        Coupon coupon = Coupon.builder().code("ONCE").discountType(DiscountType.FIXED).value(BigDecimal.TEN)
                .maxUses(1).timesUsed(1).build();
        Quote quote = quote(coupon);
        quote.setStatus(QuoteStatus.SENT);
        when(quoteRepository.findByAcceptanceToken("tok")).thenReturn(Optional.of(quote));
        doThrow(new BusinessRuleException("Coupon ONCE is no longer valid")).when(couponService).registerUse(coupon);

        assertThatThrownBy(() -> quoteService.acceptQuote("tok")).isInstanceOf(BusinessRuleException.class);
        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.SENT);
        assertThat(quote.getAcceptedAt()).isNull();
    }

    @Test
    void acceptingLapsedQuoteExpiresIt() {
        Quote quote = quote(null);
        quote.setStatus(QuoteStatus.SENT);
        quote.setValidUntil(LocalDate.now().minusDays(1));
        when(quoteRepository.findByAcceptanceToken("tok")).thenReturn(Optional.of(quote));

        assertThatThrownBy(() -> quoteService.acceptQuote("tok")).isInstanceOf(BusinessRuleException.class);
        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.EXPIRED);
    }

    @Test
    void rejectStoresReason() {
        Quote quote = quote(null);
        quote.setStatus(QuoteStatus.SENT);
        when(quoteRepository.findByAcceptanceToken("tok")).thenReturn(Optional.of(quote));

        quoteService.rejectQuote("tok", "Too expensive");

        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.REJECTED);
        assertThat(quote.getRejectionReason()).isEqualTo("Too expensive");
    }

    @SuppressWarnings("unchecked")
    @Test
    void convertBuildsSetupAndDiscountLines() {
        Coupon tenPercent = Coupon.builder().code("TEN").discountType(DiscountType.PERCENTAGE)
                .value(new BigDecimal("10")).build();
        Quote quote = quote(tenPercent);
        quote.setStatus(QuoteStatus.ACCEPTED);
        when(quoteRepository.findWithLinesById(1L)).thenReturn(Optional.of(quote));
        Invoice invoice = Invoice.builder().id(77L).invoiceNumber("INV-000077").customer(customer).build();
        when(invoiceService.createDraftInvoice(eq(customer), anyString(), anyString(), anyList())).thenReturn(invoice);

        quoteService.convertToInvoice(1L);

        ArgumentCaptor<List<InvoiceLine>> lines = ArgumentCaptor.forClass(List.class);
        verify(invoiceService).createDraftInvoice(eq(customer), anyString(), anyString(), lines.capture());
        assertThat(lines.getValue()).extracting(InvoiceLine::getDescription)
                .containsExactly("VPS", "Setup fee: VPS", "Discount (TEN)");
        assertThat(lines.getValue().get(2).getUnitPrice()).isEqualByComparingTo("-12.00");
        assertThat(quote.getStatus()).isEqualTo(QuoteStatus.CONVERTED);
        assertThat(quote.getInvoiceId()).isEqualTo(77L);
    }

    @Test
    void onlyAcceptedQuotesConvert() {
        Quote quote = quote(null);
        when(quoteRepository.findWithLinesById(1L)).thenReturn(Optional.of(quote));

        assertThatThrownBy(() -> quoteService.convertToInvoice(1L)).isInstanceOf(BusinessRuleException.class);
        verify(invoiceService, never()).createDraftInvoice(any(), any(), any(), anyList());
    }

    @Test
    void untaxedQuoteHasNoTaxName() {
        doAnswer(inv -> new TaxCalculationResult(BigDecimal.ZERO, BigDecimal.ZERO, null, false))
                .when(taxService).calculateTax(any(Customer.class), any(BigDecimal.class), anyBoolean());

        Quote quote = quote(null);

        assertThat(quote.getTaxAmount()).isEqualByComparingTo("0");
        assertThat(quote.getTaxName()).isNull();
        assertThat(quote.getTotalAmount()).isEqualByComparingTo("120.00");
    }
}
