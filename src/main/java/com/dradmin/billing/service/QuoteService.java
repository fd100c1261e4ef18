package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.InvoiceDTO;
import com.dradmin.billing.dto.QuoteDTO;
import com.dradmin.billing.dto.QuoteLineDTO;
import com.dradmin.billing.dto.QuoteRequestDTO;
import com.dradmin.billing.dto.TaxCalculationResult;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.InvoiceLine;
import com.dradmin.billing.entity.Quote;
import com.dradmin.billing.entity.Quote.QuoteStatus;
import com.dradmin.billing.entity.QuoteLine;
import com.dradmin.billing.repository.QuoteRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.service.CustomerService;
import com.dradmin.service.SystemSettingService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class QuoteService {

    static final int DEFAULT_VALIDITY_DAYS = 30;

    @Autowired
    private QuoteRepository quoteRepository;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private SystemSettingService settingService;

    @Autowired
    private CouponService couponService;

    @Autowired
    private TaxService taxService;

    @Autowired
    private InvoiceService invoiceService;

    @Transactional(readOnly = true)
    public List<QuoteDTO> getAllQuotes() {
        return quoteRepository.findAllByOrderByCreatedAtDesc().stream().map(QuoteDTO::summaryOf).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<QuoteDTO> getQuotesByCustomer(Long customerId) {
        return quoteRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
                .map(QuoteDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public QuoteDTO getQuoteById(Long id) {
        return QuoteDTO.fromEntity(find(id));
    }

    public QuoteDTO createQuote(QuoteRequestDTO request) {
        Customer customer = customerService.getCustomerEntity(request.getCustomerId());
        long number = settingService.nextSequenceValue(SystemSettingService.QUOTE_SEQUENCE, 1L);
        Quote quote = Quote.builder()
                .quoteNumber(String.format("QUO-%06d", number))
                .customer(customer)
                .currencyCode(request.getCurrencyCode() != null
                        ? request.getCurrencyCode().toUpperCase() : customer.getPreferredCurrency())
                .validUntil(request.getValidUntil() != null
                        ? request.getValidUntil() : LocalDate.now().plusDays(DEFAULT_VALIDITY_DAYS))
                .notes(request.getNotes())
                .build();
        if (request.getCouponCode() != null && !request.getCouponCode().isBlank()) {
            quote.setCoupon(couponService.getRedeemableCoupon(request.getCouponCode()));
        }
        if (request.getLines() != null) {
            request.getLines().forEach(line -> quote.addLine(toLine(line)));
        }
        recalculateTotals(quote);
        Quote saved = quoteRepository.save(quote);
        log.info("Created quote {} for customer {}", saved.getQuoteNumber(), customer.getId());
        return QuoteDTO.fromEntity(saved);
    }

    public QuoteDTO updateQuote(Long id, QuoteRequestDTO request) {
        Quote quote = requireDraft(find(id));
        if (!quote.getCustomer().getId().equals(request.getCustomerId())) {
            quote.setCustomer(customerService.getCustomerEntity(request.getCustomerId()));
        }
        if (request.getCurrencyCode() != null) {
            quote.setCurrencyCode(request.getCurrencyCode().toUpperCase());
        }
        if (request.getValidUntil() != null) {
            quote.setValidUntil(request.getValidUntil());
        }
        quote.setNotes(request.getNotes());
        recalculateTotals(quote);
        log.info("Updated quote {}", quote.getQuoteNumber());
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    public void deleteQuote(Long id) {
        Quote quote = find(id);
        if (quote.getStatus() == QuoteStatus.ACCEPTED || quote.getStatus() == QuoteStatus.CONVERTED) {
            throw new BusinessRuleException("Accepted or converted quotes cannot be deleted");
        }
        quoteRepository.delete(quote);
        log.info("Deleted quote {}", quote.getQuoteNumber());
    }

    public QuoteDTO addLine(Long quoteId, QuoteLineDTO lineDto) {
        Quote quote = requireDraft(find(quoteId));
        quote.addLine(toLine(lineDto));
        recalculateTotals(quote);
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    public QuoteDTO removeLine(Long quoteId, Long lineId) {
        Quote quote = requireDraft(find(quoteId));
        QuoteLine line = quote.getLines().stream()
                .filter(l -> l.getId() != null && l.getId().equals(lineId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Quote line", lineId));
        quote.getLines().remove(line);
        recalculateTotals(quote);
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    public QuoteDTO applyCoupon(Long quoteId, String couponCode) {
        Quote quote = requireDraft(find(quoteId));
        quote.setCoupon(couponCode == null || couponCode.isBlank() ? null : couponService.getRedeemableCoupon(couponCode));
        recalculateTotals(quote);
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    public QuoteDTO sendQuote(Long id) {
        Quote quote = requireDraft(find(id));
        if (quote.getLines().isEmpty()) {
            throw new BusinessRuleException("Cannot send a quote without lines");
        }
        recalculateTotals(quote);
        quote.setStatus(QuoteStatus.SENT);
        quote.setSentAt(LocalDateTime.now());
        quote.setAcceptanceToken(UUID.randomUUID().toString().replace("-", ""));
        log.info("Sent quote {}", quote.getQuoteNumber());
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    @Transactional(noRollbackFor = BusinessRuleException.class)
    public QuoteDTO acceptQuote(String token) {
        Quote quote = findSentByToken(token);
        if (quote.getCoupon() != null) {
            couponService.registerUse(quote.getCoupon());
        }
        quote.setStatus(QuoteStatus.ACCEPTED);
        quote.setAcceptedAt(LocalDateTime.now());
        log.info("Quote {} accepted", quote.getQuoteNumber());
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    @Transactional(noRollbackFor = BusinessRuleException.class)
    public QuoteDTO rejectQuote(String token, String reason) {
        Quote quote = findSentByToken(token);
        quote.setStatus(QuoteStatus.REJECTED);
        quote.setRejectedAt(LocalDateTime.now());
        quote.setRejectionReason(reason);
        log.info("Quote {} rejected", quote.getQuoteNumber());
        return QuoteDTO.fromEntity(quoteRepository.save(quote));
    }

    /**
     * Turns an accepted quote into a draft invoice: one line per quote line, one per setup fee and
     * a negative line for the discount.
     */
    public InvoiceDTO convertToInvoice(Long id) {
        Quote quote = find(id);
        if (quote.getStatus() != QuoteStatus.ACCEPTED) {
            throw new BusinessRuleException("Only accepted quotes can be converted, quote is " + quote.getStatus());
        }
        List<InvoiceLine> lines = new ArrayList<>();
        for (QuoteLine line : quote.getLines()) {
            lines.add(InvoiceLine.builder()
                    .description(line.getDescription())
                    .quantity(line.getQuantity())
                    .unitPrice(line.getUnitPrice())
                    .discount(BigDecimal.ZERO)
                    .taxable(line.isTaxable())
                    .build());
            if (line.getSetupFee() != null && line.getSetupFee().signum() > 0) {
                lines.add(InvoiceLine.builder()
                        .description("Setup fee: " + line.getDescription())
                        .quantity(BigDecimal.ONE)
                        .unitPrice(line.getSetupFee())
                        .discount(BigDecimal.ZERO)
                        .taxable(line.isTaxable())
                        .build());
            }
        }
        if (quote.getDiscountAmount().signum() > 0) {
            String label = quote.getCoupon() != null ? "Discount (" + quote.getCoupon().getCode() + ")" : "Discount";
            lines.add(InvoiceLine.builder()
                    .description(label)
                    .quantity(BigDecimal.ONE)
                    .unitPrice(quote.getDiscountAmount().negate())
                    .discount(BigDecimal.ZERO)
                    .taxable(true)
                    .build());
        }
        Invoice invoice = invoiceService.createDraftInvoice(quote.getCustomer(), quote.getCurrencyCode(),
                "Created from quote " + quote.getQuoteNumber(), lines);
        quote.setStatus(QuoteStatus.CONVERTED);
        quote.setInvoiceId(invoice.getId());
        quoteRepository.save(quote);
        log.info("Converted quote {} to invoice {}", quote.getQuoteNumber(), invoice.getInvoiceNumber());
        return InvoiceDTO.fromEntity(invoice);
    }

    /**
     * SENT quotes past their validUntil date become EXPIRED.
     */
    public int expireOutdatedQuotes() {
        List<Quote> outdated = quoteRepository.findSentPastValidity(LocalDate.now());
        outdated.forEach(quote -> {
            quote.setStatus(QuoteStatus.EXPIRED);
            quoteRepository.save(quote);
        });
        log.info("Expired {} quotes", outdated.size());
        return outdated.size();
    }

    void recalculateTotals(Quote quote) {
        BigDecimal subTotal = BigDecimal.ZERO;
        BigDecimal setupTotal = BigDecimal.ZERO;
        BigDecimal taxableRecurring = BigDecimal.ZERO;
        BigDecimal taxableSetup = BigDecimal.ZERO;
        for (QuoteLine line : quote.getLines()) {
            BigDecimal recurring = line.getRecurringTotal();
            BigDecimal setup = Money.nonNull(line.getSetupFee());
            subTotal = subTotal.add(recurring);
            setupTotal = setupTotal.add(setup);
            if (line.isTaxable()) {
                taxableRecurring = taxableRecurring.add(recurring);
                taxableSetup = taxableSetup.add(setup);
            }
        }
        subTotal = Money.round(subTotal);
        setupTotal = Money.round(setupTotal);
        BigDecimal base = subTotal.add(setupTotal);
        BigDecimal discount = CouponService.discountFor(quote.getCoupon(), base);

        // discount reduces both taxable parts in proportion to the base
        BigDecimal factor = base.signum() > 0
                ? BigDecimal.ONE.subtract(discount.divide(base, 10, RoundingMode.HALF_UP))
                : BigDecimal.ONE;
        TaxCalculationResult recurringTax = taxService.calculateTax(quote.getCustomer(),
                taxableRecurring.multiply(factor), false);
        TaxCalculationResult setupTax = taxService.calculateTax(quote.getCustomer(),
                taxableSetup.multiply(factor), true);
        BigDecimal tax = Money.round(recurringTax.getTaxAmount().add(setupTax.getTaxAmount()));

        quote.setSubTotal(subTotal);
        quote.setTotalSetupFee(setupTotal);
        quote.setDiscountAmount(discount);
        quote.setTaxAmount(tax);
        quote.setTaxRate(recurringTax.getTaxRate());
        quote.setTaxName(recurringTax.getTaxName());
        quote.setTotalAmount(Money.round(base.subtract(discount).add(tax)));
    }

    private Quote findSentByToken(String token) {
        Quote quote = quoteRepository.findByAcceptanceToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Quote not found for token"));
        if (quote.getStatus() != QuoteStatus.SENT) {
            throw new BusinessRuleException("Quote " + quote.getQuoteNumber() + " is " + quote.getStatus());
        }
        if (quote.getValidUntil() != null && quote.getValidUntil().isBefore(LocalDate.now())) {
            quote.setStatus(QuoteStatus.EXPIRED);
            quoteRepository.save(quote);
            throw new BusinessRuleException("Quote " + quote.getQuoteNumber() + " has expired");
        }
        return quote;
    }

    private Quote requireDraft(Quote quote) {
        if (quote.getStatus() != QuoteStatus.DRAFT) {
            throw new BusinessRuleException("Quote " + quote.getQuoteNumber() + " is " + quote.getStatus()
                    + " and can no longer be modified");
        }
        return quote;
    }

    private Quote find(Long id) {
        return quoteRepository.findWithLinesById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Quote", id));
    }

    private QuoteLine toLine(QuoteLineDTO dto) {
        return QuoteLine.builder()
                .description(dto.getDescription())
                .quantity(dto.getQuantity() != null ? dto.getQuantity() : BigDecimal.ONE)
                .unitPrice(dto.getUnitPrice())
                .setupFee(Money.nonNull(dto.getSetupFee()))
                .taxable(dto.isTaxable())
                .build();
    }
}
