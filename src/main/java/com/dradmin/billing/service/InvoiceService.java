package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

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
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.service.CustomerService;
import com.dradmin.service.SystemSettingService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class InvoiceService {

    static final int DEFAULT_PAYMENT_TERM_DAYS = 14;

    private static final EnumSet<InvoiceStatus> CANCELLABLE =
            EnumSet.of(InvoiceStatus.DRAFT, InvoiceStatus.ISSUED, InvoiceStatus.OVERDUE);

    private static final EnumSet<InvoiceStatus> PAYABLE =
            EnumSet.of(InvoiceStatus.ISSUED, InvoiceStatus.OVERDUE);

    @Autowired
    private InvoiceRepository invoiceRepository;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private SystemSettingService settingService;

    @Autowired
    private TaxService taxService;

    @Transactional(readOnly = true)
    public List<InvoiceDTO> getAllInvoices() {
        return invoiceRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(InvoiceDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<InvoiceDTO> getInvoicesByCustomer(Long customerId) {
        return invoiceRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
                .map(InvoiceDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<InvoiceDTO> getInvoicesByStatus(InvoiceStatus status) {
        return invoiceRepository.findByStatusOrderByCreatedAtDesc(status).stream()
                .map(InvoiceDTO::summaryOf)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public InvoiceDTO getInvoiceById(Long id) {
        return InvoiceDTO.fromEntity(getInvoiceEntity(id));
    }

    @Transactional(readOnly = true)
    public Invoice getInvoiceEntity(Long id) {
        return invoiceRepository.findWithLinesById(id)
                .orElseThrow(() -> {
                    log.warn("Invoice with ID {} not found", id);
                    return new ResourceNotFoundException("Invoice", id);
                });
    }

    @Transactional(readOnly = true)
    public BigDecimal getAmountDue(Long id) {
        return getInvoiceEntity(id).getAmountDue();
    }

    public InvoiceDTO createInvoice(InvoiceRequestDTO request) {
        Customer customer = customerService.getCustomerEntity(request.getCustomerId());
        Invoice invoice = Invoice.builder()
                .invoiceNumber(nextInvoiceNumber())
                .customer(customer)
                .currencyCode(request.getCurrencyCode() != null
                        ? request.getCurrencyCode().toUpperCase() : customer.getPreferredCurrency())
                .dueDate(request.getDueDate())
                .notes(request.getNotes())
                .build();
        if (request.getLines() != null) {
            request.getLines().forEach(line -> invoice.addLine(toLine(line)));
        }
        recalculateTotals(invoice);
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Created invoice {} for customer {}", saved.getInvoiceNumber(), customer.getId());
        return InvoiceDTO.fromEntity(saved);
    }

    /**
     * Builds a draft invoice from lines prepared elsewhere, e.g. an accepted quote.
     */
    public Invoice createDraftInvoice(Customer customer, String currencyCode, String notes, List<InvoiceLine> lines) {
        Invoice invoice = Invoice.builder()
                .invoiceNumber(nextInvoiceNumber())
                .customer(customer)
                .currencyCode(currencyCode)
                .notes(notes)
                .build();
        lines.forEach(invoice::addLine);
        recalculateTotals(invoice);
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Created draft invoice {} with {} lines", saved.getInvoiceNumber(), lines.size());
        return saved;
    }

    public InvoiceDTO updateInvoice(Long id, InvoiceRequestDTO request) {
        Invoice invoice = requireDraft(getInvoiceEntity(id));
        if (!invoice.getCustomer().getId().equals(request.getCustomerId())) {
            invoice.setCustomer(customerService.getCustomerEntity(request.getCustomerId()));
        }
        if (request.getCurrencyCode() != null) {
            invoice.setCurrencyCode(request.getCurrencyCode().toUpperCase());
        }
        invoice.setDueDate(request.getDueDate());
        invoice.setNotes(request.getNotes());
        log.info("Updated invoice {}", invoice.getInvoiceNumber());
        return InvoiceDTO.fromEntity(invoiceRepository.save(invoice));
    }

    public void deleteInvoice(Long id) {
        Invoice invoice = getInvoiceEntity(id);
        if (invoice.getStatus() != InvoiceStatus.DRAFT && invoice.getStatus() != InvoiceStatus.CANCELLED) {
            throw new BusinessRuleException("Only draft or cancelled invoices can be deleted");
        }
        invoiceRepository.delete(invoice);
        log.info("Deleted invoice {}", invoice.getInvoiceNumber());
    }

    public InvoiceDTO addLine(Long invoiceId, InvoiceLineDTO lineDto) {
        Invoice invoice = requireDraft(getInvoiceEntity(invoiceId));
        invoice.addLine(toLine(lineDto));
        recalculateTotals(invoice);
        return InvoiceDTO.fromEntity(invoiceRepository.save(invoice));
    }

    public InvoiceDTO updateLine(Long invoiceId, Long lineId, InvoiceLineDTO lineDto) {
        Invoice invoice = requireDraft(getInvoiceEntity(invoiceId));
        InvoiceLine line = findLine(invoice, lineId);
        line.setDescription(lineDto.getDescription());
        line.setQuantity(lineDto.getQuantity());
        line.setUnitPrice(lineDto.getUnitPrice());
        line.setDiscount(Money.nonNull(lineDto.getDiscount()));
        line.setTaxable(lineDto.isTaxable());
        recalculateTotals(invoice);
        return InvoiceDTO.fromEntity(invoiceRepository.save(invoice));
    }

    public InvoiceDTO removeLine(Long invoiceId, Long lineId) {
        Invoice invoice = requireDraft(getInvoiceEntity(invoiceId));
        invoice.getLines().remove(findLine(invoice, lineId));
        recalculateTotals(invoice);
        return InvoiceDTO.fromEntity(invoiceRepository.save(invoice));
    }

    /**
     * Finalises a draft: resolves the customer's tax rule, fixes dates and hands out a customer number
     * on the customer's first issued invoice.
     */
    public InvoiceDTO issueInvoice(Long id) {
        Invoice invoice = requireDraft(getInvoiceEntity(id));
        if (invoice.getLines().isEmpty()) {
            throw new BusinessRuleException("Cannot issue an invoice without lines");
        }
        Customer customer = invoice.getCustomer();
        Optional<TaxRule> rule = taxService.findApplicableRule(customer);
        if (rule.isPresent() && !taxService.isReverseCharge(rule.get(), customer)) {
            invoice.setTaxRate(rule.get().getRate());
            invoice.setTaxName(rule.get().getTaxName());
        } else {
            invoice.setTaxRate(BigDecimal.ZERO);
            invoice.setTaxName(rule.map(r -> "Reverse charge").orElse(null));
        }
        LocalDate today = LocalDate.now();
        invoice.setIssueDate(today);
        if (invoice.getDueDate() == null) {
            invoice.setDueDate(today.plusDays(DEFAULT_PAYMENT_TERM_DAYS));
        }
        invoice.setStatus(InvoiceStatus.ISSUED);
        recalculateTotals(invoice);
        invoice.setCustomer(customerService.ensureCustomerNumber(customer));
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Issued invoice {} total {} {}", saved.getInvoiceNumber(), saved.getTotalAmount(), saved.getCurrencyCode());
        return InvoiceDTO.fromEntity(saved);
    }

    public InvoiceDTO cancelInvoice(Long id) {
        Invoice invoice = getInvoiceEntity(id);
        if (!CANCELLABLE.contains(invoice.getStatus())) {
            throw new BusinessRuleException("Invoice in status " + invoice.getStatus() + " cannot be cancelled");
        }
        invoice.setStatus(InvoiceStatus.CANCELLED);
        log.info("Cancelled invoice {}", invoice.getInvoiceNumber());
        return InvoiceDTO.fromEntity(invoiceRepository.save(invoice));
    }

    /**
     * Moves issued invoices past their due date to OVERDUE.
     *
     * @return number of invoices updated
     */
    public int markOverdueInvoices() {
        List<Invoice> pastDue = invoiceRepository.findIssuedPastDue(LocalDate.now());
        for (Invoice invoice : pastDue) {
            invoice.setStatus(InvoiceStatus.OVERDUE);
            invoiceRepository.save(invoice);
        }
        log.info("Marked {} invoices as overdue", pastDue.size());
        return pastDue.size();
    }

    /**
     * Books a payment against an issued or overdue invoice. The invoice becomes PAID once nothing is due.
     */
    /**
     * Whether {@link #applyPayment} would accept a payment for the invoice.
     */
    public static boolean acceptsPayment(Invoice invoice) {
        return invoice.getStatus() == InvoiceStatus.PAID || PAYABLE.contains(invoice.getStatus());
    }

    public Invoice applyPayment(Long invoiceId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        Invoice invoice = getInvoiceEntity(invoiceId);
        if (invoice.getStatus() == InvoiceStatus.PAID) {
            log.warn("Invoice {} is already paid, recording extra payment of {}", invoice.getInvoiceNumber(), amount);
        } else if (!PAYABLE.contains(invoice.getStatus())) {
            throw new BusinessRuleException("Cannot apply payment to invoice in status " + invoice.getStatus());
        }
        invoice.setAmountPaid(Money.round(invoice.getAmountPaid().add(amount)));
        if (invoice.getAmountDue().signum() == 0 && invoice.getStatus() != InvoiceStatus.PAID) {
            invoice.setStatus(InvoiceStatus.PAID);
            invoice.setPaidAt(LocalDateTime.now());
            log.info("Invoice {} fully paid", invoice.getInvoiceNumber());
        }
        return invoiceRepository.save(invoice);
    }

    /**
     * subTotal = sum of line totals, tax on the taxable lines at the invoice rate.
     */
    void recalculateTotals(Invoice invoice) {
        BigDecimal subTotal = BigDecimal.ZERO;
        BigDecimal taxableBase = BigDecimal.ZERO;
        for (InvoiceLine line : invoice.getLines()) {
            BigDecimal lineTotal = line.getLineTotal();
            subTotal = subTotal.add(lineTotal);
            if (line.isTaxable()) {
                taxableBase = taxableBase.add(lineTotal);
            }
        }
        BigDecimal tax = taxableBase.signum() > 0 ? Money.percentOf(taxableBase, invoice.getTaxRate()) : Money.round(BigDecimal.ZERO);
        invoice.setSubTotal(Money.round(subTotal));
        invoice.setTaxAmount(tax);
        invoice.setTotalAmount(Money.round(subTotal.add(tax)));
    }

    private String nextInvoiceNumber() {
        long next = settingService.nextSequenceValue(SystemSettingService.INVOICE_SEQUENCE, 1L);
        return String.format("INV-%06d", next);
    }

    private Invoice requireDraft(Invoice invoice) {
        if (!invoice.isEditable()) {
            throw new BusinessRuleException("Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus()
                    + " and can no longer be modified");
        }
        return invoice;
    }

    private InvoiceLine findLine(Invoice invoice, Long lineId) {
        return invoice.getLines().stream()
                .filter(line -> line.getId() != null && line.getId().equals(lineId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Invoice line", lineId));
    }

    private InvoiceLine toLine(InvoiceLineDTO dto) {
        return InvoiceLine.builder()
                .description(dto.getDescription())
                .quantity(dto.getQuantity() != null ? dto.getQuantity() : BigDecimal.ONE)
                .unitPrice(dto.getUnitPrice())
                .discount(Money.nonNull(dto.getDiscount()))
                .taxable(dto.isTaxable())
                .build();
    }
}
