package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.PaymentStatisticsDTO;
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
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

/**
 * Invoice payments: hosted checkout sessions, webhook reconciliation, manual and credit bookings.
 */
@Service
@Transactional
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);

    private static final DateTimeFormatter REFERENCE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    @Autowired
    private PaymentTransactionRepository transactionRepository;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private CheckoutGateway checkoutGateway;

    /**
     * Opens a checkout session for the amount still due on the invoice.
     */
    public PaymentTransactionDTO processInvoicePayment(Long invoiceId) {
        Invoice invoice = invoiceService.getInvoiceEntity(invoiceId);
        if (invoice.getStatus() != InvoiceStatus.ISSUED && invoice.getStatus() != InvoiceStatus.OVERDUE) {
            throw new BusinessRuleException("Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus()
                    + " and cannot be paid");
        }
        BigDecimal amountDue = invoice.getAmountDue();
        if (amountDue.signum() <= 0) {
            throw new BusinessRuleException("Invoice " + invoice.getInvoiceNumber() + " has nothing left to pay");
        }

        String email = invoice.getCustomer().getInvoiceEmail();
        logger.info("Creating checkout session for invoice {} amount {} {}", invoice.getInvoiceNumber(),
                amountDue, invoice.getCurrencyCode());
        CheckoutSession session = checkoutGateway.createCheckoutSession(CheckoutRequest.builder()
                .description("Invoice " + invoice.getInvoiceNumber())
                .amount(amountDue)
                .currency(invoice.getCurrencyCode())
                .customerEmail(email)
                .clientReference(invoice.getInvoiceNumber())
                .build());

        PaymentTransaction tx = PaymentTransaction.builder()
                .transactionReference(newReference())
                .invoice(invoice)
                .gateway(PaymentGateway.STRIPE)
                .sessionId(session.getSessionId())
                .paymentIntentId(session.getPaymentIntentId())
                .customerEmail(email)
                .amount(amountDue)
                .currency(invoice.getCurrencyCode())
                .status(PaymentStatus.PENDING)
                .gatewayPaymentStatus(session.getPaymentStatus())
                .gatewayCreatedAt(session.getCreatedAt() != null ? session.getCreatedAt() : LocalDateTime.now())
                .gatewayExpiresAt(session.getExpiresAt())
                .build();
        PaymentTransaction saved = transactionRepository.save(tx);
        logger.info("Created payment transaction {} for session {}", saved.getId(), session.getSessionId());

        PaymentTransactionDTO dto = PaymentTransactionDTO.fromEntity(saved);
        dto.setCheckoutUrl(session.getUrl());
        return dto;
    }

    /**
     * Verifies and applies a gateway webhook. Unknown event types and unknown sessions are acknowledged.
     */
    public Map<String, Object> handleWebhook(String payload, String signatureHeader) {
        GatewayEvent event = checkoutGateway.parseWebhookEvent(payload, signatureHeader);
        logger.info("Received webhook event {}", event.getType());

        switch (event.getType()) {
            case "checkout.session.completed":
                return updateFromSessionEvent(event, PaymentStatus.COMPLETED);
            case "checkout.session.expired":
                return updateFromSessionEvent(event, PaymentStatus.EXPIRED);
            case "payment_intent.payment_failed":
                return markIntentFailed(event);
            default:
                return Map.of("received", true, "message", "Unhandled event type: " + event.getType());
        }
    }

    private Map<String, Object> updateFromSessionEvent(GatewayEvent event, PaymentStatus target) {
        Optional<PaymentTransaction> txOpt = event.getSessionId() == null
                ? Optional.empty() : transactionRepository.findBySessionId(event.getSessionId());
        if (txOpt.isEmpty()) {
            logger.warn("No payment transaction found for session: {}", event.getSessionId());
            return Map.of("received", true, "message", "No payment transaction for session " + event.getSessionId());
        }
        PaymentTransaction tx = txOpt.get();
        if (tx.isCompleted()) {
            logger.info("Payment transaction {} already completed, ignoring duplicate event", tx.getId());
            return Map.of("received", true, "message", "Already processed");
        }
        if (event.getPaymentIntentId() != null) {
            tx.setPaymentIntentId(event.getPaymentIntentId());
        }
        tx.setGatewayPaymentStatus(event.getPaymentStatus());
        tx.setStatus(target);
        transactionRepository.save(tx);

        if (target == PaymentStatus.COMPLETED) {
            Invoice invoice = tx.getInvoice();
            if (!InvoiceService.acceptsPayment(invoice)) {
                // money was captured by the gateway, keep the transaction for manual reconciliation
                logger.error("Payment transaction {} completed for invoice {} in status {}, payment of {} not applied",
                        tx.getId(), invoice.getInvoiceNumber(), invoice.getStatus(), tx.getAmount());
                return Map.of("received", true, "transactionId", tx.getId(), "status", target.name(),
                        "message", "Invoice " + invoice.getInvoiceNumber() + " is " + invoice.getStatus()
                                + ", payment needs manual reconciliation");
            }
            invoiceService.applyPayment(invoice.getId(), tx.getAmount());
        }
        logger.info("Payment transaction {} is now {}", tx.getId(), target);
        return Map.of("received", true, "transactionId", tx.getId(), "status", target.name());
    }

    private Map<String, Object> markIntentFailed(GatewayEvent event) {
        List<PaymentTransaction> txs = event.getPaymentIntentId() == null
                ? List.of() : transactionRepository.findByPaymentIntentId(event.getPaymentIntentId());
        if (txs.isEmpty()) {
            logger.warn("No payment transaction found for payment intent: {}", event.getPaymentIntentId());
        }
        for (PaymentTransaction tx : txs) {
            if (tx.isPending()) {
                tx.setStatus(PaymentStatus.FAILED);
                transactionRepository.save(tx);
                logger.info("Payment transaction {} marked FAILED", tx.getId());
            }
        }
        return Map.of("received", true, "updated", txs.size());
    }

    public PaymentTransactionDTO recordManualPayment(Long invoiceId, BigDecimal amount, String reference) {
        return PaymentTransactionDTO.fromEntity(
                recordCompletedPayment(invoiceId, amount, PaymentGateway.MANUAL, reference));
    }

    /**
     * Books an already settled payment (bank transfer, customer credit) and applies it to the invoice.
     */
    public PaymentTransaction recordCompletedPayment(Long invoiceId, BigDecimal amount, PaymentGateway gateway, String notes) {
        Invoice invoice = invoiceService.applyPayment(invoiceId, amount);
        PaymentTransaction tx = PaymentTransaction.builder()
                .transactionReference(newReference())
                .invoice(invoice)
                .gateway(gateway)
                .customerEmail(invoice.getCustomer().getInvoiceEmail())
                .amount(Money.round(amount))
                .currency(invoice.getCurrencyCode())
                .status(PaymentStatus.COMPLETED)
                .gatewayCreatedAt(LocalDateTime.now())
                .notes(notes)
                .build();
        PaymentTransaction saved = transactionRepository.save(tx);
        logger.info("Recorded {} payment {} of {} on invoice {}", gateway, saved.getTransactionReference(),
                amount, invoice.getInvoiceNumber());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionDTO> getAllTransactions() {
        return toDtos(transactionRepository.findAllByOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public PaymentTransactionDTO getTransactionById(Long id) {
        return transactionRepository.findById(id)
                .map(PaymentTransactionDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("Payment transaction", id));
    }

    @Transactional(readOnly = true)
    public PaymentTransactionDTO getBySessionId(String sessionId) {
        return transactionRepository.findBySessionId(sessionId)
                .map(PaymentTransactionDTO::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("Payment transaction not found for session: " + sessionId));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionDTO> getByInvoice(Long invoiceId) {
        return toDtos(transactionRepository.findByInvoiceIdOrderByCreatedAtDesc(invoiceId));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionDTO> getByCustomerEmail(String email) {
        return toDtos(transactionRepository.findByCustomerEmailIgnoreCaseOrderByCreatedAtDesc(email));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionDTO> getByStatus(PaymentStatus status) {
        return toDtos(transactionRepository.findByStatusOrderByCreatedAtDesc(status));
    }

    @Transactional(readOnly = true)
    public List<PaymentTransactionDTO> getExpiredPending() {
        return toDtos(transactionRepository.findExpiredPending(LocalDateTime.now()));
    }

    /**
     * Pending checkout sessions whose gateway expiry has passed become EXPIRED.
     */
    public int markExpiredSessions() {
        List<PaymentTransaction> expired = transactionRepository.findExpiredPending(LocalDateTime.now());
        int count = 0;
        for (PaymentTransaction tx : expired) {
            if (tx.isPending()) {
                tx.setStatus(PaymentStatus.EXPIRED);
                transactionRepository.save(tx);
                count++;
            }
        }
        logger.info("Marked {} payment transactions as expired", count);
        return count;
    }

    @Transactional(readOnly = true)
    public PaymentStatisticsDTO getStatistics() {
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, transactionRepository.countByStatus(status));
        }
        BigDecimal completed = transactionRepository.sumAmountByStatus(PaymentStatus.COMPLETED);
        return new PaymentStatisticsDTO(transactionRepository.count(), counts, Money.round(completed));
    }

    private List<PaymentTransactionDTO> toDtos(List<PaymentTransaction> txs) {
        return txs.stream().map(PaymentTransactionDTO::fromEntity).collect(Collectors.toList());
    }

    private static String newReference() {
        return "TXN-" + LocalDateTime.now().format(REFERENCE_FORMAT) + "-"
                + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
