package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.CreditTransactionDTO;
import com.dradmin.billing.dto.CreditTransactionRequest;
import com.dradmin.billing.dto.CustomerCreditDTO;
import com.dradmin.billing.entity.CreditTransaction;
import com.dradmin.billing.entity.CreditTransaction.CreditTransactionType;
import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.PaymentTransaction.PaymentGateway;
import com.dradmin.billing.repository.CreditTransactionRepository;
import com.dradmin.entity.Customer;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;
import com.dradmin.repository.ICustomerRepo;
import com.dradmin.security.SecurityUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Customer credit ledger. The customer's balance column always equals the balanceAfter of its latest
 * ledger row; both are written in the same transaction.
 */
@Slf4j
@Service
@Transactional
public class CreditService {

    @Autowired
    private CreditTransactionRepository creditTransactionRepository;

    @Autowired
    private ICustomerRepo customerRepo;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private PaymentService paymentService;

    @Transactional(readOnly = true)
    public CustomerCreditDTO getCustomerCredit(Long customerId) {
        Customer customer = customerRepo.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        return new CustomerCreditDTO(customer.getId(), Money.round(customer.getBalance()),
                Money.round(Money.nonNull(customer.getCreditLimit())), available(customer));
    }

    @Transactional(readOnly = true)
    public List<CreditTransactionDTO> getTransactions(Long customerId) {
        if (!customerRepo.existsById(customerId)) {
            throw new ResourceNotFoundException("Customer", customerId);
        }
        return creditTransactionRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(customerId).stream()
                .map(CreditTransactionDTO::fromEntity)
                .collect(Collectors.toList());
    }

    public CreditTransactionDTO createTransaction(CreditTransactionRequest request) {
        if (request.getAmount() == null || request.getAmount().signum() == 0) {
            throw new IllegalArgumentException("Amount must not be zero");
        }
        BigDecimal magnitude = request.getAmount().abs();
        switch (request.getType()) {
            case DEPOSIT:
            case REFUND:
                return record(request.getCustomerId(), request.getType(), magnitude, null, request.getDescription());
            case DEDUCTION:
                return deductCredit(request.getCustomerId(), magnitude, request.getInvoiceId(), request.getDescription());
            case ADJUSTMENT:
            default:
                return record(request.getCustomerId(), CreditTransactionType.ADJUSTMENT, request.getAmount(),
                        null, request.getDescription());
        }
    }

    public CreditTransactionDTO addCredit(Long customerId, BigDecimal amount, String description) {
        requirePositive(amount);
        return record(customerId, CreditTransactionType.DEPOSIT, amount, null, description);
    }

    /**
     * Takes credit from the customer. With an invoice the deducted amount is also booked as a
     * CREDIT payment on that invoice.
     */
    public CreditTransactionDTO deductCredit(Long customerId, BigDecimal amount, Long invoiceId, String description) {
        requirePositive(amount);
        Invoice invoice = null;
        if (invoiceId != null) {
            invoice = invoiceService.getInvoiceEntity(invoiceId);
            if (!invoice.getCustomer().getId().equals(customerId)) {
                throw new BusinessRuleException("Invoice " + invoice.getInvoiceNumber() + " does not belong to customer " + customerId);
            }
        }
        CreditTransactionDTO result = record(customerId, CreditTransactionType.DEDUCTION, amount.negate(), invoice, description);
        if (invoice != null) {
            paymentService.recordCompletedPayment(invoice.getId(), amount, PaymentGateway.CREDIT,
                    "Paid from customer credit, ledger entry " + result.getId());
        }
        return result;
    }

    @Transactional(readOnly = true)
    public boolean hasSufficientCredit(Long customerId, BigDecimal amount) {
        Customer customer = customerRepo.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        return available(customer).compareTo(amount) >= 0;
    }

    private CreditTransactionDTO record(Long customerId, CreditTransactionType type, BigDecimal signedAmount,
                                        Invoice invoice, String description) {
        Customer customer = customerRepo.findByIdForUpdate(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
        BigDecimal amount = Money.round(signedAmount);
        if (amount.signum() < 0 && available(customer).compareTo(amount.negate()) < 0) {
            throw new BusinessRuleException("Insufficient credit: available " + available(customer)
                    + ", requested " + amount.negate());
        }
        BigDecimal newBalance = Money.round(customer.getBalance().add(amount));
        customer.setBalance(newBalance);
        customerRepo.save(customer);

        CreditTransaction tx = CreditTransaction.builder()
                .customer(customer)
                .type(type)
                .amount(amount)
                .balanceAfter(newBalance)
                .invoice(invoice)
                .description(description)
                .createdBy(SecurityUtils.currentAdmin())
                .build();
        CreditTransaction saved = creditTransactionRepository.save(tx);
        log.info("Credit {} of {} for customer {}, balance now {}", type, amount, customerId, newBalance);
        return CreditTransactionDTO.fromEntity(saved);
    }

    /**
     * balance + creditLimit
     */
    private BigDecimal available(Customer customer) {
        return Money.round(Money.nonNull(customer.getBalance()).add(Money.nonNull(customer.getCreditLimit())));
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
