package com.dradmin.billing.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.PaymentTransaction;
import com.dradmin.billing.entity.PaymentTransaction.PaymentStatus;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    Optional<PaymentTransaction> findBySessionId(String sessionId);

    List<PaymentTransaction> findByPaymentIntentId(String paymentIntentId);

    List<PaymentTransaction> findByInvoiceIdOrderByCreatedAtDesc(Long invoiceId);

    List<PaymentTransaction> findByCustomerEmailIgnoreCaseOrderByCreatedAtDesc(String customerEmail);

    List<PaymentTransaction> findByStatusOrderByCreatedAtDesc(PaymentStatus status);

    List<PaymentTransaction> findAllByOrderByCreatedAtDesc();

    long countByStatus(PaymentStatus status);

    List<PaymentTransaction> findByStatusAndGatewayExpiresAtBefore(PaymentStatus status, LocalDateTime now);

    default List<PaymentTransaction> findExpiredPending(LocalDateTime now) {
        return findByStatusAndGatewayExpiresAtBefore(PaymentStatus.PENDING, now);
    }

    @Query("SELECT SUM(pt.amount) FROM PaymentTransaction pt WHERE pt.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") PaymentStatus status);
}
