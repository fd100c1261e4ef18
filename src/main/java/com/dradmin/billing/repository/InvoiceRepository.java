package com.dradmin.billing.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.Invoice;
import com.dradmin.billing.entity.Invoice.InvoiceStatus;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    @EntityGraph(attributePaths = {"lines", "customer"})
    @Query("SELECT i FROM Invoice i WHERE i.id = :id")
    Optional<Invoice> findWithLinesById(@Param("id") Long id);

    List<Invoice> findAllByOrderByCreatedAtDesc();

    List<Invoice> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<Invoice> findByStatusOrderByCreatedAtDesc(InvoiceStatus status);

    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    List<Invoice> findByStatusAndDueDateBefore(InvoiceStatus status, LocalDate date);

    default List<Invoice> findIssuedPastDue(LocalDate today) {
        return findByStatusAndDueDateBefore(InvoiceStatus.ISSUED, today);
    }

    long countByCustomerId(Long customerId);
}
