package com.dradmin.billing.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.Quote;
import com.dradmin.billing.entity.Quote.QuoteStatus;

@Repository
public interface QuoteRepository extends JpaRepository<Quote, Long> {

    @EntityGraph(attributePaths = {"lines", "customer", "coupon"})
    @Query("SELECT q FROM Quote q WHERE q.id = :id")
    Optional<Quote> findWithLinesById(@Param("id") Long id);

    @EntityGraph(attributePaths = {"lines", "customer", "coupon"})
    Optional<Quote> findByAcceptanceToken(String acceptanceToken);

    List<Quote> findAllByOrderByCreatedAtDesc();

    List<Quote> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<Quote> findByStatusAndValidUntilBefore(QuoteStatus status, LocalDate date);

    default List<Quote> findSentPastValidity(LocalDate today) {
        return findByStatusAndValidUntilBefore(QuoteStatus.SENT, today);
    }
}
