package com.dradmin.email.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.email.entity.SentEmail;
import com.dradmin.email.entity.SentEmail.EmailStatus;

@Repository
public interface SentEmailRepository extends JpaRepository<SentEmail, Long> {

    List<SentEmail> findAllByOrderByCreatedAtDesc();

    List<SentEmail> findByStatusOrderByCreatedAtDesc(EmailStatus status);

    @Query("SELECT e.id FROM SentEmail e WHERE e.status = :status AND (e.nextAttemptAt IS NULL OR e.nextAttemptAt <= :now) "
            + "ORDER BY e.nextAttemptAt ASC, e.id ASC")
    List<Long> findIdsDueAt(@Param("status") EmailStatus status, @Param("now") LocalDateTime now, Pageable pageable);

    default List<Long> findDueIds(LocalDateTime now, Pageable pageable) {
        return findIdsDueAt(EmailStatus.PENDING, now, pageable);
    }

    // guarded transition so two workers cannot claim the same row
    @Modifying
    @Query("UPDATE SentEmail e SET e.status = :to, e.updatedAt = :now WHERE e.id = :id AND e.status = :from")
    int transition(@Param("id") Long id, @Param("from") EmailStatus from, @Param("to") EmailStatus to,
                   @Param("now") LocalDateTime now);

    default int claim(Long id, LocalDateTime now) {
        return transition(id, EmailStatus.PENDING, EmailStatus.IN_PROGRESS, now);
    }

    long countByStatus(EmailStatus status);
}
