package com.dradmin.registrar.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.registrar.entity.RegisteredDomain;
import com.dradmin.registrar.entity.RegisteredDomain.DomainStatus;

@Repository
public interface RegisteredDomainRepository extends JpaRepository<RegisteredDomain, Long> {

    List<RegisteredDomain> findAllByOrderByNameAsc();

    List<RegisteredDomain> findByCustomerIdOrderByNameAsc(Long customerId);

    Optional<RegisteredDomain> findByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCase(String name);

    @Query("SELECT d FROM RegisteredDomain d JOIN FETCH d.customer WHERE d.status = :status AND d.expirationDate >= :from AND d.expirationDate <= :until "
            + "ORDER BY d.expirationDate ASC")
    List<RegisteredDomain> findExpiringBetween(@Param("status") DomainStatus status,
                                               @Param("from") LocalDate from,
                                               @Param("until") LocalDate until);

    List<RegisteredDomain> findByStatusAndExpirationDateBefore(DomainStatus status, LocalDate date);

    default List<RegisteredDomain> findActiveExpiredBefore(LocalDate today) {
        return findByStatusAndExpirationDateBefore(DomainStatus.ACTIVE, today);
    }
}
