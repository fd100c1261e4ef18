package com.dradmin.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.entity.Customer;

import jakarta.persistence.LockModeType;

@Repository
public interface ICustomerRepo extends JpaRepository<Customer, Long> {

	List<Customer> findAllByOrderByNameAsc();

	Page<Customer> findAllByOrderByNameAsc(Pageable pageable);

	@Query("SELECT c FROM Customer c WHERE lower(c.email) = lower(:email) OR lower(c.billingEmail) = lower(:email) ORDER BY c.id")
	List<Customer> findByEmailOrBillingEmail(@Param("email") String email);

	@Query("SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END FROM Customer c "
			+ "WHERE (lower(c.email) = lower(:email) OR lower(c.billingEmail) = lower(:email)) "
			+ "AND (:excludeId IS NULL OR c.id <> :excludeId)")
	boolean emailInUse(@Param("email") String email, @Param("excludeId") Long excludeId);

	Optional<Customer> findByReferenceNumber(Long referenceNumber);

	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@Query("SELECT c FROM Customer c WHERE c.id = :id")
	Optional<Customer> findByIdForUpdate(@Param("id") Long id);
}
