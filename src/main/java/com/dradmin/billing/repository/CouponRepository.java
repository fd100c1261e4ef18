package com.dradmin.billing.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.dradmin.billing.entity.Coupon;

@Repository
public interface CouponRepository extends JpaRepository<Coupon, Long> {

    Optional<Coupon> findByCodeIgnoreCase(String code);

    boolean existsByCodeIgnoreCase(String code);

    // counts a use only while the coupon still has uses left
    @Modifying
    @Query("UPDATE Coupon c SET c.timesUsed = c.timesUsed + 1 WHERE c.id = :id AND (c.maxUses IS NULL OR c.timesUsed < c.maxUses)")
    int incrementUseIfAvailable(@Param("id") Long id);
}
