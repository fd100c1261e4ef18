package com.dradmin.billing.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.dradmin.billing.dto.CouponDTO;
import com.dradmin.billing.entity.Coupon;
import com.dradmin.billing.entity.Coupon.DiscountType;
import com.dradmin.billing.repository.CouponRepository;
import com.dradmin.exception.BusinessRuleException;
import com.dradmin.exception.ResourceNotFoundException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@Transactional
public class CouponService {

    @Autowired
    private CouponRepository couponRepository;

    @Transactional(readOnly = true)
    public List<CouponDTO> getAllCoupons() {
        return couponRepository.findAll().stream().map(CouponDTO::fromEntity).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CouponDTO getCouponById(Long id) {
        return CouponDTO.fromEntity(find(id));
    }

    public CouponDTO createCoupon(CouponDTO dto) {
        validate(dto);
        if (couponRepository.existsByCodeIgnoreCase(dto.getCode())) {
            throw new BusinessRuleException("Coupon code already exists: " + dto.getCode());
        }
        Coupon coupon = new Coupon();
        apply(coupon, dto);
        Coupon saved = couponRepository.save(coupon);
        log.info("Created coupon {}", saved.getCode());
        return CouponDTO.fromEntity(saved);
    }

    public CouponDTO updateCoupon(Long id, CouponDTO dto) {
        validate(dto);
        Coupon coupon = find(id);
        if (!coupon.getCode().equalsIgnoreCase(dto.getCode()) && couponRepository.existsByCodeIgnoreCase(dto.getCode())) {
            throw new BusinessRuleException("Coupon code already exists: " + dto.getCode());
        }
        apply(coupon, dto);
        log.info("Updated coupon {}", coupon.getCode());
        return CouponDTO.fromEntity(couponRepository.save(coupon));
    }

    public void deleteCoupon(Long id) {
        couponRepository.delete(find(id));
        log.info("Deleted coupon {}", id);
    }

    /**
     * Active, inside its validity window and with uses left.
     */
    @Transactional(readOnly = true)
    public Coupon getRedeemableCoupon(String code) {
        Coupon coupon = couponRepository.findByCodeIgnoreCase(code.trim())
                .orElseThrow(() -> new ResourceNotFoundException("Coupon not found: " + code));
        if (!coupon.isRedeemableOn(LocalDate.now())) {
            throw new BusinessRuleException("Coupon " + coupon.getCode() + " is not valid");
        }
        return coupon;
    }

    @Transactional(readOnly = true)
    public CouponDTO validateCoupon(String code) {
        return CouponDTO.fromEntity(getRedeemableCoupon(code));
    }

    /**
     * Counts one redemption. Fails when the coupon expired, was deactivated or ran out of uses
     * since it was applied.
     */
    public void registerUse(Coupon coupon) {
        if (!coupon.isRedeemableOn(LocalDate.now()) || couponRepository.incrementUseIfAvailable(coupon.getId()) == 0) {
            throw new BusinessRuleException("Coupon " + coupon.getCode() + " is no longer valid");
        }
        coupon.setTimesUsed(coupon.getTimesUsed() + 1);
        log.info("Coupon {} used {} times", coupon.getCode(), coupon.getTimesUsed());
    }

    /**
     * Discount of the coupon on {@code base}, never more than the base itself.
     */
    public static BigDecimal discountFor(Coupon coupon, BigDecimal base) {
        if (coupon == null || base.signum() <= 0) {
            return Money.round(BigDecimal.ZERO);
        }
        BigDecimal discount = coupon.getDiscountType() == DiscountType.PERCENTAGE
                ? Money.percentOf(base, coupon.getValue())
                : Money.round(coupon.getValue());
        return discount.compareTo(base) > 0 ? Money.round(base) : discount;
    }

    private void validate(CouponDTO dto) {
        if (dto.getDiscountType() == DiscountType.PERCENTAGE && dto.getValue().compareTo(Money.HUNDRED) > 0) {
            throw new IllegalArgumentException("Percentage discount cannot exceed 100");
        }
        if (dto.getValidFrom() != null && dto.getValidUntil() != null && dto.getValidUntil().isBefore(dto.getValidFrom())) {
            throw new IllegalArgumentException("validUntil must not be before validFrom");
        }
    }

    private void apply(Coupon coupon, CouponDTO dto) {
        coupon.setCode(dto.getCode().trim().toUpperCase());
        coupon.setName(dto.getName());
        coupon.setDiscountType(dto.getDiscountType());
        coupon.setValue(dto.getValue());
        coupon.setValidFrom(dto.getValidFrom());
        coupon.setValidUntil(dto.getValidUntil());
        coupon.setMaxUses(dto.getMaxUses());
        coupon.setActive(dto.isActive());
    }

    private Coupon find(Long id) {
        return couponRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Coupon", id));
    }
}
