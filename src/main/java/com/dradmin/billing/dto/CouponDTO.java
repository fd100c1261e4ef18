package com.dradmin.billing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.dradmin.billing.entity.Coupon;
import com.dradmin.billing.entity.Coupon.DiscountType;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CouponDTO {
    private Long id;

    @NotBlank
    @Size(max = 50)
    private String code;

    @NotBlank
    private String name;

    @NotNull
    private DiscountType discountType;

    @NotNull
    @DecimalMin("0.01")
    private BigDecimal value;

    private LocalDate validFrom;
    private LocalDate validUntil;

    @Min(1)
    private Integer maxUses;

    private int timesUsed;

    @Builder.Default
    private boolean active = true;

    public static CouponDTO fromEntity(Coupon coupon) {
        return CouponDTO.builder()
                .id(coupon.getId())
                .code(coupon.getCode())
                .name(coupon.getName())
                .discountType(coupon.getDiscountType())
                .value(coupon.getValue())
                .validFrom(coupon.getValidFrom())
                .validUntil(coupon.getValidUntil())
                .maxUses(coupon.getMaxUses())
                .timesUsed(coupon.getTimesUsed())
                .active(coupon.isActive())
                .build();
    }
}
