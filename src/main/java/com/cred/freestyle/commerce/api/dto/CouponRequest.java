package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.domain.model.Coupon;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request DTO for creating or updating a coupon (admin).
 *
 * Percentage coupons carry a fraction in (0, 1]: 0.10 means 10% off.
 *
 * @author Commerce Platform Team
 */
public class CouponRequest {

    @NotBlank(message = "Coupon code is required")
    @Size(max = 50, message = "Coupon code must be at most 50 characters")
    private String code;

    private String description;

    @NotNull(message = "Discount type is required")
    private Coupon.DiscountType discountType;

    @NotNull(message = "Discount value is required")
    private BigDecimal discountValue;

    private BigDecimal minOrderAmount;
    private BigDecimal maxDiscount;

    @NotNull(message = "Usage limit is required")
    private Integer usageLimit;

    @NotNull(message = "Valid-from is required")
    private Instant validFrom;

    @NotNull(message = "Valid-until is required")
    private Instant validUntil;

    public CouponRequest() {
    }

    /**
     * Build an unsaved coupon from this request. The active flag is left
     * unset so updates keep the current state and creation defaults to active.
     */
    public Coupon toCoupon() {
        return Coupon.builder()
                .code(code)
                .description(description)
                .discountType(discountType)
                .discountValue(discountValue)
                .minOrderAmount(minOrderAmount != null ? minOrderAmount : BigDecimal.ZERO)
                .maxDiscount(maxDiscount)
                .usageLimit(usageLimit)
                .validFrom(validFrom)
                .validUntil(validUntil)
                .isActive(null)
                .build();
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Coupon.DiscountType getDiscountType() {
        return discountType;
    }

    public void setDiscountType(Coupon.DiscountType discountType) {
        this.discountType = discountType;
    }

    public BigDecimal getDiscountValue() {
        return discountValue;
    }

    public void setDiscountValue(BigDecimal discountValue) {
        this.discountValue = discountValue;
    }

    public BigDecimal getMinOrderAmount() {
        return minOrderAmount;
    }

    public void setMinOrderAmount(BigDecimal minOrderAmount) {
        this.minOrderAmount = minOrderAmount;
    }

    public BigDecimal getMaxDiscount() {
        return maxDiscount;
    }

    public void setMaxDiscount(BigDecimal maxDiscount) {
        this.maxDiscount = maxDiscount;
    }

    public Integer getUsageLimit() {
        return usageLimit;
    }

    public void setUsageLimit(Integer usageLimit) {
        this.usageLimit = usageLimit;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    public void setValidFrom(Instant validFrom) {
        this.validFrom = validFrom;
    }

    public Instant getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(Instant validUntil) {
        this.validUntil = validUntil;
    }
}
