package com.cred.freestyle.commerce.domain.model;

import com.cred.freestyle.commerce.exception.InvalidCouponException;
import com.cred.freestyle.commerce.exception.InvalidCouponException.Reason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Discount coupon redeemable at checkout.
 *
 * Discount types:
 * - PERCENTAGE: discountValue is a fraction of the subtotal (0.10 = 10%)
 * - FIXED: discountValue is an absolute amount
 *
 * In both cases the discount is capped by maxDiscount (when set) and by
 * the order subtotal. usedCount never exceeds usageLimit.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "coupons", indexes = {
    @Index(name = "idx_coupons_code", columnList = "code", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coupon {

    @Id
    @Column(name = "coupon_id", nullable = false, length = 36)
    private String couponId;

    /**
     * Code entered by the customer. Matched exactly.
     */
    @Column(name = "code", nullable = false, unique = true, length = 50)
    private String code;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 20)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, precision = 12, scale = 4)
    private BigDecimal discountValue;

    /**
     * Minimum subtotal required for the coupon to apply.
     */
    @Column(name = "min_order_amount", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal minOrderAmount = BigDecimal.ZERO;

    /**
     * Upper bound on the discount. Null means uncapped.
     */
    @Column(name = "max_discount", precision = 12, scale = 2)
    private BigDecimal maxDiscount;

    @Column(name = "usage_limit", nullable = false)
    private Integer usageLimit;

    @Column(name = "used_count", nullable = false)
    @Builder.Default
    private Integer usedCount = 0;

    @Column(name = "valid_from", nullable = false)
    private Instant validFrom;

    @Column(name = "valid_until", nullable = false)
    private Instant validUntil;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (couponId == null) {
            couponId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isExhausted() {
        return usedCount >= usageLimit;
    }

    /**
     * Count one redemption. Re-checks the usage limit at write time.
     *
     * @throws InvalidCouponException if the usage limit is already reached
     */
    public void redeem() {
        if (isExhausted()) {
            throw new InvalidCouponException(code, Reason.USAGE_LIMIT_REACHED);
        }
        usedCount = usedCount + 1;
    }

    public void deactivate() {
        this.isActive = false;
    }

    public enum DiscountType {
        PERCENTAGE,
        FIXED
    }
}
