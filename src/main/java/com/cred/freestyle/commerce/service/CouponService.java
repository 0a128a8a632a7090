package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Coupon;
import com.cred.freestyle.commerce.domain.model.Coupon.DiscountType;
import com.cred.freestyle.commerce.exception.DuplicateResourceException;
import com.cred.freestyle.commerce.exception.InvalidCouponException;
import com.cred.freestyle.commerce.exception.InvalidCouponException.Reason;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.CouponRepository;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Coupon collaborator.
 *
 * Applicability rule used at checkout, checked in this order:
 * 1. Coupon exists (NOT_FOUND)
 * 2. Coupon is active (INACTIVE)
 * 3. validFrom <= now (NOT_YET_VALID)
 * 4. now <= validUntil (EXPIRED)
 * 5. usedCount < usageLimit (USAGE_LIMIT_REACHED)
 * 6. subtotal >= minOrderAmount (BELOW_MINIMUM)
 *
 * @author Commerce Platform Team
 */
@Service
public class CouponService {

    private static final Logger logger = LoggerFactory.getLogger(CouponService.class);

    private static final String TABLE = "coupons";

    private final CouponRepository couponRepository;
    private final AuditService auditService;

    public CouponService(CouponRepository couponRepository, AuditService auditService) {
        this.couponRepository = couponRepository;
        this.auditService = auditService;
    }

    /**
     * Exact-match lookup by code.
     *
     * @param code Coupon code
     * @return Coupon, if any
     */
    @Transactional(readOnly = true)
    public Optional<Coupon> findCoupon(String code) {
        return couponRepository.findByCode(code);
    }

    /**
     * Load a coupon for redemption under a row lock. Must run inside the
     * checkout transaction.
     *
     * @throws InvalidCouponException with NOT_FOUND if the code is unknown
     */
    @Transactional
    public Coupon lockForRedemption(String code) {
        return couponRepository.findByCodeWithLock(code)
                .orElseThrow(() -> new InvalidCouponException(code, Reason.NOT_FOUND));
    }

    /**
     * Check the applicability rule.
     *
     * @param coupon Coupon to check
     * @param subtotal Order subtotal
     * @param now Evaluation time
     * @throws InvalidCouponException naming the first failing rule
     */
    public void verifyApplicable(Coupon coupon, BigDecimal subtotal, Instant now) {
        Reason failure = null;
        if (!Boolean.TRUE.equals(coupon.getIsActive())) {
            failure = Reason.INACTIVE;
        } else if (now.isBefore(coupon.getValidFrom())) {
            failure = Reason.NOT_YET_VALID;
        } else if (now.isAfter(coupon.getValidUntil())) {
            failure = Reason.EXPIRED;
        } else if (coupon.isExhausted()) {
            failure = Reason.USAGE_LIMIT_REACHED;
        } else if (subtotal.compareTo(coupon.getMinOrderAmount()) < 0) {
            failure = Reason.BELOW_MINIMUM;
        }

        if (failure != null) {
            logger.warn("Coupon {} rejected: {}", coupon.getCode(), failure);
            throw new InvalidCouponException(coupon.getCode(), failure);
        }
    }

    @Transactional
    public Coupon createCoupon(Coupon draft) {
        validateDefinition(draft);
        if (couponRepository.existsByCode(draft.getCode())) {
            throw new DuplicateResourceException("Coupon", "code", draft.getCode());
        }

        draft.setCouponId(null);
        draft.setUsedCount(0);
        if (draft.getMinOrderAmount() == null) {
            draft.setMinOrderAmount(BigDecimal.ZERO);
        }
        if (draft.getIsActive() == null) {
            draft.setIsActive(true);
        }

        Coupon coupon = couponRepository.save(draft);
        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.CREATE, TABLE,
                coupon.getCouponId(), null, coupon);
        logger.info("Created coupon {} ({} {})", coupon.getCode(), coupon.getDiscountType(), coupon.getDiscountValue());
        return coupon;
    }

    /**
     * Replace the definition of a coupon. Code and used count are kept.
     */
    @Transactional
    public Coupon updateCoupon(String couponId, Coupon changes) {
        Coupon coupon = getCoupon(couponId);
        String before = auditService.snapshot(coupon);

        coupon.setDescription(changes.getDescription());
        coupon.setDiscountType(changes.getDiscountType());
        coupon.setDiscountValue(changes.getDiscountValue());
        coupon.setMinOrderAmount(changes.getMinOrderAmount() == null ? BigDecimal.ZERO : changes.getMinOrderAmount());
        coupon.setMaxDiscount(changes.getMaxDiscount());
        coupon.setUsageLimit(changes.getUsageLimit());
        coupon.setValidFrom(changes.getValidFrom());
        coupon.setValidUntil(changes.getValidUntil());
        if (changes.getIsActive() != null) {
            coupon.setIsActive(changes.getIsActive());
        }
        validateDefinition(coupon);
        if (coupon.getUsageLimit() < coupon.getUsedCount()) {
            throw new IllegalArgumentException("Usage limit cannot be below the current used count " + coupon.getUsedCount());
        }

        Coupon saved = couponRepository.save(coupon);
        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.UPDATE, TABLE, couponId, before, saved);
        return saved;
    }

    @Transactional
    public void deactivateCoupon(String couponId) {
        Coupon coupon = getCoupon(couponId);
        String before = auditService.snapshot(coupon);
        coupon.deactivate();
        couponRepository.save(coupon);
        auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.DELETE, TABLE, couponId, before, coupon);
        logger.info("Deactivated coupon {}", coupon.getCode());
    }

    @Transactional(readOnly = true)
    public Coupon getCoupon(String couponId) {
        return couponRepository.findById(couponId)
                .orElseThrow(() -> new ResourceNotFoundException("Coupon", couponId));
    }

    @Transactional(readOnly = true)
    public Page<Coupon> listCoupons(Pageable pageable) {
        return couponRepository.findAll(pageable);
    }

    private void validateDefinition(Coupon coupon) {
        if (coupon.getDiscountType() == null || coupon.getDiscountValue() == null) {
            throw new IllegalArgumentException("Discount type and value are required");
        }
        if (coupon.getDiscountValue().signum() <= 0) {
            throw new IllegalArgumentException("Discount value must be positive");
        }
        if (coupon.getDiscountType() == DiscountType.PERCENTAGE
                && coupon.getDiscountValue().compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Percentage discount must be a fraction between 0 and 1");
        }
        if (coupon.getMaxDiscount() != null && coupon.getMaxDiscount().signum() < 0) {
            throw new IllegalArgumentException("Max discount must not be negative");
        }
        if (coupon.getUsageLimit() == null || coupon.getUsageLimit() <= 0) {
            throw new IllegalArgumentException("Usage limit must be positive");
        }
        if (coupon.getValidFrom() == null || coupon.getValidUntil() == null
                || !coupon.getValidFrom().isBefore(coupon.getValidUntil())) {
            throw new IllegalArgumentException("validFrom must be before validUntil");
        }
    }
}
