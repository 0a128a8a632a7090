package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Coupon;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure pricing arithmetic for checkout. All amounts are scale 2, HALF_UP.
 *
 * Discount rules:
 * - PERCENTAGE: subtotal x discountValue, capped at maxDiscount
 * - FIXED: discountValue, capped at maxDiscount
 * - never negative, never more than the subtotal
 *
 * @author Commerce Platform Team
 */
@Component
public class DiscountCalculator {

    static final int SCALE = 2;

    /**
     * @param coupon Applicable coupon, or null for no discount
     * @param subtotal Order subtotal
     * @return Discount amount in [0, subtotal]
     */
    public BigDecimal calculateDiscount(Coupon coupon, BigDecimal subtotal) {
        if (coupon == null) {
            return money(BigDecimal.ZERO);
        }

        BigDecimal discount;
        if (coupon.getDiscountType() == Coupon.DiscountType.PERCENTAGE) {
            discount = subtotal.multiply(coupon.getDiscountValue());
        } else {
            discount = coupon.getDiscountValue();
        }

        if (coupon.getMaxDiscount() != null) {
            discount = discount.min(coupon.getMaxDiscount());
        }

        discount = discount.min(subtotal).max(BigDecimal.ZERO);
        return money(discount);
    }

    /**
     * @return subtotal minus discount, floored at zero
     */
    public BigDecimal calculateTotal(BigDecimal subtotal, BigDecimal discount) {
        return money(subtotal.subtract(discount).max(BigDecimal.ZERO));
    }

    public BigDecimal lineTotal(BigDecimal unitPrice, int quantity) {
        return money(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }

    public BigDecimal money(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
