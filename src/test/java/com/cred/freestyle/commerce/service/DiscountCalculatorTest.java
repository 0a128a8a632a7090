package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Coupon;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aFixedCoupon;
import static com.cred.freestyle.commerce.testutil.TestDataBuilder.aPercentageCoupon;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for checkout pricing arithmetic.
 */
@DisplayName("DiscountCalculator Unit Tests")
class DiscountCalculatorTest {

    private final DiscountCalculator calculator = new DiscountCalculator();

    @Test
    @DisplayName("No coupon - zero discount at scale 2")
    void noCoupon() {
        assertThat(calculator.calculateDiscount(null, new BigDecimal("20.00"))).isEqualByComparingTo("0.00");
        assertThat(calculator.calculateDiscount(null, new BigDecimal("20.00")).scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Percentage coupon - 10% of 100.00 capped at 5.00 gives 5.00 off, total 95.00")
    void percentageCapped() {
        // Given
        Coupon coupon = aPercentageCoupon("SAVE10", "0.10").maxDiscount(new BigDecimal("5.00")).build();
        BigDecimal subtotal = new BigDecimal("100.00");

        // When
        BigDecimal discount = calculator.calculateDiscount(coupon, subtotal);
        BigDecimal total = calculator.calculateTotal(subtotal, discount);

        // Then
        assertThat(discount).isEqualByComparingTo("5.00");
        assertThat(total).isEqualByComparingTo("95.00");
    }

    @Test
    @DisplayName("Percentage coupon - uncapped when maxDiscount is null, HALF_UP rounding")
    void percentageUncappedRounding() {
        Coupon coupon = aPercentageCoupon("SAVE15", "0.15").build();

        assertThat(calculator.calculateDiscount(coupon, new BigDecimal("33.33"))).isEqualByComparingTo("5.00");
        assertThat(calculator.calculateDiscount(coupon, new BigDecimal("100.00"))).isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("Fixed coupon - never more than the subtotal, total floored at zero")
    void fixedClampedToSubtotal() {
        // Given
        Coupon coupon = aFixedCoupon("FLAT50", "50.00").build();
        BigDecimal subtotal = new BigDecimal("30.00");

        // When
        BigDecimal discount = calculator.calculateDiscount(coupon, subtotal);

        // Then
        assertThat(discount).isEqualByComparingTo("30.00");
        assertThat(calculator.calculateTotal(subtotal, discount)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("Fixed coupon - capped by maxDiscount")
    void fixedCapped() {
        Coupon coupon = aFixedCoupon("FLAT20", "20.00").maxDiscount(new BigDecimal("7.50")).build();

        assertThat(calculator.calculateDiscount(coupon, new BigDecimal("100.00"))).isEqualByComparingTo("7.50");
    }

    @Test
    @DisplayName("lineTotal - unit price times quantity")
    void lineTotal() {
        assertThat(calculator.lineTotal(new BigDecimal("10.00"), 2)).isEqualByComparingTo("20.00");
        assertThat(calculator.lineTotal(new BigDecimal("0.335"), 3)).isEqualByComparingTo("1.01");
    }
}
