package com.cred.freestyle.commerce.testutil;

import com.cred.freestyle.commerce.domain.model.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Domain objects with sensible defaults for tests.
 * Each method returns a Lombok builder so tests override only what they care about.
 */
public final class TestDataBuilder {

    private TestDataBuilder() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static Product.ProductBuilder aProduct() {
        return Product.builder()
                .productId(newId())
                .name("Test Product")
                .description("Test product description")
                .price(new BigDecimal("10.00"))
                .stockQty(100)
                .brand("Acme")
                .isActive(true)
                .version(0L);
    }

    public static User.UserBuilder aUser() {
        return User.builder()
                .userId(newId())
                .name("Test User")
                .email("user-" + UUID.randomUUID() + "@example.com")
                .passwordHash("$2a$10$hash")
                .address("221B Baker Street, London")
                .isActive(true);
    }

    public static CartItem.CartItemBuilder aCartItem(String productId, int quantity) {
        return CartItem.builder()
                .cartItemId(newId())
                .cartId("cart-1")
                .productId(productId)
                .quantity(quantity)
                .createdAt(Instant.now());
    }

    /**
     * Active percentage coupon valid from yesterday until tomorrow, 100 uses.
     */
    public static Coupon.CouponBuilder aPercentageCoupon(String code, String fraction) {
        return Coupon.builder()
                .couponId(newId())
                .code(code)
                .discountType(Coupon.DiscountType.PERCENTAGE)
                .discountValue(new BigDecimal(fraction))
                .minOrderAmount(BigDecimal.ZERO)
                .usageLimit(100)
                .usedCount(0)
                .validFrom(Instant.now().minus(1, ChronoUnit.DAYS))
                .validUntil(Instant.now().plus(1, ChronoUnit.DAYS))
                .isActive(true)
                .version(0L);
    }

    public static Coupon.CouponBuilder aFixedCoupon(String code, String amount) {
        return aPercentageCoupon(code, amount)
                .discountType(Coupon.DiscountType.FIXED);
    }

    public static Order.OrderBuilder anOrder(String userId) {
        return Order.builder()
                .orderId(newId())
                .userId(userId)
                .orderDate(Instant.now())
                .subtotalAmount(new BigDecimal("20.00"))
                .discountAmount(new BigDecimal("0.00"))
                .totalAmount(new BigDecimal("20.00"))
                .status(Order.OrderStatus.CREATED)
                .shippingAddress("221B Baker Street, London");
    }

    public static Payment.PaymentBuilder aPendingPayment(String orderId) {
        return Payment.builder()
                .paymentId(newId())
                .orderId(orderId)
                .paymentMethod("CARD")
                .amount(new BigDecimal("20.00"))
                .paymentStatus(Payment.PaymentStatus.PENDING);
    }

    public static Shipping.ShippingBuilder aPendingShipment(String orderId) {
        return Shipping.builder()
                .shipmentId(newId())
                .orderId(orderId)
                .courierName("STANDARD")
                .shippingStatus(Shipping.ShippingStatus.PENDING);
    }
}
