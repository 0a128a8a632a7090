package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Order entity created by checkout from the contents of a user's cart.
 *
 * Amounts:
 * - subtotalAmount: sum of price at time x quantity over all items
 * - discountAmount: coupon discount, 0 when no coupon was applied
 * - totalAmount: subtotal minus discount, never negative
 *
 * Lifecycle: CREATED -> PAID -> SHIPPED -> DELIVERED, with CANCELLED
 * reachable from CREATED and PAID.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_order_date", columnList = "order_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    /**
     * User who placed the order.
     */
    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "order_date", nullable = false)
    private Instant orderDate;

    @Column(name = "subtotal_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotalAmount;

    @Column(name = "discount_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    /**
     * Code of the redeemed coupon, null when none was applied.
     */
    @Column(name = "coupon_code", length = 50)
    private String couponCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "shipping_address", nullable = false, columnDefinition = "TEXT")
    private String shippingAddress;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (orderId == null) {
            orderId = UUID.randomUUID().toString();
        }
        if (orderDate == null) {
            orderDate = Instant.now();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Mark order as paid once its payment is completed.
     */
    public void markPaid() {
        requireStatus(OrderStatus.CREATED, "mark as paid");
        this.status = OrderStatus.PAID;
    }

    /**
     * Mark order as handed over to the courier.
     */
    public void markShipped() {
        requireStatus(OrderStatus.PAID, "ship");
        this.status = OrderStatus.SHIPPED;
    }

    public void markDelivered() {
        requireStatus(OrderStatus.SHIPPED, "deliver");
        this.status = OrderStatus.DELIVERED;
    }

    /**
     * Cancel the order. Only orders that have not shipped can be cancelled.
     */
    public void cancel() {
        if (!isCancellable()) {
            throw new IllegalStateException(
                    String.format("Cannot cancel order %s in status %s", orderId, status));
        }
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = Instant.now();
    }

    public boolean isCancellable() {
        return status == OrderStatus.CREATED || status == OrderStatus.PAID;
    }

    private void requireStatus(OrderStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                    String.format("Cannot %s order %s in status %s (expected %s)", action, orderId, status, expected));
        }
    }

    /**
     * Order status enum.
     */
    public enum OrderStatus {
        CREATED,     // Placed, awaiting payment
        PAID,        // Payment completed
        SHIPPED,     // With the courier
        DELIVERED,   // Received by the customer
        CANCELLED    // Cancelled before shipping, stock returned
    }
}
