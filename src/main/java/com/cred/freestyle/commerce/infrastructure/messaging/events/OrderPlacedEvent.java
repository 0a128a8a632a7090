package com.cred.freestyle.commerce.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Event raised when checkout commits a new order.
 * Published inside the checkout transaction as a Spring application event,
 * relayed to Kafka only after the transaction commits.
 *
 * @author Commerce Platform Team
 */
public class OrderPlacedEvent {

    private String orderId;
    private String userId;
    private BigDecimal subtotalAmount;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;
    private String couponCode;
    private List<Line> items;
    private Instant timestamp;

    // Default constructor for JSON deserialization
    public OrderPlacedEvent() {
        this.items = new ArrayList<>();
    }

    public OrderPlacedEvent(String orderId, String userId, BigDecimal subtotalAmount, BigDecimal discountAmount,
                            BigDecimal totalAmount, String couponCode, List<Line> items) {
        this.orderId = orderId;
        this.userId = userId;
        this.subtotalAmount = subtotalAmount;
        this.discountAmount = discountAmount;
        this.totalAmount = totalAmount;
        this.couponCode = couponCode;
        this.items = items;
        this.timestamp = Instant.now();
    }

    /**
     * @return IDs of every product whose stock changed
     */
    public List<String> productIds() {
        return items.stream().map(Line::getProductId).collect(Collectors.toList());
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public BigDecimal getSubtotalAmount() {
        return subtotalAmount;
    }

    public void setSubtotalAmount(BigDecimal subtotalAmount) {
        this.subtotalAmount = subtotalAmount;
    }

    public BigDecimal getDiscountAmount() {
        return discountAmount;
    }

    public void setDiscountAmount(BigDecimal discountAmount) {
        this.discountAmount = discountAmount;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getCouponCode() {
        return couponCode;
    }

    public void setCouponCode(String couponCode) {
        this.couponCode = couponCode;
    }

    public List<Line> getItems() {
        return items;
    }

    public void setItems(List<Line> items) {
        this.items = items;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * One ordered product.
     */
    public static class Line {
        private String productId;
        private Integer quantity;
        private BigDecimal unitPrice;

        public Line() {
        }

        public Line(String productId, Integer quantity, BigDecimal unitPrice) {
            this.productId = productId;
            this.quantity = quantity;
            this.unitPrice = unitPrice;
        }

        public String getProductId() {
            return productId;
        }

        public void setProductId(String productId) {
            this.productId = productId;
        }

        public Integer getQuantity() {
            return quantity;
        }

        public void setQuantity(Integer quantity) {
            this.quantity = quantity;
        }

        public BigDecimal getUnitPrice() {
            return unitPrice;
        }

        public void setUnitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
        }
    }
}
