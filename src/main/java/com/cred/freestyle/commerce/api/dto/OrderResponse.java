package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.domain.model.Order;
import com.cred.freestyle.commerce.domain.model.OrderItem;
import com.cred.freestyle.commerce.domain.model.Payment;
import com.cred.freestyle.commerce.domain.model.Shipping;
import com.cred.freestyle.commerce.service.OrderDetails;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Full order representation: header, priced lines, payment and shipment.
 * Returned by placement and by every lifecycle transition.
 *
 * @author Commerce Platform Team
 */
public class OrderResponse {

    private String orderId;
    private String userId;
    private String status;
    private Instant orderDate;
    private BigDecimal subtotalAmount;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;
    private String couponCode;
    private String shippingAddress;
    private Instant cancelledAt;
    private List<Item> items;
    private PaymentView payment;
    private ShippingView shipping;

    public OrderResponse() {
    }

    public static OrderResponse from(OrderDetails details) {
        Order order = details.getOrder();
        OrderResponse response = new OrderResponse();
        response.setOrderId(order.getOrderId());
        response.setUserId(order.getUserId());
        response.setStatus(order.getStatus().name());
        response.setOrderDate(order.getOrderDate());
        response.setSubtotalAmount(order.getSubtotalAmount());
        response.setDiscountAmount(order.getDiscountAmount());
        response.setTotalAmount(order.getTotalAmount());
        response.setCouponCode(order.getCouponCode());
        response.setShippingAddress(order.getShippingAddress());
        response.setCancelledAt(order.getCancelledAt());
        response.setItems(details.getItems().stream().map(Item::from).collect(Collectors.toList()));
        response.setPayment(details.getPayment() != null ? PaymentView.from(details.getPayment()) : null);
        response.setShipping(details.getShipping() != null ? ShippingView.from(details.getShipping()) : null);
        return response;
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getOrderDate() {
        return orderDate;
    }

    public void setOrderDate(Instant orderDate) {
        this.orderDate = orderDate;
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

    public String getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(String shippingAddress) {
        this.shippingAddress = shippingAddress;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public List<Item> getItems() {
        return items;
    }

    public void setItems(List<Item> items) {
        this.items = items;
    }

    public PaymentView getPayment() {
        return payment;
    }

    public void setPayment(PaymentView payment) {
        this.payment = payment;
    }

    public ShippingView getShipping() {
        return shipping;
    }

    public void setShipping(ShippingView shipping) {
        this.shipping = shipping;
    }

    /**
     * Ordered line with the unit price captured at placement time.
     */
    public static class Item {

        private String orderItemId;
        private String productId;
        private String productName;
        private Integer quantity;
        private BigDecimal priceAtTime;
        private BigDecimal lineTotal;

        public Item() {
        }

        static Item from(OrderItem orderItem) {
            Item item = new Item();
            item.setOrderItemId(orderItem.getOrderItemId());
            item.setProductId(orderItem.getProductId());
            item.setProductName(orderItem.getProductName());
            item.setQuantity(orderItem.getQuantity());
            item.setPriceAtTime(orderItem.getPriceAtTime());
            item.setLineTotal(orderItem.getLineTotal());
            return item;
        }

        public String getOrderItemId() {
            return orderItemId;
        }

        public void setOrderItemId(String orderItemId) {
            this.orderItemId = orderItemId;
        }

        public String getProductId() {
            return productId;
        }

        public void setProductId(String productId) {
            this.productId = productId;
        }

        public String getProductName() {
            return productName;
        }

        public void setProductName(String productName) {
            this.productName = productName;
        }

        public Integer getQuantity() {
            return quantity;
        }

        public void setQuantity(Integer quantity) {
            this.quantity = quantity;
        }

        public BigDecimal getPriceAtTime() {
            return priceAtTime;
        }

        public void setPriceAtTime(BigDecimal priceAtTime) {
            this.priceAtTime = priceAtTime;
        }

        public BigDecimal getLineTotal() {
            return lineTotal;
        }

        public void setLineTotal(BigDecimal lineTotal) {
            this.lineTotal = lineTotal;
        }
    }

    public static class PaymentView {

        private String paymentId;
        private String paymentMethod;
        private BigDecimal amount;
        private String paymentStatus;
        private String transactionId;
        private Instant paymentDate;

        public PaymentView() {
        }

        static PaymentView from(Payment payment) {
            PaymentView view = new PaymentView();
            view.setPaymentId(payment.getPaymentId());
            view.setPaymentMethod(payment.getPaymentMethod());
            view.setAmount(payment.getAmount());
            view.setPaymentStatus(payment.getPaymentStatus().name());
            view.setTransactionId(payment.getTransactionId());
            view.setPaymentDate(payment.getPaymentDate());
            return view;
        }

        public String getPaymentId() {
            return paymentId;
        }

        public void setPaymentId(String paymentId) {
            this.paymentId = paymentId;
        }

        public String getPaymentMethod() {
            return paymentMethod;
        }

        public void setPaymentMethod(String paymentMethod) {
            this.paymentMethod = paymentMethod;
        }

        public BigDecimal getAmount() {
            return amount;
        }

        public void setAmount(BigDecimal amount) {
            this.amount = amount;
        }

        public String getPaymentStatus() {
            return paymentStatus;
        }

        public void setPaymentStatus(String paymentStatus) {
            this.paymentStatus = paymentStatus;
        }

        public String getTransactionId() {
            return transactionId;
        }

        public void setTransactionId(String transactionId) {
            this.transactionId = transactionId;
        }

        public Instant getPaymentDate() {
            return paymentDate;
        }

        public void setPaymentDate(Instant paymentDate) {
            this.paymentDate = paymentDate;
        }
    }

    public static class ShippingView {

        private String shipmentId;
        private String courierName;
        private String trackingNumber;
        private String shippingStatus;
        private LocalDate estimatedDelivery;
        private Instant actualDelivery;

        public ShippingView() {
        }

        static ShippingView from(Shipping shipping) {
            ShippingView view = new ShippingView();
            view.setShipmentId(shipping.getShipmentId());
            view.setCourierName(shipping.getCourierName());
            view.setTrackingNumber(shipping.getTrackingNumber());
            view.setShippingStatus(shipping.getShippingStatus().name());
            view.setEstimatedDelivery(shipping.getEstimatedDelivery());
            view.setActualDelivery(shipping.getActualDelivery());
            return view;
        }

        public String getShipmentId() {
            return shipmentId;
        }

        public void setShipmentId(String shipmentId) {
            this.shipmentId = shipmentId;
        }

        public String getCourierName() {
            return courierName;
        }

        public void setCourierName(String courierName) {
            this.courierName = courierName;
        }

        public String getTrackingNumber() {
            return trackingNumber;
        }

        public void setTrackingNumber(String trackingNumber) {
            this.trackingNumber = trackingNumber;
        }

        public String getShippingStatus() {
            return shippingStatus;
        }

        public void setShippingStatus(String shippingStatus) {
            this.shippingStatus = shippingStatus;
        }

        public LocalDate getEstimatedDelivery() {
            return estimatedDelivery;
        }

        public void setEstimatedDelivery(LocalDate estimatedDelivery) {
            this.estimatedDelivery = estimatedDelivery;
        }

        public Instant getActualDelivery() {
            return actualDelivery;
        }

        public void setActualDelivery(Instant actualDelivery) {
            this.actualDelivery = actualDelivery;
        }
    }
}
