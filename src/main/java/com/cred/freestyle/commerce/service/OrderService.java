package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Order;
import com.cred.freestyle.commerce.domain.model.OrderItem;
import com.cred.freestyle.commerce.domain.model.Payment;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.domain.model.Shipping;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderStatusChangedEvent;
import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.commerce.repository.*;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for the order lifecycle after placement.
 *
 * Transitions:
 * - completePayment: payment PENDING -> COMPLETED, order CREATED -> PAID
 * - failPayment: payment PENDING -> FAILED, order stays CREATED
 * - ship: shipment PENDING -> SHIPPED, order PAID -> SHIPPED
 * - deliver: shipment SHIPPED -> DELIVERED, order SHIPPED -> DELIVERED
 * - cancel: order CREATED/PAID -> CANCELLED, stock returned, pending payment failed
 *
 * Each transition raises an OrderStatusChangedEvent relayed after commit.
 * Transitions performed by admins are audited.
 *
 * @author Commerce Platform Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private static final String TABLE = "orders";

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PaymentRepository paymentRepository;
    private final ShippingRepository shippingRepository;
    private final ProductRepository productRepository;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final CommerceMetricsService metricsService;

    public OrderService(
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            PaymentRepository paymentRepository,
            ShippingRepository shippingRepository,
            ProductRepository productRepository,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher,
            CommerceMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.paymentRepository = paymentRepository;
        this.shippingRepository = shippingRepository;
        this.productRepository = productRepository;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    @Transactional(readOnly = true)
    public Order getOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    @Transactional(readOnly = true)
    public OrderDetails getOrderDetails(String orderId) {
        return toDetails(getOrder(orderId));
    }

    /**
     * Orders of one user, newest first.
     */
    @Transactional(readOnly = true)
    public Page<OrderDetails> getOrdersForUser(String userId, Pageable pageable) {
        return orderRepository.findByUserIdOrderByOrderDateDesc(userId, pageable).map(this::toDetails);
    }

    @Transactional(readOnly = true)
    public Page<OrderDetails> getAllOrders(Pageable pageable) {
        return orderRepository.findAllByOrderByOrderDateDesc(pageable).map(this::toDetails);
    }

    /**
     * Payment gateway confirmed the payment.
     *
     * @param orderId Order ID
     * @param transactionId Gateway transaction reference
     */
    @Transactional
    public OrderDetails completePayment(String orderId, String transactionId) {
        Order order = getOrder(orderId);
        String before = auditService.snapshot(order);
        Payment payment = requirePayment(orderId);

        order.markPaid();
        payment.complete(transactionId);
        paymentRepository.save(payment);
        orderRepository.save(order);

        afterTransition(order, before, Order.OrderStatus.CREATED, Collections.emptyList());
        logger.info("Payment completed for order {}, transaction {}", orderId, transactionId);
        return toDetails(order);
    }

    /**
     * Payment gateway reported a failed payment. The order stays CREATED.
     */
    @Transactional
    public OrderDetails failPayment(String orderId) {
        Order order = getOrder(orderId);
        if (order.getStatus() != Order.OrderStatus.CREATED) {
            throw new IllegalStateException(
                    String.format("Cannot fail payment of order %s in status %s", orderId, order.getStatus()));
        }
        Payment payment = requirePayment(orderId);
        payment.fail();
        paymentRepository.save(payment);

        logger.warn("Payment failed for order {}", orderId);
        return toDetails(order);
    }

    @Transactional
    public OrderDetails ship(String orderId, String courierName, String trackingNumber, LocalDate estimatedDelivery) {
        Order order = getOrder(orderId);
        String before = auditService.snapshot(order);
        Shipping shipping = requireShipping(orderId);

        order.markShipped();
        shipping.ship(courierName, trackingNumber, estimatedDelivery);
        shippingRepository.save(shipping);
        orderRepository.save(order);

        afterTransition(order, before, Order.OrderStatus.PAID, Collections.emptyList());
        logger.info("Order {} shipped with {} tracking {}", orderId, shipping.getCourierName(), trackingNumber);
        return toDetails(order);
    }

    @Transactional
    public OrderDetails deliver(String orderId) {
        Order order = getOrder(orderId);
        String before = auditService.snapshot(order);
        Shipping shipping = requireShipping(orderId);

        order.markDelivered();
        shipping.deliver();
        shippingRepository.save(shipping);
        orderRepository.save(order);

        afterTransition(order, before, Order.OrderStatus.SHIPPED, Collections.emptyList());
        logger.info("Order {} delivered", orderId);
        return toDetails(order);
    }

    /**
     * Cancel an order that has not shipped. Ordered units go back to stock
     * under row locks; a pending payment is marked FAILED. Coupon
     * redemptions are not returned.
     */
    @Transactional
    public OrderDetails cancel(String orderId) {
        Order order = getOrder(orderId);
        String before = auditService.snapshot(order);
        Order.OrderStatus previous = order.getStatus();

        order.cancel();

        List<OrderItem> items = orderItemRepository.findByOrderId(orderId).stream()
                .sorted(Comparator.comparing(OrderItem::getProductId))
                .collect(Collectors.toList());
        for (OrderItem item : items) {
            Product product = productRepository.findByIdWithLock(item.getProductId())
                    .orElseThrow(() -> new ResourceNotFoundException("Product", item.getProductId()));
            product.restoreStock(item.getQuantity());
            productRepository.save(product);
        }

        paymentRepository.findByOrderId(orderId)
                .filter(Payment::isPending)
                .ifPresent(payment -> {
                    payment.fail();
                    paymentRepository.save(payment);
                });

        orderRepository.save(order);

        List<String> restocked = items.stream().map(OrderItem::getProductId).collect(Collectors.toList());
        afterTransition(order, before, previous, restocked);
        logger.info("Order {} cancelled, restocked {} products", orderId, restocked.size());
        return toDetails(order);
    }

    private void afterTransition(Order order, String before, Order.OrderStatus previous, List<String> restocked) {
        if (SecurityUtils.isAdmin()) {
            auditService.record(SecurityUtils.getCurrentUserId(), AuditAction.STATUS_CHANGE, TABLE,
                    order.getOrderId(), before, order);
        }
        eventPublisher.publishEvent(new OrderStatusChangedEvent(
                order.getOrderId(), order.getUserId(), previous.name(), order.getStatus().name(), restocked));
        metricsService.recordOrderStatusChange(order.getStatus().name());
    }

    private Payment requirePayment(String orderId) {
        return paymentRepository.findByOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", orderId));
    }

    private Shipping requireShipping(String orderId) {
        return shippingRepository.findByOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Shipping", orderId));
    }

    private OrderDetails toDetails(Order order) {
        String orderId = order.getOrderId();
        return new OrderDetails(
                order,
                orderItemRepository.findByOrderId(orderId),
                paymentRepository.findByOrderId(orderId).orElse(null),
                shippingRepository.findByOrderId(orderId).orElse(null));
    }
}
