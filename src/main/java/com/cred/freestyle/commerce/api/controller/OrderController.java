package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.OrderResponse;
import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.api.dto.PaymentConfirmationRequest;
import com.cred.freestyle.commerce.api.dto.PlaceOrderRequest;
import com.cred.freestyle.commerce.api.dto.ShipmentRequest;
import com.cred.freestyle.commerce.exception.ConcurrencyConflictException;
import com.cred.freestyle.commerce.exception.EmptyCartException;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.InvalidCouponException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.commerce.security.SecurityUtils;
import com.cred.freestyle.commerce.service.OrderDetails;
import com.cred.freestyle.commerce.service.OrderPlacementService;
import com.cred.freestyle.commerce.service.OrderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for order placement and the order lifecycle.
 *
 * Flow:
 * 1. Customer fills the cart
 * 2. POST /api/v1/orders turns the cart into an order (CREATED, payment PENDING)
 * 3. Payment callback marks the order PAID
 * 4. Back office ships and delivers it
 *
 * A customer may cancel their own order until it ships.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/orders")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderPlacementService orderPlacementService;
    private final OrderService orderService;
    private final CommerceMetricsService metricsService;

    public OrderController(
            OrderPlacementService orderPlacementService,
            OrderService orderService,
            CommerceMetricsService metricsService
    ) {
        this.orderPlacementService = orderPlacementService;
        this.orderService = orderService;
        this.metricsService = metricsService;
    }

    /**
     * Place an order from the caller's cart.
     *
     * The body is optional; see {@link PlaceOrderRequest} for defaults.
     *
     * @return 201 with the created order, its items, payment and shipment
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderResponse> placeOrder(@Valid @RequestBody(required = false) PlaceOrderRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        PlaceOrderRequest body = request != null ? request : new PlaceOrderRequest();

        logger.info("Placing order for user {} (coupon: {})", userId, body.getCouponCode());

        try {
            OrderDetails details = orderPlacementService.placeOrder(
                    userId,
                    body.getShippingAddress(),
                    body.getCouponCode(),
                    body.getPaymentMethod()
            );

            logger.info("Placed order {} for user {}, total {}",
                    details.getOrder().getOrderId(), userId, details.getOrder().getTotalAmount());

            return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(details));

        } catch (EmptyCartException | InsufficientStockException | InvalidCouponException
                 | ConcurrencyConflictException | ResourceNotFoundException | IllegalArgumentException e) {
            // Rejections are logged and counted by the placement service
            throw e;

        } catch (RuntimeException e) {
            logger.error("Unexpected error placing order for user {}", userId, e);
            metricsService.recordError("ORDER_PLACEMENT_ERROR", "placeOrder");
            throw e;
        }
    }

    /**
     * Orders of the caller, newest first.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<OrderResponse>> getMyOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(PageResponse.from(
                orderService.getOrdersForUser(userId, Pagination.of(page, size)), OrderResponse::from));
    }

    @GetMapping("/all")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<PageResponse<OrderResponse>> getAllOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                orderService.getAllOrders(Pagination.of(page, size)), OrderResponse::from));
    }

    /**
     * Authorization: owner or admin.
     */
    @GetMapping("/{orderId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        logger.debug("Fetching order: {}", orderId);
        OrderDetails details = orderService.getOrderDetails(orderId);
        SecurityUtils.verifyUserAccess(details.getOrder().getUserId());
        return ResponseEntity.ok(OrderResponse.from(details));
    }

    /**
     * Payment gateway callback: payment succeeded.
     */
    @PostMapping("/{orderId}/payment")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> completePayment(
            @PathVariable String orderId,
            @Valid @RequestBody PaymentConfirmationRequest request
    ) {
        return ResponseEntity.ok(OrderResponse.from(
                orderService.completePayment(orderId, request.getTransactionId())));
    }

    @PostMapping("/{orderId}/payment/failure")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> failPayment(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.failPayment(orderId)));
    }

    @PostMapping("/{orderId}/ship")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> shipOrder(
            @PathVariable String orderId,
            @Valid @RequestBody ShipmentRequest request
    ) {
        return ResponseEntity.ok(OrderResponse.from(orderService.ship(
                orderId,
                request.getCourierName(),
                request.getTrackingNumber(),
                request.getEstimatedDelivery()
        )));
    }

    @PostMapping("/{orderId}/deliver")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> deliverOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderService.deliver(orderId)));
    }

    /**
     * Cancel an order that has not shipped yet. Stock is returned.
     *
     * Authorization: owner or admin.
     */
    @PostMapping("/{orderId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrderResponse> cancelOrder(@PathVariable String orderId) {
        SecurityUtils.verifyUserAccess(orderService.getOrder(orderId).getUserId());

        logger.info("Cancelling order: {}", orderId);
        OrderDetails details = orderService.cancel(orderId);
        return ResponseEntity.ok(OrderResponse.from(details));
    }
}
