package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.exception.ConcurrencyConflictException;
import com.cred.freestyle.commerce.exception.EmptyCartException;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.InvalidCouponException;
import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Order placement entry point.
 *
 * Runs {@link OrderPlacementTransaction} under the order placement
 * {@link RetryTemplate}. Each attempt is a fresh transaction; an attempt
 * that loses a lock race is rolled back entirely before the next one starts.
 * When every attempt fails on a lock conflict the caller gets a retryable
 * {@link ConcurrencyConflictException}.
 *
 * Business failures (empty cart, stock, coupon) are thrown from the first
 * attempt unchanged.
 *
 * @author Commerce Platform Team
 */
@Service
public class OrderPlacementService {

    private static final Logger logger = LoggerFactory.getLogger(OrderPlacementService.class);

    private final OrderPlacementTransaction placementTransaction;
    private final RetryTemplate retryTemplate;
    private final CommerceMetricsService metricsService;
    private final int maxAttempts;

    public OrderPlacementService(
            OrderPlacementTransaction placementTransaction,
            RetryTemplate orderPlacementRetryTemplate,
            CommerceMetricsService metricsService,
            @Value("${commerce.order.max-attempts:3}") int maxAttempts
    ) {
        this.placementTransaction = placementTransaction;
        this.retryTemplate = orderPlacementRetryTemplate;
        this.metricsService = metricsService;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Place an order from the user's current cart.
     *
     * @param userId Authenticated user ID
     * @param shippingAddress Address for this order, or null to use the profile address
     * @param couponCode Optional coupon code
     * @param paymentMethod Optional payment method
     * @return Created order with items, payment and shipment
     * @throws EmptyCartException if the cart is empty
     * @throws InsufficientStockException if a product cannot cover its quantity
     * @throws InvalidCouponException if the coupon cannot be applied
     * @throws ConcurrencyConflictException if lock conflicts persisted through every attempt
     */
    public OrderDetails placeOrder(String userId, String shippingAddress, String couponCode, String paymentMethod) {
        long startTime = System.currentTimeMillis();

        try {
            OrderDetails details = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    logger.warn("Retrying order placement for user {} (attempt {}) after: {}",
                            userId, context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                    metricsService.recordOrderRetry();
                }
                return placementTransaction.placeOrder(userId, shippingAddress, couponCode, paymentMethod);
            });

            metricsService.recordOrderPlaced(
                    details.getOrder().getTotalAmount(),
                    details.getItems().size(),
                    details.getOrder().getCouponCode() != null);
            metricsService.recordCheckoutLatency(System.currentTimeMillis() - startTime);
            return details;

        } catch (EmptyCartException e) {
            logger.warn("Order placement rejected for user {}: empty cart", userId);
            metricsService.recordOrderFailure("EMPTY_CART");
            throw e;

        } catch (InsufficientStockException e) {
            logger.warn("Order placement rejected for user {}: {}", userId, e.getMessage());
            metricsService.recordOrderFailure("INSUFFICIENT_STOCK");
            throw e;

        } catch (InvalidCouponException e) {
            logger.warn("Order placement rejected for user {}: {}", userId, e.getMessage());
            metricsService.recordOrderFailure("INVALID_COUPON_" + e.getReason().name());
            throw e;

        } catch (PessimisticLockingFailureException | OptimisticLockingFailureException e) {
            logger.warn("Order placement for user {} gave up after lock conflicts: {}", userId, e.getMessage());
            metricsService.recordOrderFailure("CONCURRENCY_CONFLICT");
            throw new ConcurrencyConflictException(
                    "Order could not be placed because the same products are being purchased concurrently. Please retry.",
                    maxAttempts, e);
        }
    }
}
