package com.cred.freestyle.commerce.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Records custom metrics through Micrometer; in production the registry
 * publishes to AWS CloudWatch (see CloudWatchConfig).
 *
 * Key Metrics:
 * - Order placement success/failure by reason
 * - Checkout latency
 * - Revenue per placed order
 * - Retries caused by lock conflicts
 * - Cache hit/miss rates
 * - Authentication failures and error counts
 *
 * @author Commerce Platform Team
 */
@Service
public class CommerceMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CommerceMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "commerce.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";
    private static final String AUTH_PREFIX = METRIC_PREFIX + "auth.";

    public CommerceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successfully placed order.
     *
     * @param totalAmount Order total after discount
     * @param itemCount Number of order lines
     * @param couponApplied Whether a coupon was redeemed
     */
    public void recordOrderPlaced(BigDecimal totalAmount, int itemCount, boolean couponApplied) {
        Counter.builder(ORDER_PREFIX + "placed")
                .tag("coupon", String.valueOf(couponApplied))
                .description("Successfully placed orders")
                .register(meterRegistry)
                .increment();

        DistributionSummary.builder(ORDER_PREFIX + "revenue")
                .description("Order totals after discount")
                .register(meterRegistry)
                .record(totalAmount.doubleValue());

        DistributionSummary.builder(ORDER_PREFIX + "items")
                .description("Lines per placed order")
                .register(meterRegistry)
                .record(itemCount);

        logger.debug("Recorded order placed: total={}, items={}", totalAmount, itemCount);
    }

    /**
     * Record a rejected order placement.
     *
     * @param reason Failure reason (e.g., "EMPTY_CART", "INSUFFICIENT_STOCK")
     */
    public void recordOrderFailure(String reason) {
        Counter.builder(ORDER_PREFIX + "failure")
                .tag("reason", reason)
                .description("Rejected order placements")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order failure, reason: {}", reason);
    }

    /**
     * Record a retry of the order placement transaction after a lock conflict.
     */
    public void recordOrderRetry() {
        Counter.builder(ORDER_PREFIX + "retry")
                .description("Order placement retries after lock conflicts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an order lifecycle transition.
     *
     * @param status New order status
     */
    public void recordOrderStatusChange(String status) {
        Counter.builder(ORDER_PREFIX + "status_change")
                .tag("status", status)
                .description("Order status transitions")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record checkout latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordCheckoutLatency(long durationMs) {
        Timer.builder(ORDER_PREFIX + "checkout.latency")
                .description("Order placement latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Type of cache (e.g., "product")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache miss.
     *
     * @param cacheType Type of cache (e.g., "product")
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a failed authentication attempt.
     *
     * @param reason Failure reason (e.g., "BAD_CREDENTIALS", "INVALID_TOKEN")
     */
    public void recordAuthFailure(String reason) {
        Counter.builder(AUTH_PREFIX + "failure")
                .tag("reason", reason)
                .description("Failed authentication attempts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
