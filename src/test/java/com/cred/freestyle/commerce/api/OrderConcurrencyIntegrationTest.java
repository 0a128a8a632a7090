package com.cred.freestyle.commerce.api;

import com.cred.freestyle.commerce.domain.model.Coupon;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.domain.model.User;
import com.cred.freestyle.commerce.exception.ConcurrencyConflictException;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.InvalidCouponException;
import com.cred.freestyle.commerce.infrastructure.cache.ProductCacheService;
import com.cred.freestyle.commerce.infrastructure.messaging.OrderEventProducer;
import com.cred.freestyle.commerce.repository.*;
import com.cred.freestyle.commerce.service.CartService;
import com.cred.freestyle.commerce.service.OrderPlacementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many customers race for the last units of one product.
 *
 * Whatever the interleaving, stock never goes negative and the number of
 * placed orders equals the number of units sold. A coupon raced the same
 * way is never redeemed past its usage limit.
 */
@SpringBootTest
@DisplayName("Order Placement Concurrency Integration Tests")
class OrderConcurrencyIntegrationTest {

    private static final int INITIAL_STOCK = 5;
    private static final int CUSTOMERS = 12;
    private static final int COUPON_LIMIT = 2;
    private static final String COUPON_CODE = "RACE2";

    @Autowired
    private OrderPlacementService orderPlacementService;

    @Autowired
    private CartService cartService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CartRepository cartRepository;

    @Autowired
    private CartItemRepository cartItemRepository;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private ShippingRepository shippingRepository;

    @MockBean
    private OrderEventProducer orderEventProducer;

    @MockBean
    private ProductCacheService productCacheService;

    private Product product;
    private final List<String> customerIds = new ArrayList<>();

    @BeforeEach
    void setUp() {
        orderItemRepository.deleteAll();
        paymentRepository.deleteAll();
        shippingRepository.deleteAll();
        orderRepository.deleteAll();
        cartItemRepository.deleteAll();
        cartRepository.deleteAll();
        productRepository.deleteAll();
        couponRepository.deleteAll();

        product = productRepository.save(Product.builder()
                .name("Limited Edition Print")
                .price(new BigDecimal("40.00"))
                .stockQty(INITIAL_STOCK)
                .isActive(true)
                .build());

        customerIds.clear();
        for (int i = 0; i < CUSTOMERS; i++) {
            User user = userRepository.save(User.builder()
                    .name("Racer " + i)
                    .email("racer-" + i + "-" + System.nanoTime() + "@example.com")
                    .passwordHash("unused")
                    .address(i + " Race Road")
                    .isActive(true)
                    .build());
            cartService.addItem(user.getUserId(), product.getProductId(), 1);
            customerIds.add(user.getUserId());
        }
    }

    @Test
    @DisplayName("Concurrent checkouts never oversell")
    void concurrentCheckouts_NeverOversell() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(CUSTOMERS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger placed = new AtomicInteger();
        AtomicInteger outOfStock = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (String customerId : customerIds) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    orderPlacementService.placeOrder(customerId, null, null, null);
                    placed.incrementAndGet();
                } catch (InsufficientStockException e) {
                    outOfStock.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        int finalStock = productRepository.findById(product.getProductId()).orElseThrow().getStockQty();
        assertThat(finalStock).isGreaterThanOrEqualTo(0);
        assertThat(placed.get()).isEqualTo(INITIAL_STOCK - finalStock);
        assertThat(orderRepository.count()).isEqualTo(placed.get());
        assertThat(placed.get() + outOfStock.get() + conflicts.get()).isEqualTo(CUSTOMERS);
        assertThat(placed.get()).isLessThanOrEqualTo(INITIAL_STOCK);
    }

    @Test
    @DisplayName("Concurrent checkouts with one coupon never redeem it past its limit")
    void concurrentCouponRedemptions_StopAtLimit() throws Exception {
        // Given
        Coupon coupon = couponRepository.save(Coupon.builder()
                .code(COUPON_CODE)
                .discountType(Coupon.DiscountType.FIXED)
                .discountValue(new BigDecimal("5.00"))
                .minOrderAmount(BigDecimal.ZERO)
                .usageLimit(COUPON_LIMIT)
                .usedCount(0)
                .validFrom(Instant.now().minus(1, ChronoUnit.DAYS))
                .validUntil(Instant.now().plus(1, ChronoUnit.DAYS))
                .isActive(true)
                .build());
        ExecutorService executor = Executors.newFixedThreadPool(CUSTOMERS);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger placed = new AtomicInteger();
        AtomicInteger couponRejected = new AtomicInteger();
        AtomicInteger outOfStock = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (String customerId : customerIds) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    orderPlacementService.placeOrder(customerId, null, COUPON_CODE, null);
                    placed.incrementAndGet();
                } catch (InvalidCouponException e) {
                    couponRejected.incrementAndGet();
                } catch (InsufficientStockException e) {
                    outOfStock.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        int usedCount = couponRepository.findById(coupon.getCouponId()).orElseThrow().getUsedCount();
        long ordersWithCoupon = orderRepository.findAll().stream()
                .filter(order -> COUPON_CODE.equals(order.getCouponCode()))
                .count();
        int finalStock = productRepository.findById(product.getProductId()).orElseThrow().getStockQty();

        assertThat(placed.get() + couponRejected.get() + outOfStock.get() + conflicts.get()).isEqualTo(CUSTOMERS);
        assertThat(usedCount).isEqualTo(Math.min(COUPON_LIMIT, CUSTOMERS - conflicts.get()));
        assertThat(usedCount).isEqualTo(placed.get());
        assertThat(ordersWithCoupon).isEqualTo(placed.get());
        assertThat(orderRepository.count()).isEqualTo(placed.get());
        assertThat(finalStock).isEqualTo(INITIAL_STOCK - placed.get());
        assertThat(outOfStock.get()).isZero();
    }
}
