package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.*;
import com.cred.freestyle.commerce.exception.AuthenticationFailedException;
import com.cred.freestyle.commerce.exception.EmptyCartException;
import com.cred.freestyle.commerce.exception.InsufficientStockException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderPlacedEvent;
import com.cred.freestyle.commerce.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * One attempt at turning a user's cart into an order, in a single database transaction.
 *
 * Steps:
 * 1. Read cart lines; empty cart fails with EmptyCartException
 * 2. Lock every referenced product row (PESSIMISTIC_WRITE, ascending product ID)
 * 3. Check each product is active with enough stock
 * 4. Price the cart at current prices
 * 5. Lock and validate the coupon, compute discount and total
 * 6. Decrement stock, redeem coupon
 * 7. Insert order, items, PENDING payment and PENDING shipment
 * 8. Clear the cart, raise OrderPlacedEvent (relayed after commit)
 *
 * Any exception rolls the whole attempt back. Locking products in a fixed
 * order keeps two checkouts over overlapping products from deadlocking.
 * This bean is called through {@link OrderPlacementService}, which retries
 * attempts that fail on lock conflicts.
 *
 * @author Commerce Platform Team
 */
@Service
public class OrderPlacementTransaction {

    private static final Logger logger = LoggerFactory.getLogger(OrderPlacementTransaction.class);

    private final CartService cartService;
    private final CouponService couponService;
    private final DiscountCalculator discountCalculator;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final PaymentRepository paymentRepository;
    private final ShippingRepository shippingRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${commerce.order.default-payment-method:CARD}")
    private String defaultPaymentMethod = "CARD";

    @Value("${commerce.order.default-courier:STANDARD}")
    private String defaultCourier = "STANDARD";

    public OrderPlacementTransaction(
            CartService cartService,
            CouponService couponService,
            DiscountCalculator discountCalculator,
            UserRepository userRepository,
            ProductRepository productRepository,
            OrderRepository orderRepository,
            OrderItemRepository orderItemRepository,
            PaymentRepository paymentRepository,
            ShippingRepository shippingRepository,
            ApplicationEventPublisher eventPublisher
    ) {
        this.cartService = cartService;
        this.couponService = couponService;
        this.discountCalculator = discountCalculator;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.paymentRepository = paymentRepository;
        this.shippingRepository = shippingRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Place an order from the user's cart.
     *
     * @param userId Authenticated user
     * @param shippingAddress Address for this order, or null to use the profile address
     * @param couponCode Optional coupon code
     * @param paymentMethod Optional payment method
     * @return The created order with items, payment and shipment
     */
    @Transactional
    public OrderDetails placeOrder(String userId, String shippingAddress, String couponCode, String paymentMethod) {
        Instant now = Instant.now();

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        if (!Boolean.TRUE.equals(user.getIsActive())) {
            throw new AuthenticationFailedException("User account is deactivated");
        }

        // Step 1: Cart must not be empty
        List<CartItem> cartItems = cartService.getCartItems(userId);
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(userId);
        }
        Map<String, Integer> requested = requestedQuantities(cartItems);

        // Step 2 + 3: Lock products in ID order and check availability
        Map<String, Product> products = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : new TreeMap<>(requested).entrySet()) {
            String productId = entry.getKey();
            int quantity = entry.getValue();

            Product product = productRepository.findByIdWithLock(productId).orElse(null);
            if (product == null || !Boolean.TRUE.equals(product.getIsActive())) {
                throw new InsufficientStockException(productId, quantity, 0);
            }
            if (!product.canFulfil(quantity)) {
                throw new InsufficientStockException(productId, quantity, product.getStockQty());
            }
            products.put(productId, product);
        }

        // Step 4: Price at current prices
        BigDecimal subtotal = BigDecimal.ZERO;
        for (Map.Entry<String, Integer> entry : requested.entrySet()) {
            Product product = products.get(entry.getKey());
            subtotal = subtotal.add(discountCalculator.lineTotal(product.getPrice(), entry.getValue()));
        }
        subtotal = discountCalculator.money(subtotal);

        // Step 5: Coupon
        Coupon coupon = null;
        String normalizedCode = couponCode == null || couponCode.isBlank() ? null : couponCode.trim();
        if (normalizedCode != null) {
            coupon = couponService.lockForRedemption(normalizedCode);
            couponService.verifyApplicable(coupon, subtotal, now);
        }
        BigDecimal discount = discountCalculator.calculateDiscount(coupon, subtotal);
        BigDecimal total = discountCalculator.calculateTotal(subtotal, discount);

        String address = resolveShippingAddress(user, shippingAddress);

        // Step 6: Stock and coupon writes (entity methods re-check at write time)
        requested.forEach((productId, quantity) -> products.get(productId).decrementStock(quantity));
        productRepository.saveAll(products.values());
        if (coupon != null) {
            coupon.redeem();
        }

        // Step 7: Order rows
        Order order = orderRepository.save(Order.builder()
                .userId(userId)
                .orderDate(now)
                .subtotalAmount(subtotal)
                .discountAmount(discount)
                .totalAmount(total)
                .couponCode(coupon != null ? coupon.getCode() : null)
                .status(Order.OrderStatus.CREATED)
                .shippingAddress(address)
                .build());

        List<OrderItem> items = new ArrayList<>();
        requested.forEach((productId, quantity) -> {
            Product product = products.get(productId);
            items.add(OrderItem.builder()
                    .orderId(order.getOrderId())
                    .productId(productId)
                    .productName(product.getName())
                    .quantity(quantity)
                    .priceAtTime(product.getPrice())
                    .lineTotal(discountCalculator.lineTotal(product.getPrice(), quantity))
                    .build());
        });
        List<OrderItem> savedItems = orderItemRepository.saveAll(items);

        Payment payment = paymentRepository.save(Payment.builder()
                .orderId(order.getOrderId())
                .paymentMethod(paymentMethod == null || paymentMethod.isBlank() ? defaultPaymentMethod : paymentMethod)
                .amount(total)
                .paymentStatus(Payment.PaymentStatus.PENDING)
                .build());

        Shipping shipping = shippingRepository.save(Shipping.builder()
                .orderId(order.getOrderId())
                .courierName(defaultCourier)
                .shippingStatus(Shipping.ShippingStatus.PENDING)
                .build());

        // Step 8: Clear cart and raise event
        cartService.clearCart(userId);

        eventPublisher.publishEvent(new OrderPlacedEvent(
                order.getOrderId(),
                userId,
                subtotal,
                discount,
                total,
                order.getCouponCode(),
                savedItems.stream()
                        .map(item -> new OrderPlacedEvent.Line(item.getProductId(), item.getQuantity(), item.getPriceAtTime()))
                        .collect(Collectors.toList())
        ));

        logger.info("Placed order {} for user {}: {} lines, subtotal {}, discount {}, total {}",
                order.getOrderId(), userId, savedItems.size(), subtotal, discount, total);

        return new OrderDetails(order, savedItems, payment, shipping);
    }

    /**
     * Sum quantities per product, keeping first-seen cart order.
     */
    private Map<String, Integer> requestedQuantities(List<CartItem> cartItems) {
        Map<String, Integer> requested = new LinkedHashMap<>();
        for (CartItem item : cartItems) {
            requested.merge(item.getProductId(), item.getQuantity(), Integer::sum);
        }
        return requested;
    }

    private String resolveShippingAddress(User user, String requestedAddress) {
        if (requestedAddress != null && !requestedAddress.isBlank()) {
            return requestedAddress.trim();
        }
        if (user.getAddress() == null || user.getAddress().isBlank()) {
            throw new IllegalArgumentException("Shipping address is required: none given and no address on profile");
        }
        return user.getAddress();
    }
}
