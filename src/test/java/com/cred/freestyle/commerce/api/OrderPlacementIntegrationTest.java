package com.cred.freestyle.commerce.api;

import com.cred.freestyle.commerce.domain.model.*;
import com.cred.freestyle.commerce.infrastructure.cache.ProductCacheService;
import com.cred.freestyle.commerce.infrastructure.messaging.OrderEventProducer;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderPlacedEvent;
import com.cred.freestyle.commerce.infrastructure.messaging.events.OrderStatusChangedEvent;
import com.cred.freestyle.commerce.repository.*;
import com.cred.freestyle.commerce.service.CartService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for order placement.
 * Runs against H2 with the real security filter chain and bearer tokens.
 *
 * Not @Transactional: every request commits so after-commit event relays run
 * exactly as in production.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Order Placement API Integration Tests")
class OrderPlacementIntegrationTest {

    private static final String PASSWORD = "password123";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private AdminRepository adminRepository;

    @Autowired
    private AuthTokenRepository authTokenRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private CartRepository cartRepository;

    @Autowired
    private CartItemRepository cartItemRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private ShippingRepository shippingRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private CartService cartService;

    @MockBean
    private OrderEventProducer orderEventProducer;

    @MockBean
    private ProductCacheService productCacheService;

    private User customer;
    private String customerToken;

    @BeforeEach
    void setUp() throws Exception {
        orderItemRepository.deleteAll();
        paymentRepository.deleteAll();
        shippingRepository.deleteAll();
        orderRepository.deleteAll();
        cartItemRepository.deleteAll();
        cartRepository.deleteAll();
        couponRepository.deleteAll();
        productRepository.deleteAll();
        authTokenRepository.deleteAll();
        auditLogRepository.deleteAll();
        adminRepository.deleteAll();
        userRepository.deleteAll();

        customer = userRepository.save(User.builder()
                .name("Ann Customer")
                .email("ann@example.com")
                .passwordHash(passwordEncoder.encode(PASSWORD))
                .address("221B Baker Street, London")
                .isActive(true)
                .build());
        customerToken = login("/api/v1/auth/login", "{\"email\": \"ann@example.com\", \"password\": \"" + PASSWORD + "\"}");
    }

    // ========================================
    // Helpers
    // ========================================

    private String login(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("token").asText();
    }

    private String adminToken() throws Exception {
        adminRepository.save(Admin.builder()
                .username("ops")
                .email("ops@example.com")
                .passwordHash(passwordEncoder.encode(PASSWORD))
                .role(Admin.AdminRole.ADMIN)
                .isActive(true)
                .build());
        return login("/api/v1/auth/admin/login", "{\"username\": \"ops\", \"password\": \"" + PASSWORD + "\"}");
    }

    private Product product(String price, int stock) {
        // id and version left null so the row is inserted, not merged
        return productRepository.save(Product.builder()
                .name("Widget " + price)
                .price(new BigDecimal(price))
                .stockQty(stock)
                .isActive(true)
                .build());
    }

    private Coupon percentageCoupon(String code, String fraction, String maxDiscount, int limit, int used) {
        return couponRepository.save(Coupon.builder()
                .code(code)
                .discountType(Coupon.DiscountType.PERCENTAGE)
                .discountValue(new BigDecimal(fraction))
                .maxDiscount(maxDiscount != null ? new BigDecimal(maxDiscount) : null)
                .minOrderAmount(BigDecimal.ZERO)
                .usageLimit(limit)
                .usedCount(used)
                .validFrom(Instant.now().minus(1, ChronoUnit.DAYS))
                .validUntil(Instant.now().plus(1, ChronoUnit.DAYS))
                .isActive(true)
                .build());
    }

    private void addToCart(String productId, int quantity) throws Exception {
        mockMvc.perform(post("/api/v1/cart/items")
                        .header("Authorization", "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\": \"" + productId + "\", \"quantity\": " + quantity + "}"))
                .andExpect(status().isOk());
    }

    private JsonNode placeOrder(String body, int expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/orders")
                        .header("Authorization", "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().is(expectedStatus))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private int stockOf(String productId) {
        return productRepository.findById(productId).orElseThrow().getStockQty();
    }

    // ========================================
    // Successful placement
    // ========================================

    @Test
    @DisplayName("Two units at 10.00 - order 20.00, stock decremented, payment and shipment pending, cart cleared")
    void placeOrder_NoCoupon() throws Exception {
        // Given
        Product widget = product("10.00", 10);
        addToCart(widget.getProductId(), 2);

        // When
        JsonNode order = placeOrder("{}", 201);

        // Then
        String orderId = order.get("orderId").asText();
        assertThat(order.get("status").asText()).isEqualTo("CREATED");
        assertThat(order.get("subtotalAmount").decimalValue()).isEqualByComparingTo("20.00");
        assertThat(order.get("totalAmount").decimalValue()).isEqualByComparingTo("20.00");
        assertThat(order.get("shippingAddress").asText()).isEqualTo("221B Baker Street, London");

        assertThat(stockOf(widget.getProductId())).isEqualTo(8);
        assertThat(orderItemRepository.findByOrderId(orderId)).singleElement()
                .satisfies(item -> assertThat(item.getPriceAtTime()).isEqualByComparingTo("10.00"));

        Payment payment = paymentRepository.findByOrderId(orderId).orElseThrow();
        assertThat(payment.getPaymentStatus()).isEqualTo(Payment.PaymentStatus.PENDING);
        assertThat(payment.getAmount()).isEqualByComparingTo("20.00");
        assertThat(shippingRepository.findByOrderId(orderId).orElseThrow().getShippingStatus())
                .isEqualTo(Shipping.ShippingStatus.PENDING);

        assertThat(cartService.getCartItems(customer.getUserId())).isEmpty();
        verify(orderEventProducer).publishOrderPlaced(any(OrderPlacedEvent.class));
        verify(productCacheService).evictProducts(List.of(widget.getProductId()));
    }

    @Test
    @DisplayName("10% coupon capped at 5.00 on 100.00 - total 95.00 and coupon usage incremented")
    void placeOrder_WithCoupon() throws Exception {
        // Given
        Product widget = product("50.00", 10);
        Coupon coupon = percentageCoupon("SAVE10", "0.10", "5.00", 100, 0);
        addToCart(widget.getProductId(), 2);

        // When
        JsonNode order = placeOrder("{\"couponCode\": \"SAVE10\"}", 201);

        // Then
        assertThat(order.get("subtotalAmount").decimalValue()).isEqualByComparingTo("100.00");
        assertThat(order.get("discountAmount").decimalValue()).isEqualByComparingTo("5.00");
        assertThat(order.get("totalAmount").decimalValue()).isEqualByComparingTo("95.00");
        assertThat(order.get("couponCode").asText()).isEqualTo("SAVE10");
        assertThat(couponRepository.findById(coupon.getCouponId()).orElseThrow().getUsedCount()).isEqualTo(1);
    }

    // ========================================
    // Rejections leave no trace
    // ========================================

    @Test
    @DisplayName("Stock 1 with quantity 2 - 409, nothing written, cart kept")
    void placeOrder_InsufficientStock() throws Exception {
        // Given
        Product widget = product("10.00", 1);
        addToCart(widget.getProductId(), 2);

        // When
        JsonNode error = placeOrder("{}", 409);

        // Then
        assertThat(error.get("details").get("productId").asText()).isEqualTo(widget.getProductId());
        assertThat(error.get("details").get("availableQuantity").asInt()).isEqualTo(1);
        assertThat(stockOf(widget.getProductId())).isEqualTo(1);
        assertThat(orderRepository.count()).isZero();
        assertThat(paymentRepository.count()).isZero();
        assertThat(cartService.getCartItems(customer.getUserId())).hasSize(1);
        verify(orderEventProducer, never()).publishOrderPlaced(any());
    }

    @Test
    @DisplayName("Exhausted coupon - 400, no order and stock untouched")
    void placeOrder_ExhaustedCoupon() throws Exception {
        // Given
        Product widget = product("10.00", 10);
        percentageCoupon("USED", "0.10", null, 1, 1);
        addToCart(widget.getProductId(), 1);

        // When
        JsonNode error = placeOrder("{\"couponCode\": \"USED\"}", 400);

        // Then
        assertThat(error.get("details").get("reason").asText()).isEqualTo("USAGE_LIMIT_REACHED");
        assertThat(orderRepository.count()).isZero();
        assertThat(stockOf(widget.getProductId())).isEqualTo(10);
    }

    @Test
    @DisplayName("Retrying against short stock fails the same way and still writes nothing")
    void placeOrder_InsufficientStockRetried() throws Exception {
        // Given
        Product widget = product("10.00", 1);
        addToCart(widget.getProductId(), 2);

        for (int attempt = 0; attempt < 2; attempt++) {
            // When
            JsonNode error = placeOrder("{}", 409);

            // Then
            assertThat(error.get("error").asText()).isEqualTo("Insufficient Stock");
            assertThat(error.get("details").get("productId").asText()).isEqualTo(widget.getProductId());
            assertThat(stockOf(widget.getProductId())).isEqualTo(1);
            assertThat(orderRepository.count()).isZero();
            assertThat(paymentRepository.count()).isZero();
            assertThat(cartService.getCartItems(customer.getUserId())).hasSize(1);
        }
    }

    @Test
    @DisplayName("Retrying with an exhausted coupon fails the same way and leaves usage, stock and orders unchanged")
    void placeOrder_ExhaustedCouponRetried() throws Exception {
        // Given
        Product widget = product("10.00", 10);
        Coupon coupon = percentageCoupon("SPENT", "0.10", null, 1, 1);
        addToCart(widget.getProductId(), 1);

        for (int attempt = 0; attempt < 2; attempt++) {
            // When
            JsonNode error = placeOrder("{\"couponCode\": \"SPENT\"}", 400);

            // Then
            assertThat(error.get("details").get("reason").asText()).isEqualTo("USAGE_LIMIT_REACHED");
            assertThat(couponRepository.findById(coupon.getCouponId()).orElseThrow().getUsedCount()).isEqualTo(1);
            assertThat(stockOf(widget.getProductId())).isEqualTo(10);
            assertThat(orderRepository.count()).isZero();
        }
    }

    @Test
    @DisplayName("Unknown coupon - 400 NOT_FOUND")
    void placeOrder_UnknownCoupon() throws Exception {
        Product widget = product("10.00", 10);
        addToCart(widget.getProductId(), 1);

        JsonNode error = placeOrder("{\"couponCode\": \"NOPE\"}", 400);

        assertThat(error.get("details").get("reason").asText()).isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("Empty cart - 400")
    void placeOrder_EmptyCart() throws Exception {
        JsonNode error = placeOrder("{}", 400);

        assertThat(error.get("error").asText()).isEqualTo("Empty Cart");
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    @DisplayName("No bearer token - 401")
    void placeOrder_Unauthenticated() throws Exception {
        mockMvc.perform(post("/api/v1/orders").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Revoked token - 401")
    void placeOrder_AfterLogout() throws Exception {
        mockMvc.perform(post("/api/v1/auth/logout").header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/orders").header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Self-deactivated customer - old token gets 401 and no order is placed")
    void placeOrder_AfterSelfDeactivation() throws Exception {
        // Given
        Product widget = product("10.00", 5);
        addToCart(widget.getProductId(), 1);
        mockMvc.perform(delete("/api/v1/users/" + customer.getUserId())
                        .header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isNoContent());

        // When / Then
        mockMvc.perform(post("/api/v1/orders")
                        .header("Authorization", "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
        assertThat(orderRepository.count()).isZero();
        assertThat(stockOf(widget.getProductId())).isEqualTo(5);
        assertThat(authTokenRepository.findAll()).allSatisfy(token -> assertThat(token.getRevoked()).isTrue());
    }

    @Test
    @DisplayName("Customer deactivated without token revocation - 401 and no order is placed")
    void placeOrder_DeactivatedWithLiveToken() throws Exception {
        // Given
        Product widget = product("10.00", 5);
        addToCart(widget.getProductId(), 1);
        User stored = userRepository.findById(customer.getUserId()).orElseThrow();
        stored.setIsActive(false);
        userRepository.save(stored);

        // When / Then
        mockMvc.perform(post("/api/v1/orders")
                        .header("Authorization", "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
        assertThat(orderRepository.count()).isZero();
        assertThat(stockOf(widget.getProductId())).isEqualTo(5);
    }

    // ========================================
    // Lifecycle after placement
    // ========================================

    @Test
    @DisplayName("Customer cancels a CREATED order - stock restored and payment failed")
    void cancelOrder_RestoresStock() throws Exception {
        // Given
        Product widget = product("10.00", 5);
        addToCart(widget.getProductId(), 3);
        String orderId = placeOrder("{}", 201).get("orderId").asText();
        assertThat(stockOf(widget.getProductId())).isEqualTo(2);

        // When
        mockMvc.perform(post("/api/v1/orders/" + orderId + "/cancel")
                        .header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.payment.paymentStatus").value("FAILED"));

        // Then
        assertThat(stockOf(widget.getProductId())).isEqualTo(5);
        verify(orderEventProducer).publishOrderStatusChanged(any(OrderStatusChangedEvent.class));
    }

    @Test
    @DisplayName("Admin moves an order through PAID, SHIPPED and DELIVERED")
    void adminLifecycle() throws Exception {
        // Given
        Product widget = product("10.00", 5);
        addToCart(widget.getProductId(), 1);
        String orderId = placeOrder("{}", 201).get("orderId").asText();
        String admin = adminToken();

        // When / Then
        mockMvc.perform(post("/api/v1/orders/" + orderId + "/payment")
                        .header("Authorization", "Bearer " + admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\": \"txn-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"))
                .andExpect(jsonPath("$.payment.transactionId").value("txn-1"));

        mockMvc.perform(post("/api/v1/orders/" + orderId + "/ship")
                        .header("Authorization", "Bearer " + admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"courierName\": \"DHL\", \"trackingNumber\": \"TRK-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SHIPPED"));

        mockMvc.perform(post("/api/v1/orders/" + orderId + "/deliver")
                        .header("Authorization", "Bearer " + admin))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELIVERED"))
                .andExpect(jsonPath("$.shipping.shippingStatus").value("DELIVERED"));

        // Shipped orders can no longer be cancelled
        mockMvc.perform(post("/api/v1/orders/" + orderId + "/cancel")
                        .header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isBadRequest());

        assertThat(auditLogRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Customer token cannot confirm payments - 403")
    void customerCannotConfirmPayment() throws Exception {
        mockMvc.perform(post("/api/v1/orders/any/payment")
                        .header("Authorization", "Bearer " + customerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\": \"txn-1\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Customer lists own orders newest first")
    void listOwnOrders() throws Exception {
        Product widget = product("10.00", 5);
        addToCart(widget.getProductId(), 1);
        placeOrder("{}", 201);

        mockMvc.perform(get("/api/v1/orders").header("Authorization", "Bearer " + customerToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content", hasSize(1)))
                .andExpect(jsonPath("$.totalElements").value(1));
    }
}
