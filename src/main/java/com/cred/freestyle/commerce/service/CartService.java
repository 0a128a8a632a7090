package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Cart;
import com.cred.freestyle.commerce.domain.model.CartItem;
import com.cred.freestyle.commerce.domain.model.Product;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.CartItemRepository;
import com.cred.freestyle.commerce.repository.CartRepository;
import com.cred.freestyle.commerce.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cart collaborator.
 *
 * Checkout depends on two operations only:
 * - {@link #getCartItems(String)}: lines in the order they were added
 * - {@link #clearCart(String)}: empties the cart inside the checkout transaction
 *
 * The remaining operations back the cart HTTP API. Carts are created
 * lazily on first write.
 *
 * @author Commerce Platform Team
 */
@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final ProductRepository productRepository;

    public CartService(
            CartRepository cartRepository,
            CartItemRepository cartItemRepository,
            ProductRepository productRepository
    ) {
        this.cartRepository = cartRepository;
        this.cartItemRepository = cartItemRepository;
        this.productRepository = productRepository;
    }

    /**
     * Current cart lines of a user, oldest first. Empty if the user has no cart.
     *
     * @param userId User ID
     * @return Cart lines
     */
    @Transactional(readOnly = true)
    public List<CartItem> getCartItems(String userId) {
        return cartRepository.findByUserId(userId)
                .map(cart -> cartItemRepository.findByCartIdOrderByCreatedAtAscCartItemIdAsc(cart.getCartId()))
                .orElse(Collections.emptyList());
    }

    /**
     * Cart lines joined with their products and priced at current prices.
     */
    @Transactional(readOnly = true)
    public CartSummary getCartSummary(String userId) {
        List<CartItem> items = getCartItems(userId);
        Map<String, Product> products = productRepository
                .findAllById(items.stream().map(CartItem::getProductId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        List<CartSummary.Line> lines = items.stream()
                .filter(item -> products.containsKey(item.getProductId()))
                .map(item -> new CartSummary.Line(item, products.get(item.getProductId())))
                .collect(Collectors.toList());

        return new CartSummary(userId, lines);
    }

    /**
     * Add a product to the cart. Adding a product that is already in the
     * cart increases the quantity of the existing line.
     *
     * @throws ResourceNotFoundException if the product is missing or inactive
     */
    @Transactional
    public CartItem addItem(String userId, String productId, int quantity) {
        requirePositive(quantity);
        productRepository.findByProductIdAndIsActiveTrue(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

        Cart cart = getOrCreateCart(userId);

        CartItem item = cartItemRepository.findByCartIdAndProductId(cart.getCartId(), productId)
                .map(existing -> {
                    existing.setQuantity(mergedQuantity(existing.getQuantity(), quantity));
                    return existing;
                })
                .orElseGet(() -> CartItem.builder()
                        .cartId(cart.getCartId())
                        .productId(productId)
                        .quantity(quantity)
                        .build());

        CartItem saved = cartItemRepository.save(item);
        logger.info("User {} cart: product {} quantity now {}", userId, productId, saved.getQuantity());
        return saved;
    }

    /**
     * Set the quantity of an existing line.
     */
    @Transactional
    public CartItem updateItemQuantity(String userId, String productId, int quantity) {
        requirePositive(quantity);
        CartItem item = findLine(userId, productId);
        item.setQuantity(quantity);
        return cartItemRepository.save(item);
    }

    @Transactional
    public void removeItem(String userId, String productId) {
        CartItem item = findLine(userId, productId);
        cartItemRepository.delete(item);
        logger.info("User {} cart: removed product {}", userId, productId);
    }

    /**
     * Remove every line of the user's cart.
     *
     * @param userId User ID
     */
    @Transactional
    public void clearCart(String userId) {
        cartRepository.findByUserId(userId).ifPresent(cart -> {
            int removed = cartItemRepository.deleteAllByCartId(cart.getCartId());
            logger.debug("Cleared {} lines from cart of user {}", removed, userId);
        });
    }

    private Cart getOrCreateCart(String userId) {
        return cartRepository.findByUserId(userId)
                .orElseGet(() -> cartRepository.save(Cart.builder().userId(userId).build()));
    }

    private CartItem findLine(String userId, String productId) {
        return cartRepository.findByUserId(userId)
                .flatMap(cart -> cartItemRepository.findByCartIdAndProductId(cart.getCartId(), productId))
                .orElseThrow(() -> new ResourceNotFoundException("CartItem", productId));
    }

    private int mergedQuantity(int current, int added) {
        try {
            return Math.addExact(current, added);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Cart line quantity too large: " + current + " + " + added, e);
        }
    }

    private void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than zero");
        }
    }
}
