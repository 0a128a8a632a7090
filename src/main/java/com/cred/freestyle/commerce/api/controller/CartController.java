package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.AddCartItemRequest;
import com.cred.freestyle.commerce.api.dto.CartResponse;
import com.cred.freestyle.commerce.api.dto.UpdateCartItemRequest;
import com.cred.freestyle.commerce.security.SecurityUtils;
import com.cred.freestyle.commerce.service.CartService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * The caller's shopping cart. Every operation acts on the authenticated
 * user's own cart and returns the repriced cart.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/cart")
@PreAuthorize("isAuthenticated()")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping
    public ResponseEntity<CartResponse> getCart() {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(CartResponse.from(cartService.getCartSummary(userId)));
    }

    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(@Valid @RequestBody AddCartItemRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        cartService.addItem(userId, request.getProductId(), request.getQuantity());
        return ResponseEntity.ok(CartResponse.from(cartService.getCartSummary(userId)));
    }

    @PutMapping("/items/{productId}")
    public ResponseEntity<CartResponse> updateItem(
            @PathVariable String productId,
            @Valid @RequestBody UpdateCartItemRequest request
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        cartService.updateItemQuantity(userId, productId, request.getQuantity());
        return ResponseEntity.ok(CartResponse.from(cartService.getCartSummary(userId)));
    }

    @DeleteMapping("/items/{productId}")
    public ResponseEntity<CartResponse> removeItem(@PathVariable String productId) {
        String userId = SecurityUtils.requireCurrentUserId();
        cartService.removeItem(userId, productId);
        return ResponseEntity.ok(CartResponse.from(cartService.getCartSummary(userId)));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearCart() {
        cartService.clearCart(SecurityUtils.requireCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
