package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.WishlistItemResponse;
import com.cred.freestyle.commerce.api.dto.WishlistRequest;
import com.cred.freestyle.commerce.security.SecurityUtils;
import com.cred.freestyle.commerce.service.WishlistService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/wishlist")
@PreAuthorize("isAuthenticated()")
public class WishlistController {

    private final WishlistService wishlistService;

    public WishlistController(WishlistService wishlistService) {
        this.wishlistService = wishlistService;
    }

    @GetMapping
    public ResponseEntity<List<WishlistItemResponse>> getWishlist() {
        List<WishlistItemResponse> items = wishlistService.getWishlist(SecurityUtils.requireCurrentUserId())
                .stream()
                .map(WishlistItemResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(items);
    }

    @PostMapping
    public ResponseEntity<WishlistItemResponse> addItem(@Valid @RequestBody WishlistRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(WishlistItemResponse.fromEntity(
                wishlistService.addItem(SecurityUtils.requireCurrentUserId(), request.getProductId())));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<Void> removeItem(@PathVariable String productId) {
        wishlistService.removeItem(SecurityUtils.requireCurrentUserId(), productId);
        return ResponseEntity.noContent().build();
    }
}
