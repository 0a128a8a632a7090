package com.cred.freestyle.commerce.api.dto;

import com.cred.freestyle.commerce.domain.model.WishlistItem;

import java.time.Instant;

public class WishlistItemResponse {

    private String wishlistItemId;
    private String userId;
    private String productId;
    private Instant createdAt;

    public WishlistItemResponse() {
    }

    public static WishlistItemResponse fromEntity(WishlistItem item) {
        WishlistItemResponse response = new WishlistItemResponse();
        response.setWishlistItemId(item.getWishlistItemId());
        response.setUserId(item.getUserId());
        response.setProductId(item.getProductId());
        response.setCreatedAt(item.getCreatedAt());
        return response;
    }

    public String getWishlistItemId() {
        return wishlistItemId;
    }

    public void setWishlistItemId(String wishlistItemId) {
        this.wishlistItemId = wishlistItemId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
