package com.cred.freestyle.commerce.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Add a product to the wishlist.
 *
 * @author Commerce Platform Team
 */
public class WishlistRequest {

    @NotBlank(message = "Product ID is required")
    private String productId;

    public WishlistRequest() {
    }

    public WishlistRequest(String productId) {
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }
}
