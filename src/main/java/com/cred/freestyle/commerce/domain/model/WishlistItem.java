package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Product saved to a user's wishlist.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "wishlist",
    uniqueConstraints = @UniqueConstraint(name = "uk_wishlist_user_product", columnNames = {"user_id", "product_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WishlistItem {

    @Id
    @Column(name = "wishlist_item_id", nullable = false, length = 36)
    private String wishlistItemId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (wishlistItemId == null) {
            wishlistItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
