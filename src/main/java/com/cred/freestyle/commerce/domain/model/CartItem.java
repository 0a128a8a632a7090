package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One product line in a cart. A cart holds at most one line per product;
 * adding the same product again increases {@code quantity}.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "cart_items",
    uniqueConstraints = @UniqueConstraint(name = "uk_cart_items_cart_product", columnNames = {"cart_id", "product_id"}),
    indexes = @Index(name = "idx_cart_items_cart", columnList = "cart_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {

    @Id
    @Column(name = "cart_item_id", nullable = false, length = 36)
    private String cartItemId;

    @Column(name = "cart_id", nullable = false, length = 36)
    private String cartId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * Always greater than zero.
     */
    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (cartItemId == null) {
            cartItemId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
