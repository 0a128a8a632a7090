package com.cred.freestyle.commerce.domain.model;

import com.cred.freestyle.commerce.exception.InsufficientStockException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Product entity representing a sellable catalog item.
 * Stock lives directly on the product row so that checkout can lock and
 * decrement it in the same transaction that creates the order.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_products_category", columnList = "category_id"),
    @Index(name = "idx_products_active", columnList = "is_active"),
    @Index(name = "idx_products_name", columnList = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * Display name of the product. Searched case-insensitively.
     */
    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Current unit price. Orders snapshot this value into order items,
     * so later price changes never affect placed orders.
     */
    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    /**
     * Units on hand. Never negative.
     */
    @Column(name = "stock_qty", nullable = false)
    private Integer stockQty;

    /**
     * Foreign key to categories.category_id (nullable).
     */
    @Column(name = "category_id", length = 36)
    private String categoryId;

    @Column(name = "brand", length = 100)
    private String brand;

    /**
     * Soft delete flag. Inactive products cannot be carted or ordered.
     */
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    /**
     * Optimistic version, bumped on every update.
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (productId == null) {
            productId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check whether the requested quantity can be served right now.
     *
     * @param quantity Requested units
     * @return true if the quantity is positive, the product is active and has at least that many units
     */
    public boolean canFulfil(int quantity) {
        return quantity > 0 && Boolean.TRUE.equals(isActive) && stockQty != null && stockQty >= quantity;
    }

    /**
     * Remove units from stock. Re-checks availability at write time.
     *
     * @param quantity Units to remove (must be positive)
     * @throws InsufficientStockException if fewer units are on hand
     */
    public void decrementStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (stockQty < quantity) {
            throw new InsufficientStockException(productId, quantity, stockQty);
        }
        stockQty = stockQty - quantity;
    }

    /**
     * Return units to stock (order cancellation).
     *
     * @param quantity Units to add back (must be positive)
     */
    public void restoreStock(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        stockQty = stockQty + quantity;
    }

    /**
     * Soft delete this product.
     */
    public void deactivate() {
        this.isActive = false;
    }
}
