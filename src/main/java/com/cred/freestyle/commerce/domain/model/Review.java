package com.cred.freestyle.commerce.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Product review. One review per user and product.
 *
 * @author Commerce Platform Team
 */
@Entity
@Table(name = "reviews",
    uniqueConstraints = @UniqueConstraint(name = "uk_reviews_user_product", columnNames = {"user_id", "product_id"}),
    indexes = @Index(name = "idx_reviews_product", columnList = "product_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {

    @Id
    @Column(name = "review_id", nullable = false, length = 36)
    private String reviewId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * 1 to 5.
     */
    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "comment", columnDefinition = "TEXT")
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (reviewId == null) {
            reviewId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
