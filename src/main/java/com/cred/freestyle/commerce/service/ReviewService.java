package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Review;
import com.cred.freestyle.commerce.exception.DuplicateResourceException;
import com.cred.freestyle.commerce.exception.ResourceNotFoundException;
import com.cred.freestyle.commerce.repository.ProductRepository;
import com.cred.freestyle.commerce.repository.ReviewRepository;
import com.cred.freestyle.commerce.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for product reviews.
 *
 * @author Commerce Platform Team
 */
@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final ProductRepository productRepository;

    public ReviewService(ReviewRepository reviewRepository, ProductRepository productRepository) {
        this.reviewRepository = reviewRepository;
        this.productRepository = productRepository;
    }

    /**
     * Create a review.
     *
     * @throws IllegalArgumentException if rating is outside 1..5
     * @throws DuplicateResourceException if the user already reviewed the product
     */
    @Transactional
    public Review createReview(String userId, String productId, int rating, String comment) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5");
        }
        if (!productRepository.existsById(productId)) {
            throw new ResourceNotFoundException("Product", productId);
        }
        if (reviewRepository.existsByUserIdAndProductId(userId, productId)) {
            throw new DuplicateResourceException("Review", "productId", productId);
        }

        Review review = reviewRepository.save(Review.builder()
                .userId(userId)
                .productId(productId)
                .rating(rating)
                .comment(comment)
                .build());
        logger.info("User {} reviewed product {} with rating {}", userId, productId, rating);
        return review;
    }

    @Transactional(readOnly = true)
    public Review getReview(String reviewId) {
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Review", reviewId));
    }

    @Transactional(readOnly = true)
    public Page<Review> listReviews(String productId, Pageable pageable) {
        return reviewRepository.findByProductIdOrderByCreatedAtDesc(productId, pageable);
    }

    /**
     * Delete a review. Authors may delete their own reviews, admins any review.
     */
    @Transactional
    public void deleteReview(String reviewId) {
        Review review = getReview(reviewId);
        SecurityUtils.verifyUserAccess(review.getUserId());
        reviewRepository.delete(review);
        logger.info("Deleted review {}", reviewId);
    }
}
