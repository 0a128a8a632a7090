package com.cred.freestyle.commerce.api.controller;

import com.cred.freestyle.commerce.api.dto.CreateReviewRequest;
import com.cred.freestyle.commerce.api.dto.PageResponse;
import com.cred.freestyle.commerce.api.dto.ReviewResponse;
import com.cred.freestyle.commerce.domain.model.Review;
import com.cred.freestyle.commerce.security.SecurityUtils;
import com.cred.freestyle.commerce.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * Product reviews. Listing and reading are public.
 *
 * @author Commerce Platform Team
 */
@RestController
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ReviewResponse> createReview(@Valid @RequestBody CreateReviewRequest request) {
        Review review = reviewService.createReview(
                SecurityUtils.requireCurrentUserId(),
                request.getProductId(),
                request.getRating(),
                request.getComment()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.fromEntity(review));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> getReview(@PathVariable String reviewId) {
        return ResponseEntity.ok(ReviewResponse.fromEntity(reviewService.getReview(reviewId)));
    }

    /**
     * Reviews of one product, newest first.
     */
    @GetMapping
    public ResponseEntity<PageResponse<ReviewResponse>> listReviews(
            @RequestParam String productId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(
                reviewService.listReviews(productId, Pagination.of(page, size)), ReviewResponse::fromEntity));
    }

    /**
     * Authors may delete their own review; admins may delete any.
     */
    @DeleteMapping("/{reviewId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteReview(@PathVariable String reviewId) {
        reviewService.deleteReview(reviewId);
        return ResponseEntity.noContent().build();
    }
}
