package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.Review;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewRepository extends JpaRepository<Review, String> {

    boolean existsByUserIdAndProductId(String userId, String productId);

    Page<Review> findByProductIdOrderByCreatedAtDesc(String productId, Pageable pageable);
}
