package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.Product;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Product entity.
 * Checkout and stock adjustments go through {@link #findByIdWithLock(String)}.
 *
 * @author Commerce Platform Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    /**
     * Find product by ID with pessimistic write lock.
     * Waits at most 3 seconds for a conflicting lock before failing with a
     * lock acquisition error, which the order placement retry handles.
     *
     * @param productId Product ID
     * @return Optional containing the locked product if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT p FROM Product p WHERE p.productId = :productId")
    Optional<Product> findByIdWithLock(@Param("productId") String productId);

    Optional<Product> findByProductIdAndIsActiveTrue(String productId);

    Page<Product> findByIsActiveTrue(Pageable pageable);

    Page<Product> findByCategoryIdAndIsActiveTrue(String categoryId, Pageable pageable);

    /**
     * Case-insensitive search over name and description of active products.
     *
     * @param query Search text
     * @param pageable Page request
     * @return Matching products
     */
    @Query("SELECT p FROM Product p WHERE p.isActive = true AND " +
           "(LOWER(p.name) LIKE LOWER(CONCAT('%', :query, '%')) " +
           "OR LOWER(p.description) LIKE LOWER(CONCAT('%', :query, '%')))")
    Page<Product> searchActive(@Param("query") String query, Pageable pageable);

    long countByIsActiveTrue();

    long countByIsActiveTrueAndStockQtyLessThan(Integer threshold);
}
