package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for CartItem entity.
 *
 * @author Commerce Platform Team
 */
@Repository
public interface CartItemRepository extends JpaRepository<CartItem, String> {

    /**
     * Lines of a cart in the order they were added.
     *
     * @param cartId Cart ID
     * @return Cart lines, oldest first
     */
    List<CartItem> findByCartIdOrderByCreatedAtAscCartItemIdAsc(String cartId);

    Optional<CartItem> findByCartIdAndProductId(String cartId, String productId);

    /**
     * Delete every line of a cart.
     *
     * @param cartId Cart ID
     * @return Number of deleted lines
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CartItem c WHERE c.cartId = :cartId")
    int deleteAllByCartId(@Param("cartId") String cartId);
}
