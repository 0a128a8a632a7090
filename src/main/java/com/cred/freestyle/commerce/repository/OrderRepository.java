package com.cred.freestyle.commerce.repository;

import com.cred.freestyle.commerce.domain.model.Order;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Order entity.
 *
 * @author Commerce Platform Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find a user's orders, newest first.
     *
     * @param userId User ID
     * @param pageable Page request
     * @return Page of orders
     */
    Page<Order> findByUserIdOrderByOrderDateDesc(String userId, Pageable pageable);

    Page<Order> findAllByOrderByOrderDateDesc(Pageable pageable);

    long countByStatus(Order.OrderStatus status);
}
