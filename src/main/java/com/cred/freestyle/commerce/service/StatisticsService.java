package com.cred.freestyle.commerce.service;

import com.cred.freestyle.commerce.domain.model.Order;
import com.cred.freestyle.commerce.repository.OrderRepository;
import com.cred.freestyle.commerce.repository.ProductRepository;
import com.cred.freestyle.commerce.repository.UserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Back-office counters over products, users and orders.
 *
 * @author Commerce Platform Team
 */
@Service
public class StatisticsService {

    private final ProductRepository productRepository;
    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final int lowStockThreshold;

    public StatisticsService(
            ProductRepository productRepository,
            UserRepository userRepository,
            OrderRepository orderRepository,
            @Value("${commerce.catalog.low-stock-threshold:10}") int lowStockThreshold
    ) {
        this.productRepository = productRepository;
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.lowStockThreshold = lowStockThreshold;
    }

    /**
     * @return total, active and low_stock (active products below the threshold)
     */
    @Transactional(readOnly = true)
    public Map<String, Long> productStatistics() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total", productRepository.count());
        stats.put("active", productRepository.countByIsActiveTrue());
        stats.put("low_stock", productRepository.countByIsActiveTrueAndStockQtyLessThan(lowStockThreshold));
        return stats;
    }

    @Transactional(readOnly = true)
    public Map<String, Long> userStatistics() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total", userRepository.count());
        stats.put("active", userRepository.countByIsActiveTrue());
        return stats;
    }

    /**
     * @return total plus one count per order status (lower-case keys)
     */
    @Transactional(readOnly = true)
    public Map<String, Long> orderStatistics() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("total", orderRepository.count());
        for (Order.OrderStatus status : Order.OrderStatus.values()) {
            stats.put(status.name().toLowerCase(), orderRepository.countByStatus(status));
        }
        return stats;
    }
}
