package com.cred.freestyle.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the commerce platform.
 *
 * Architecture:
 * - API Layer: REST controllers with validation and bearer-token security
 * - Service Layer: catalog, cart, coupons, order placement and lifecycle
 * - Data Access Layer: JPA repositories with pessimistic row locks for checkout
 * - Infrastructure Layer: Redis product cache, Kafka order events, CloudWatch metrics
 *
 * Order placement runs as one database transaction: product and coupon rows
 * are locked, stock and coupon usage are re-checked and updated, and the
 * order, payment and shipping rows are written together. Lock conflicts are
 * retried a bounded number of times.
 *
 * @author Commerce Platform Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class CommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommerceApplication.class, args);
    }
}
