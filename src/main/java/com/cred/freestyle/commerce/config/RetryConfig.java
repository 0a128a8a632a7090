package com.cred.freestyle.commerce.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for transactions that can lose a lock race.
 *
 * Retried exceptions:
 * - PessimisticLockingFailureException (lock timeout, deadlock victim)
 * - OptimisticLockingFailureException (@Version mismatch)
 *
 * Backoff is exponential from the initial delay (x2 per attempt, max 1s).
 * Business exceptions are never retried.
 *
 * @author Commerce Platform Team
 */
@Configuration
public class RetryConfig {

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final long MAX_BACKOFF_MS = 1000L;

    @Bean
    public RetryTemplate orderPlacementRetryTemplate(
            @Value("${commerce.order.max-attempts:3}") int maxAttempts,
            @Value("${commerce.order.initial-backoff-ms:50}") long initialBackoffMs
    ) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, BACKOFF_MULTIPLIER, MAX_BACKOFF_MS)
                .retryOn(PessimisticLockingFailureException.class)
                .retryOn(OptimisticLockingFailureException.class)
                .traversingCauses()
                .build();
    }
}
