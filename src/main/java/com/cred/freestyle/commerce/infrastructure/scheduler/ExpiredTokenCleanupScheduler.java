package com.cred.freestyle.commerce.infrastructure.scheduler;

import com.cred.freestyle.commerce.infrastructure.metrics.CommerceMetricsService;
import com.cred.freestyle.commerce.service.AuthenticationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically deletes expired bearer tokens.
 *
 * Expired tokens are already rejected by {@link AuthenticationService#authenticate(String)};
 * this job only keeps the auth_tokens table small. Safe to run on every node.
 *
 * @author Commerce Platform Team
 */
@Service
public class ExpiredTokenCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExpiredTokenCleanupScheduler.class);

    private final AuthenticationService authenticationService;
    private final CommerceMetricsService metricsService;

    @Value("${commerce.auth.cleanup.enabled:true}")
    private boolean schedulerEnabled;

    public ExpiredTokenCleanupScheduler(
            AuthenticationService authenticationService,
            CommerceMetricsService metricsService
    ) {
        this.authenticationService = authenticationService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${commerce.auth.cleanup.interval-ms:600000}")
    public void purgeExpiredTokens() {
        if (!schedulerEnabled) {
            logger.debug("Expired token cleanup is disabled");
            return;
        }

        long startTime = System.currentTimeMillis();
        try {
            int purged = authenticationService.purgeExpiredTokens();
            if (purged > 0) {
                logger.info("Purged {} expired tokens in {}ms", purged, System.currentTimeMillis() - startTime);
            } else {
                logger.debug("No expired tokens to purge");
            }
        } catch (Exception e) {
            // Next run retries; a failed purge never affects authentication
            logger.error("Error purging expired tokens", e);
            metricsService.recordError("TOKEN_CLEANUP_ERROR", "purgeExpiredTokens");
        }
    }

    void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }
}
