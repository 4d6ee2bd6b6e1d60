package com.flagship.subscription_billing.observability;

import com.flagship.subscription_billing.billing.BillingRun;
import com.flagship.subscription_billing.billing.BillingRunService;
import com.flagship.subscription_billing.billing.BillingRunStatus;
import com.flagship.subscription_billing.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health indicators exposed through Actuator.
 */
public class HealthIndicators {

    /**
     * Backlog of events waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxService.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency fast path only, so an outage degrades
     * rather than fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency lookups fall back to the ledger";

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty() || redisTemplate.get().getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (var connection = redisTemplate.get().getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Outcome of the most recent billing run.
     */
    @Component("billingRunHealth")
    public static class BillingRunHealthIndicator implements HealthIndicator {

        private final BillingRunService billingRunService;

        public BillingRunHealthIndicator(BillingRunService billingRunService) {
            this.billingRunService = billingRunService;
        }

        @Override
        public Health health() {
            try {
                Optional<BillingRun> latest = billingRunService.findLatestRun();
                if (latest.isEmpty()) {
                    return Health.up()
                            .withDetail("lastRun", "none")
                            .build();
                }

                BillingRun run = latest.get();
                Health.Builder builder = run.getStatus() == BillingRunStatus.FAILED
                        ? Health.status("DEGRADED")
                        : Health.up();

                builder.withDetail("lastRunId", run.getId())
                        .withDetail("lastRunStatus", run.getStatus())
                        .withDetail("lastRunStartedAt", run.getStartedAt())
                        .withDetail("storageErrors", run.getSummary().getStorageErrors())
                        .withDetail("deferred", run.getSummary().getDeferred());
                if (run.getErrorDetails() != null) {
                    builder.withDetail("error", run.getErrorDetails());
                }
                return builder.build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
