package com.flagship.subscription_billing.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for billing.
 *
 * <ul>
 *   <li>{@code billing.attempts{outcome}}: attempts by result (processed, failed, conflict, ...)</li>
 *   <li>{@code billing.attempts.deferred}: due subscriptions left for a later run</li>
 *   <li>{@code billing.charge.latency{result}}: time spent in the charge executor</li>
 *   <li>{@code billing.runs{status}} and {@code billing.run.duration}</li>
 *   <li>{@code billing.idempotency.replay{source}}: attempts answered from a recorded outcome</li>
 *   <li>{@code subscriptions.created{status}}, {@code subscriptions.cancelled{reason}}</li>
 * </ul>
 */
@Component
public class BillingMetrics {

    private final MeterRegistry registry;
    private final Counter deferredAttempts;
    private final Timer runTimer;

    public BillingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.deferredAttempts = Counter.builder("billing.attempts.deferred")
                .description("Due subscriptions not attempted because a run stopped early")
                .register(registry);

        this.runTimer = Timer.builder("billing.run.duration")
                .description("Wall-clock time of a billing run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAttempt(String outcome) {
        registry.counter("billing.attempts", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordDeferred(int count) {
        if (count > 0) {
            deferredAttempts.increment(count);
        }
    }

    public void recordChargeLatency(String result, long durationMs) {
        registry.timer("billing.charge.latency", "result", sanitizeTag(result))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordRun(String status, Duration duration) {
        registry.counter("billing.runs", "status", sanitizeTag(status)).increment();
        runTimer.record(duration);
    }

    public void recordIdempotencyReplay(String source) {
        registry.counter("billing.idempotency.replay", "source", sanitizeTag(source)).increment();
    }

    public void recordSubscriptionCreated(String status) {
        registry.counter("subscriptions.created", "status", sanitizeTag(status)).increment();
    }

    public void recordSubscriptionCancelled(String reason) {
        registry.counter("subscriptions.cancelled", "reason", sanitizeTag(reason)).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
