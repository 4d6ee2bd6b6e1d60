package com.flagship.subscription_billing.charge;

import com.flagship.subscription_billing.config.ChargeGatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * In-process stand-in for a payment gateway, for local runs and demos.
 *
 * Approves {@code billing.gateway.approval-rate} of charges after a random
 * latency between {@code min-latency} and {@code max-latency}. A
 * {@code timeout-rate} share of calls lose their response: the charge is
 * decided but the caller sees {@link ChargeIndeterminateException}. Like a
 * real gateway it remembers each idempotency key and answers repeats with the
 * original decision. Only the newest {@code remembered-keys} decisions are
 * kept; older keys are forgotten oldest first.
 */
@Component
@ConditionalOnProperty(name = "billing.gateway.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedChargeExecutor implements ChargeExecutor {

    private static final List<String> DECLINE_REASONS = List.of(
        "Insufficient funds",
        "Card declined",
        "Payment method expired",
        "Billing address mismatch",
        "Risk assessment failed"
    );

    private final ChargeGatewayProperties properties;
    private final DoubleSupplier random;
    private final Map<String, ChargeResult> decisions;

    @Autowired
    public SimulatedChargeExecutor(ChargeGatewayProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    SimulatedChargeExecutor(ChargeGatewayProperties properties, DoubleSupplier random) {
        this.properties = properties;
        this.random = random;
        this.decisions = Collections.synchronizedMap(boundedDecisionMap(properties.getRememberedKeys()));
    }

    private static Map<String, ChargeResult> boundedDecisionMap(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("billing.gateway.remembered-keys must be positive, got " + capacity);
        }
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ChargeResult> eldest) {
                return size() > capacity;
            }
        };
    }

    int rememberedDecisions() {
        return decisions.size();
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        ChargeResult previous = decisions.get(request.getIdempotencyKey());
        if (previous != null) {
            log.debug("Simulated gateway replaying decision: idempotencyKey={}, status={}",
                    request.getIdempotencyKey(), previous.getStatus());
            return previous;
        }

        simulateLatency();

        ChargeResult decision = decisions.computeIfAbsent(request.getIdempotencyKey(), key -> decide());

        if (random.getAsDouble() < properties.getTimeoutRate()) {
            log.warn("Simulated gateway timeout: idempotencyKey={}", request.getIdempotencyKey());
            throw new ChargeIndeterminateException("gateway timeout");
        }
        return decision;
    }

    private ChargeResult decide() {
        String transactionId = "sim_" + UUID.randomUUID();
        if (random.getAsDouble() < properties.getApprovalRate()) {
            return ChargeResult.succeeded(transactionId);
        }
        int index = (int) (random.getAsDouble() * DECLINE_REASONS.size());
        return ChargeResult.declined(transactionId, DECLINE_REASONS.get(Math.min(index, DECLINE_REASONS.size() - 1)));
    }

    private void simulateLatency() {
        long min = properties.getMinLatency().toMillis();
        long max = Math.max(min, properties.getMaxLatency().toMillis());
        long delay = min + (long) (random.getAsDouble() * (max - min));
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChargeIndeterminateException("interrupted while waiting for gateway", e);
        }
    }
}
