package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the billing cycle on a cron. Off unless {@code billing.scheduler.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "billing.scheduler", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BillingCycleScheduler {

    private final BillingRunService billingRunService;

    @Scheduled(cron = "${billing.scheduler.cron:0 0 2 * * *}", zone = "UTC")
    public void runScheduledCycle() {
        CorrelationContext.setCorrelationId(null);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        log.info("Scheduled billing run starting");
        try {
            BillingRun run = billingRunService.runNow(null, BillingRunTrigger.SCHEDULER);
            log.info("Scheduled billing run done: runId={}, status={}", run.getId(), run.getStatus());
        } catch (Exception e) {
            // The next tick retries; everything not billed is still due.
            log.error("Scheduled billing run failed", e);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clear();
        }
    }
}
