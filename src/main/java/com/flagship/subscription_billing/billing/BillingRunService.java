package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.config.BillingProperties;
import com.flagship.subscription_billing.observability.BillingMetrics;
import com.flagship.subscription_billing.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs billing passes and keeps a {@code billing_runs} record of each.
 *
 * Not transactional: every attempt commits on its own. The run record is
 * written when the pass starts and again when it ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingRunService {

    private final BillingCycleProcessor processor;
    private final BillingRunRepository runRepository;
    private final BillingProperties properties;
    private final BillingMetrics metrics;
    private final Clock clock;

    /**
     * Runs one pass synchronously.
     *
     * @param asOf bill everything due on or before this date; today (UTC) when null
     * @throws RuntimeException whatever aborted the pass; the run is recorded as FAILED first
     */
    public BillingRun runNow(LocalDate asOf, BillingRunTrigger trigger) {
        LocalDate effectiveAsOf = asOf != null ? asOf : LocalDate.now(clock);
        BillingRunEntity run = runRepository.save(
            BillingRunEntity.fromDomain(BillingRun.start(trigger, effectiveAsOf, clock.instant())));

        MDC.put(CorrelationContext.BILLING_RUN_ID_MDC_KEY, run.getId().toString());
        long startTime = System.currentTimeMillis();
        log.info("Billing run started: runId={}, trigger={}, asOf={}, timeout={}",
                run.getId(), trigger, effectiveAsOf, properties.getRunTimeout());

        try {
            BillingRunSummary summary = processor.run(
                effectiveAsOf, BillingRunControl.withTimeout(properties.getRunTimeout(), clock));

            run.finish(summary, clock.instant());
            BillingRun finished = runRepository.save(run).toDomain();

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRun(finished.getStatus().name(), Duration.ofMillis(duration));
            metrics.recordDeferred(summary.getDeferred());
            log.info("Billing run finished: runId={}, status={}, considered={}, processed={}, failed={}, " +
                            "escalated={}, indeterminate={}, conflicts={}, storageErrors={}, deferred={}, duration={}ms",
                    finished.getId(), finished.getStatus(), summary.getConsidered(), summary.getProcessed(),
                    summary.getFailed(), summary.getEscalatedToCancelled(), summary.getIndeterminate(),
                    summary.getConflicts(), summary.getStorageErrors(), summary.getDeferred(), duration);
            return finished;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("Billing run aborted: runId={}, duration={}ms", run.getId(), duration, e);
            recordFailure(run, e);
            metrics.recordRun(BillingRunStatus.FAILED.name(), Duration.ofMillis(duration));
            throw e;
        } finally {
            MDC.remove(CorrelationContext.BILLING_RUN_ID_MDC_KEY);
        }
    }

    public Optional<BillingRun> findRun(UUID runId) {
        return runRepository.findById(runId).map(BillingRunEntity::toDomain);
    }

    public Optional<BillingRun> findLatestRun() {
        return runRepository.findFirstByOrderByStartedAtDesc().map(BillingRunEntity::toDomain);
    }

    private void recordFailure(BillingRunEntity run, RuntimeException cause) {
        try {
            run.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage(), clock.instant());
            runRepository.save(run);
        } catch (RuntimeException e) {
            log.error("Failed to record billing run failure: runId={}", run.getId(), e);
            cause.addSuppressed(e);
        }
    }
}
