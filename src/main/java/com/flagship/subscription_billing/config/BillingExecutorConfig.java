package com.flagship.subscription_billing.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Worker pool shared by all billing runs in this process.
 *
 * Fixed size equal to {@code billing.cycle.concurrency}. Each run also
 * throttles its own dispatch, so the queue only holds work that a run has
 * already decided to start.
 */
@Slf4j
@Configuration
public class BillingExecutorConfig {

    public static final String BILLING_WORKER_POOL = "billingWorkerPool";

    private ExecutorService billingWorkerPool;

    @Bean(name = BILLING_WORKER_POOL)
    public ExecutorService billingWorkerPool(BillingProperties properties) {
        int size = properties.getConcurrency();
        this.billingWorkerPool = new ThreadPoolExecutor(
                size,
                size,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new CustomizableThreadFactory("billing-worker-")
        );
        log.info("Billing worker pool initialised: size={}", size);
        return this.billingWorkerPool;
    }

    @PreDestroy
    public void shutdown() {
        if (billingWorkerPool != null) {
            log.info("Shutting down billing worker pool");
            billingWorkerPool.shutdown();
            try {
                if (!billingWorkerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Billing worker pool did not stop within 30s, forcing shutdown");
                    billingWorkerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                billingWorkerPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
