package com.flagship.subscription_billing.health;

import com.flagship.subscription_billing.billing.BillingRun;
import com.flagship.subscription_billing.billing.BillingRunService;
import com.flagship.subscription_billing.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe endpoint for load balancers: no authorization, unlike Actuator.
 *
 * 503 only when the database is unreachable. Billing run and outbox details
 * are informational.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final BillingRunService billingRunService;
    private final OutboxService outboxService;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("checked_at", clock.instant().toString());

        if (!databaseReachable()) {
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("status", "UP");
        body.put("database", "UP");
        body.put("outbox_backlog", outboxService.countUnpublished());
        body.put("last_billing_run", billingRunService.findLatestRun()
                .map(this::describe)
                .orElse(null));
        return ResponseEntity.ok(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return false;
        }
    }

    private Map<String, Object> describe(BillingRun run) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", run.getId());
        summary.put("status", run.getStatus());
        summary.put("as_of", run.getAsOf());
        summary.put("started_at", run.getStartedAt());
        summary.put("completed_at", run.getCompletedAt());
        return summary;
    }
}
