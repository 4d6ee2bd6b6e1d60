package com.flagship.subscription_billing.billing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of {@code billing_runs}.
 *
 * No setters: a run moves out of RUNNING only through {@link #finish} or {@link #fail}.
 */
@Entity
@Table(name = "billing_runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BillingRunEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, updatable = false, length = 20)
    private BillingRunTrigger trigger;

    @Column(name = "as_of", nullable = false, updatable = false)
    private LocalDate asOf;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BillingRunStatus status;

    @Column(name = "considered", nullable = false)
    private int considered;

    @Column(name = "processed", nullable = false)
    private int processed;

    @Column(name = "failed", nullable = false)
    private int failed;

    @Column(name = "escalated_to_cancelled", nullable = false)
    private int escalatedToCancelled;

    @Column(name = "indeterminate", nullable = false)
    private int indeterminate;

    @Column(name = "conflicts", nullable = false)
    private int conflicts;

    @Column(name = "storage_errors", nullable = false)
    private int storageErrors;

    @Column(name = "deferred", nullable = false)
    private int deferred;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    static BillingRunEntity fromDomain(BillingRun run) {
        BillingRunSummary summary = run.getSummary();
        return new BillingRunEntity(
            run.getId(),
            run.getTrigger(),
            run.getAsOf(),
            run.getStatus(),
            summary.getConsidered(),
            summary.getProcessed(),
            summary.getFailed(),
            summary.getEscalatedToCancelled(),
            summary.getIndeterminate(),
            summary.getConflicts(),
            summary.getStorageErrors(),
            summary.getDeferred(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getErrorDetails()
        );
    }

    public BillingRun toDomain() {
        BillingRunSummary summary = new BillingRunSummary(
            considered, processed, failed, escalatedToCancelled,
            indeterminate, conflicts, storageErrors, deferred, status);
        return new BillingRun(id, trigger, asOf, status, summary, startedAt, completedAt, errorDetails);
    }

    void finish(BillingRunSummary summary, Instant finishedAt) {
        if (status.isFinished()) {
            throw new IllegalStateException("Billing run " + id + " already finished with status " + status);
        }
        this.status = summary.getStatus();
        this.considered = summary.getConsidered();
        this.processed = summary.getProcessed();
        this.failed = summary.getFailed();
        this.escalatedToCancelled = summary.getEscalatedToCancelled();
        this.indeterminate = summary.getIndeterminate();
        this.conflicts = summary.getConflicts();
        this.storageErrors = summary.getStorageErrors();
        this.deferred = summary.getDeferred();
        this.completedAt = finishedAt;
    }

    void fail(String error, Instant failedAt) {
        if (status.isFinished()) {
            throw new IllegalStateException("Billing run " + id + " already finished with status " + status);
        }
        this.status = BillingRunStatus.FAILED;
        this.errorDetails = error;
        this.completedAt = failedAt;
    }
}
