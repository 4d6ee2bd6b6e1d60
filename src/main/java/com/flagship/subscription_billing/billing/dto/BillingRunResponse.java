package com.flagship.subscription_billing.billing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.subscription_billing.billing.BillingRun;
import com.flagship.subscription_billing.billing.BillingRunStatus;
import com.flagship.subscription_billing.billing.BillingRunSummary;
import com.flagship.subscription_billing.billing.BillingRunTrigger;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class BillingRunResponse {

    @JsonProperty("run_id")
    UUID runId;

    @JsonProperty("trigger")
    BillingRunTrigger trigger;

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("status")
    BillingRunStatus status;

    @JsonProperty("considered")
    int considered;

    @JsonProperty("processed")
    int processed;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("escalated_to_cancelled")
    int escalatedToCancelled;

    @JsonProperty("indeterminate")
    int indeterminate;

    @JsonProperty("conflicts")
    int conflicts;

    @JsonProperty("storage_errors")
    int storageErrors;

    @JsonProperty("deferred")
    int deferred;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("error_details")
    String errorDetails;

    public static BillingRunResponse from(BillingRun run) {
        BillingRunSummary summary = run.getSummary();
        return BillingRunResponse.builder()
            .runId(run.getId())
            .trigger(run.getTrigger())
            .asOf(run.getAsOf())
            .status(run.getStatus())
            .considered(summary.getConsidered())
            .processed(summary.getProcessed())
            .failed(summary.getFailed())
            .escalatedToCancelled(summary.getEscalatedToCancelled())
            .indeterminate(summary.getIndeterminate())
            .conflicts(summary.getConflicts())
            .storageErrors(summary.getStorageErrors())
            .deferred(summary.getDeferred())
            .startedAt(run.getStartedAt())
            .completedAt(run.getCompletedAt())
            .errorDetails(run.getErrorDetails())
            .build();
    }
}
