package com.flagship.subscription_billing.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.subscription_billing.subscription.Subscription;
import com.flagship.subscription_billing.subscription.SubscriptionDetails;
import com.flagship.subscription_billing.subscription.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class SubscriptionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("plan_id")
    UUID planId;

    @JsonProperty("status")
    SubscriptionStatus status;

    @JsonProperty("next_billing_date")
    LocalDate nextBillingDate;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    @JsonProperty("recent_charges")
    List<LedgerEntryResponse> recentCharges;

    public static SubscriptionResponse from(SubscriptionDetails details) {
        Subscription subscription = details.getSubscription();
        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .userId(subscription.getUserId())
            .planId(subscription.getPlanId())
            .status(subscription.getStatus())
            .nextBillingDate(subscription.getNextBillingDate())
            .createdAt(subscription.getCreatedAt())
            .cancelledAt(subscription.getCancelledAt())
            .recentCharges(details.getRecentCharges().stream()
                .map(LedgerEntryResponse::from)
                .collect(Collectors.toList()))
            .build();
    }
}
