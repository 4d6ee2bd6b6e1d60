package com.flagship.subscription_billing.charge;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ChargeRequest {
    UUID subscriptionId;
    UUID userId;
    BigDecimal amount;
    String idempotencyKey;
    String description;
}
