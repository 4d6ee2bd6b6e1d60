package com.flagship.subscription_billing.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A subscription plan as read from the catalog. The engine never writes plans.
 */
@Value
public class Plan {
    UUID id;
    String name;
    BigDecimal price;
    BillingCycle billingCycle;
    boolean active;
}
