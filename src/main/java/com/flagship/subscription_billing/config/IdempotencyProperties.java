package com.flagship.subscription_billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "billing.idempotency")
@Data
public class IdempotencyProperties {

    private boolean cacheEnabled = true;
    private Duration ttl = Duration.ofDays(7);
}
