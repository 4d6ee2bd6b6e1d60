package com.flagship.subscription_billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Payment gateway connection settings, bound from {@code billing.gateway.*}.
 */
@ConfigurationProperties(prefix = "billing.gateway")
@Data
public class ChargeGatewayProperties {

    /** {@code http} talks to a real gateway, {@code simulated} uses the in-process stand-in. */
    private String mode = "simulated";

    private String baseUrl = "http://localhost:9090";
    private String chargePath = "/v1/charges";
    private String apiKey = "";
    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(30);

    // simulated gateway only
    private double approvalRate = 0.92;
    private double timeoutRate = 0.01;
    private Duration minLatency = Duration.ofMillis(150);
    private Duration maxLatency = Duration.ofMillis(800);
    private int rememberedKeys = 100_000;
}
