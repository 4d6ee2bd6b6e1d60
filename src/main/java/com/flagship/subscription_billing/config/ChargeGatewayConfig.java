package com.flagship.subscription_billing.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * RestClient for the payment gateway, with the configured timeouts and credentials.
 */
@Configuration
@ConditionalOnProperty(name = "billing.gateway.mode", havingValue = "http")
public class ChargeGatewayConfig {

    @Bean
    RestClient chargeGatewayRestClient(RestClient.Builder builder, ChargeGatewayProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        RestClient.Builder configured = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        return configured.build();
    }
}
