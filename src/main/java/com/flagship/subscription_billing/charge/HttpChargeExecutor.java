package com.flagship.subscription_billing.charge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.subscription_billing.config.ChargeGatewayProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.UUID;

/**
 * Charges through an HTTP payment gateway.
 *
 * Outcome mapping:
 * <ul>
 *   <li>2xx with status {@code approved} or {@code succeeded}: SUCCEEDED</li>
 *   <li>2xx with status {@code declined} or {@code failed}, HTTP 402, and
 *       400/422 whose body reports a decline: DECLINED</li>
 *   <li>every other 4xx (401, 403, 404 included), 5xx, timeouts, connection
 *       errors, unreadable bodies: {@link ChargeIndeterminateException}</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "billing.gateway.mode", havingValue = "http")
@Slf4j
public class HttpChargeExecutor implements ChargeExecutor {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private static final Set<String> APPROVED = Set.of("approved", "succeeded");
    private static final Set<String> DECLINED = Set.of("declined", "failed");
    private static final Set<Integer> DECLINE_BODY_STATUSES = Set.of(400, 422);

    private final RestClient chargeGatewayRestClient;
    private final ChargeGatewayProperties properties;
    private final ObjectMapper objectMapper;

    public HttpChargeExecutor(RestClient chargeGatewayRestClient,
                              ChargeGatewayProperties properties,
                              ObjectMapper objectMapper) {
        this.chargeGatewayRestClient = chargeGatewayRestClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        try {
            GatewayChargeResponse response = chargeGatewayRestClient.post()
                    .uri(properties.getChargePath())
                    .header(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(GatewayChargeRequest.from(request))
                    .retrieve()
                    .body(GatewayChargeResponse.class);
            return toResult(request, response);

        } catch (RestClientResponseException e) {
            return mapErrorResponse(request, e);
        } catch (ResourceAccessException e) {
            String reason = isTimeout(e) ? "gateway timeout" : "gateway unreachable";
            log.warn("Charge outcome unknown: idempotencyKey={}, reason={}", request.getIdempotencyKey(), reason);
            throw new ChargeIndeterminateException(reason, e);
        } catch (RestClientException e) {
            log.warn("Unreadable gateway response: idempotencyKey={}, error={}",
                    request.getIdempotencyKey(), e.getMessage());
            throw new ChargeIndeterminateException("unreadable gateway response", e);
        }
    }

    private ChargeResult toResult(ChargeRequest request, GatewayChargeResponse response) {
        if (response == null || response.getStatus() == null) {
            throw new ChargeIndeterminateException("gateway response has no status");
        }
        String status = response.getStatus().toLowerCase();
        if (APPROVED.contains(status)) {
            return ChargeResult.succeeded(response.getId());
        }
        if (DECLINED.contains(status)) {
            log.info("Charge declined: idempotencyKey={}, reason={}",
                    request.getIdempotencyKey(), response.getDeclineReason());
            return ChargeResult.declined(response.getId(), response.getDeclineReason());
        }
        throw new ChargeIndeterminateException("gateway reported status " + status);
    }

    private ChargeResult mapErrorResponse(ChargeRequest request, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        GatewayChargeResponse body = status == HttpStatus.PAYMENT_REQUIRED.value()
                || DECLINE_BODY_STATUSES.contains(status) ? readErrorBody(e) : null;

        if (status != HttpStatus.PAYMENT_REQUIRED.value() && !isDeclineBody(body)) {
            log.warn("Charge outcome unknown: idempotencyKey={}, httpStatus={}", request.getIdempotencyKey(), status);
            throw new ChargeIndeterminateException("gateway returned HTTP " + status, e);
        }

        String reason = body != null && body.getDeclineReason() != null
                ? body.getDeclineReason()
                : "payment declined";
        log.info("Charge declined: idempotencyKey={}, httpStatus={}, reason={}",
                request.getIdempotencyKey(), status, reason);
        return ChargeResult.declined(body != null ? body.getId() : null, reason);
    }

    private boolean isDeclineBody(GatewayChargeResponse body) {
        if (body == null) {
            return false;
        }
        return body.getDeclineReason() != null
                || (body.getStatus() != null && DECLINED.contains(body.getStatus().toLowerCase()));
    }

    private GatewayChargeResponse readErrorBody(RestClientResponseException e) {
        String raw = e.getResponseBodyAsString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(raw, GatewayChargeResponse.class);
        } catch (Exception parseError) {
            log.debug("Gateway error body is not JSON: {}", parseError.getMessage());
            return null;
        }
    }

    private boolean isTimeout(ResourceAccessException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    @Value
    static class GatewayChargeRequest {
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("customer_reference")
        UUID customerReference;

        @JsonProperty("subscription_reference")
        UUID subscriptionReference;

        @JsonProperty("description")
        String description;

        static GatewayChargeRequest from(ChargeRequest request) {
            return new GatewayChargeRequest(
                request.getAmount(),
                request.getUserId(),
                request.getSubscriptionId(),
                request.getDescription()
            );
        }
    }

    @Value
    static class GatewayChargeResponse {
        @JsonProperty("id")
        String id;

        @JsonProperty("status")
        String status;

        @JsonProperty("decline_reason")
        String declineReason;
    }
}
