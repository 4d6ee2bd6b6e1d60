package com.flagship.subscription_billing.subscription;

import com.flagship.subscription_billing.subscription.dto.CreateSubscriptionRequest;
import com.flagship.subscription_billing.subscription.dto.LedgerEntryResponse;
import com.flagship.subscription_billing.subscription.dto.SubscriptionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    /**
     * Creates a subscription and attempts its first charge synchronously.
     *
     * @return 201 with the subscription as left by the first charge
     */
    @PostMapping
    public ResponseEntity<SubscriptionResponse> create(@Valid @RequestBody CreateSubscriptionRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received subscription creation request: userId={}, planId={}",
                request.getUserId(), request.getPlanId());

        SubscriptionDetails created = subscriptionService.create(request.getUserId(), request.getPlanId());

        Subscription subscription = created.getSubscription();
        log.info("Subscription created: subscriptionId={}, status={}, nextBillingDate={}, duration={}ms",
                subscription.getId(), subscription.getStatus(), subscription.getNextBillingDate(),
                System.currentTimeMillis() - startTime);

        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponse.from(created));
    }

    @GetMapping
    public ResponseEntity<List<SubscriptionResponse>> list(
            @RequestParam(name = "user_id", required = false) UUID userId,
            @RequestParam(name = "status", required = false) SubscriptionStatus status,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {

        List<SubscriptionResponse> body = subscriptionService.list(userId, status, offset, limit).stream()
            .map(SubscriptionResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubscriptionResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.get(id)));
    }

    @GetMapping("/{id}/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> ledger(
            @PathVariable("id") UUID id,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {

        List<LedgerEntryResponse> body = subscriptionService.ledger(id, limit).stream()
            .map(LedgerEntryResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    /**
     * Cancels unconditionally. Repeating the call returns 200 and changes nothing.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<SubscriptionResponse> cancel(@PathVariable("id") UUID id) {
        log.info("Received cancellation request: subscriptionId={}", id);
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.cancel(id)));
    }
}
