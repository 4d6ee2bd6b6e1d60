package com.flagship.subscription_billing.billing;

import com.flagship.subscription_billing.billing.dto.BillingRunResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/billing-cycle")
@RequiredArgsConstructor
@Slf4j
public class BillingCycleController {

    private final BillingRunService billingRunService;

    /**
     * Runs one billing pass and responds when it ends: every dispatched
     * attempt finished, or the run timeout stopped further dispatch.
     *
     * @param asOf optional ISO date; defaults to today
     */
    @PostMapping("/run")
    public ResponseEntity<BillingRunResponse> run(
            @RequestParam(name = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {

        log.info("Received billing run request: asOf={}", asOf);
        BillingRun run = billingRunService.runNow(asOf, BillingRunTrigger.API);
        return ResponseEntity.ok(BillingRunResponse.from(run));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<BillingRunResponse> getRun(@PathVariable("id") UUID id) {
        return billingRunService.findRun(id)
            .map(run -> ResponseEntity.ok(BillingRunResponse.from(run)))
            .orElse(ResponseEntity.notFound().build());
    }
}
