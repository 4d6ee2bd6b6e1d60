package com.flagship.subscription_billing.ledger;

/**
 * Another writer already recorded a determinate outcome for the same attempt.
 */
public class DuplicateChargeAttemptException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateChargeAttemptException(String idempotencyKey, Throwable cause) {
        super("Charge attempt already recorded: " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
