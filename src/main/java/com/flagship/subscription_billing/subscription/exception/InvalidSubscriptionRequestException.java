package com.flagship.subscription_billing.subscription.exception;

/**
 * Request input that fails validation before any state changes.
 */
public class InvalidSubscriptionRequestException extends IllegalArgumentException {

    public InvalidSubscriptionRequestException(String message) {
        super(message);
    }
}
