package com.flagship.subscription_billing.charge;

/**
 * The gateway may or may not have charged: timeout, dropped connection,
 * 5xx or an unreadable response.
 */
public class ChargeIndeterminateException extends RuntimeException {

    public ChargeIndeterminateException(String message) {
        super(message);
    }

    public ChargeIndeterminateException(String message, Throwable cause) {
        super(message, cause);
    }
}
