package com.flagship.subscription_billing.charge;

/**
 * Charges a customer through an external payment capability.
 *
 * Implementations must honour {@link ChargeRequest#getIdempotencyKey()}: a
 * repeated request with the same key must not move money twice.
 */
public interface ChargeExecutor {

    /**
     * @return SUCCEEDED or DECLINED when the gateway gave a definite answer
     * @throws ChargeIndeterminateException when the outcome is unknown
     */
    ChargeResult charge(ChargeRequest request);
}
