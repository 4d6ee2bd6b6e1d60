package com.flagship.subscription_billing.charge;

import com.flagship.subscription_billing.ledger.ChargeOutcome;
import lombok.Value;

/**
 * A definite answer from the gateway. Unknown outcomes are reported by
 * throwing {@link ChargeIndeterminateException} instead.
 */
@Value
public class ChargeResult {

    public enum Status {
        SUCCEEDED,
        DECLINED
    }

    Status status;
    String gatewayTransactionId;
    String failureReason;

    public static ChargeResult succeeded(String gatewayTransactionId) {
        return new ChargeResult(Status.SUCCEEDED, gatewayTransactionId, null);
    }

    public static ChargeResult declined(String gatewayTransactionId, String failureReason) {
        return new ChargeResult(Status.DECLINED, gatewayTransactionId,
                failureReason != null ? failureReason : "declined");
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public ChargeOutcome toOutcome() {
        return isSucceeded() ? ChargeOutcome.SUCCESS : ChargeOutcome.FAILED;
    }
}
