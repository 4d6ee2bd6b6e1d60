package com.flagship.subscription_billing.ledger;

/**
 * A ledger append failed and the entry was not recorded.
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
