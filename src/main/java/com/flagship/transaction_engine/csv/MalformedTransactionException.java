package com.flagship.transaction_engine.csv;

/**
 * Thrown when a row of the transaction log cannot be turned into a transaction.
 *
 * The reason is a short, metric-friendly category; the message carries the detail.
 */
public class MalformedTransactionException extends RuntimeException {

    private final String reason;

    public MalformedTransactionException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MalformedTransactionException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
