package com.flagship.transaction_engine.replay;

/**
 * Thrown when a replay cannot be completed: the transaction log is missing,
 * unreadable or not valid CSV, or the report cannot be written.
 */
public class ReplayException extends RuntimeException {

    public ReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
