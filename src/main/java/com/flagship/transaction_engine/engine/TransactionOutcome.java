package com.flagship.transaction_engine.engine;

/**
 * Result of applying one transaction.
 *
 * Everything except APPLIED is a no-op: the engine state is left untouched.
 */
public enum TransactionOutcome {
    APPLIED,
    ACCOUNT_LOCKED,
    INSUFFICIENT_FUNDS,
    UNKNOWN_TRANSACTION,
    INVALID_DISPUTE_STATE;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
