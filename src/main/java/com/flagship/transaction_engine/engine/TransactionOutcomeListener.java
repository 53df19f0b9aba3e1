package com.flagship.transaction_engine.engine;

import com.flagship.transaction_engine.transaction.Transaction;

/**
 * Observes the outcome of every transaction the engine applies.
 *
 * Used for metrics and diagnostics; the engine itself reports nothing to its caller.
 */
@FunctionalInterface
public interface TransactionOutcomeListener {

    TransactionOutcomeListener NONE = (transaction, outcome) -> { };

    void onOutcome(Transaction transaction, TransactionOutcome outcome);
}
