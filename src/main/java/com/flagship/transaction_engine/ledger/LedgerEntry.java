package com.flagship.transaction_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Retained record of a deposit, the only transaction kind that can be disputed.
 *
 * Immutable: a dispute state change produces a new entry which is recorded back
 * under the same transaction id.
 */
@Value
public class LedgerEntry {
    int clientId;
    long txId;
    BigDecimal amount;
    DisputeState disputeState;

    /**
     * Creates an undisputed entry for a freshly applied deposit.
     */
    public static LedgerEntry deposit(int clientId, long txId, BigDecimal amount) {
        return new LedgerEntry(clientId, txId, amount, DisputeState.NONE);
    }

    public LedgerEntry withDisputeState(DisputeState state) {
        return new LedgerEntry(clientId, txId, amount, state);
    }

    public boolean isDisputed() {
        return disputeState == DisputeState.DISPUTED;
    }
}
