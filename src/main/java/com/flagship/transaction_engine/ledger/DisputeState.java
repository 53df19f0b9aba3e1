package com.flagship.transaction_engine.ledger;

/**
 * Dispute state of a recorded deposit.
 *
 * Transitions:
 * - NONE → DISPUTED (dispute)
 * - DISPUTED → NONE (resolve, or chargeback which also locks the owning account)
 */
public enum DisputeState {
    /**
     * Not under dispute. Initial state of every entry.
     */
    NONE,

    /**
     * Funds of the deposit are held pending resolve or chargeback.
     */
    DISPUTED
}
