package com.flagship.transaction_engine.transaction;

/**
 * Kind of a transaction record.
 *
 * Deposits and withdrawals move funds and carry an amount.
 * Disputes, resolves and chargebacks carry no amount; they reference a prior deposit
 * by its transaction id.
 */
public enum TransactionType {
    DEPOSIT(true),
    WITHDRAWAL(true),
    DISPUTE(false),
    RESOLVE(false),
    CHARGEBACK(false);

    private final boolean carriesAmount;

    TransactionType(boolean carriesAmount) {
        this.carriesAmount = carriesAmount;
    }

    public boolean carriesAmount() {
        return carriesAmount;
    }
}
