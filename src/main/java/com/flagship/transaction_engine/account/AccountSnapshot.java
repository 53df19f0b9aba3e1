package com.flagship.transaction_engine.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable copy of an account's balances at the time it was taken.
 */
@Value
public class AccountSnapshot {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;

    /**
     * Compares balances numerically, so 10.0 and 10.00 are considered equal.
     */
    public boolean hasBalances(BigDecimal available, BigDecimal held, BigDecimal total) {
        return this.available.compareTo(available) == 0
            && this.held.compareTo(held) == 0
            && this.total.compareTo(total) == 0;
    }

    public boolean isBalanced() {
        return total.compareTo(available.add(held)) == 0;
    }
}
