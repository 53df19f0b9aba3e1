package com.flagship.transaction_engine.account;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Live balance state of one client.
 *
 * Mutated in place by the transaction engine only; everything outside this package
 * works with {@link AccountSnapshot} copies.
 *
 * Key invariant: total == available + held after every applied operation.
 * Once locked, an account stays locked.
 */
@Getter
@ToString
public class Account {

    private final int clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private BigDecimal total = BigDecimal.ZERO;
    private boolean locked;

    Account(int clientId) {
        this.clientId = clientId;
    }

    /**
     * Adds fresh funds: available and total grow by the amount.
     */
    public void credit(BigDecimal amount) {
        available = available.add(amount);
        total = total.add(amount);
    }

    /**
     * Removes funds: available and total shrink by the amount.
     */
    public void debit(BigDecimal amount) {
        available = available.subtract(amount);
        total = total.subtract(amount);
    }

    /**
     * Moves the amount from available to held. Total is unchanged.
     */
    public void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    /**
     * Moves the amount from held back to available. Total is unchanged.
     */
    public void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    /**
     * Removes held funds for good and freezes the account.
     */
    public void reverse(BigDecimal amount) {
        held = held.subtract(amount);
        total = total.subtract(amount);
        locked = true;
    }

    public boolean hasAvailable(BigDecimal amount) {
        return available.compareTo(amount) >= 0;
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, total, locked);
    }
}
