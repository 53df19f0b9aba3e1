package com.flagship.transaction_engine.account;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of client accounts for a single replay.
 *
 * Accounts are created lazily with zero balances on first reference and are never
 * removed. Not thread-safe: owned by exactly one engine.
 */
public class AccountStore {

    private final Map<Integer, Account> accounts = new HashMap<>();

    /**
     * Returns the live account for the client, creating an empty one if absent.
     */
    public Account getOrCreate(int clientId) {
        return accounts.computeIfAbsent(clientId, Account::new);
    }

    public Optional<Account> find(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    /**
     * Copies every tracked account. No ordering is guaranteed.
     */
    public List<AccountSnapshot> snapshot() {
        List<AccountSnapshot> snapshots = new ArrayList<>(accounts.size());
        for (Account account : accounts.values()) {
            snapshots.add(account.snapshot());
        }
        return snapshots;
    }

    public int size() {
        return accounts.size();
    }
}
