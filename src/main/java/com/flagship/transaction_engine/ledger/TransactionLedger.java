package com.flagship.transaction_engine.ledger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Deposit records keyed by transaction id, used to validate and reverse disputes.
 *
 * Entries live for the whole replay. Not thread-safe: owned by exactly one engine.
 */
public class TransactionLedger {

    private final Map<Long, LedgerEntry> entries = new HashMap<>();

    /**
     * Inserts the entry, replacing any entry already recorded under the same id.
     */
    public void record(long txId, LedgerEntry entry) {
        entries.put(txId, entry);
    }

    /**
     * Looks up an entry. Empty for unknown ids and for ids that never were deposits.
     */
    public Optional<LedgerEntry> lookup(long txId) {
        return Optional.ofNullable(entries.get(txId));
    }

    public int size() {
        return entries.size();
    }
}
