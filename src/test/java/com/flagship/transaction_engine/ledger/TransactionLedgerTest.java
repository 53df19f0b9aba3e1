package com.flagship.transaction_engine.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TransactionLedgerTest {

    private final TransactionLedger ledger = new TransactionLedger();

    @Test
    @DisplayName("Lookup of an unknown id should be empty, not an error")
    void testLookupUnknown() {
        assertTrue(ledger.lookup(1).isEmpty());
        assertEquals(0, ledger.size());
    }

    @Test
    @DisplayName("Recorded deposit should start undisputed")
    void testRecordDeposit() {
        ledger.record(10, LedgerEntry.deposit(2, 10, new BigDecimal("7.25")));

        LedgerEntry entry = ledger.lookup(10).orElseThrow();
        assertEquals(2, entry.getClientId());
        assertEquals(10L, entry.getTxId());
        assertEquals(new BigDecimal("7.25"), entry.getAmount());
        assertEquals(DisputeState.NONE, entry.getDisputeState());
        assertFalse(entry.isDisputed());
    }

    @Test
    @DisplayName("Recording under an existing id should overwrite the entry")
    void testRecordOverwrites() {
        LedgerEntry entry = LedgerEntry.deposit(2, 10, new BigDecimal("7.25"));
        ledger.record(10, entry);

        ledger.record(10, entry.withDisputeState(DisputeState.DISPUTED));

        assertEquals(1, ledger.size());
        assertTrue(ledger.lookup(10).orElseThrow().isDisputed());
        assertFalse(entry.isDisputed(), "Entries are immutable");
    }
}
