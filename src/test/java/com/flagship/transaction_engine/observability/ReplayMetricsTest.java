package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.engine.TransactionOutcome;
import com.flagship.transaction_engine.transaction.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReplayMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ReplayMetrics metrics = new ReplayMetrics(registry);

    @Test
    @DisplayName("Applied and ignored outcomes should land on separate counters")
    void testRecordOutcome() {
        metrics.recordOutcome(TransactionType.DEPOSIT, TransactionOutcome.APPLIED);
        metrics.recordOutcome(TransactionType.DEPOSIT, TransactionOutcome.APPLIED);
        metrics.recordOutcome(TransactionType.WITHDRAWAL, TransactionOutcome.INSUFFICIENT_FUNDS);

        assertEquals(2.0, registry.counter("transactions.applied", "type", "deposit").count());
        assertEquals(1.0, registry.counter("transactions.ignored",
            "type", "withdrawal", "outcome", "insufficient_funds").count());
    }

    @Test
    @DisplayName("Rejected reasons should be sanitized")
    void testRecordRejected() {
        metrics.recordRejected("bad reason!");
        metrics.recordRejected(null);

        assertEquals(1.0, registry.counter("transactions.rejected", "reason", "bad_reason_").count());
        assertEquals(1.0, registry.counter("transactions.rejected", "reason", "unknown").count());
    }

    @Test
    @DisplayName("Replay duration should be timed")
    void testReplayDuration() {
        metrics.recordReplayDuration(Duration.ofMillis(15));

        assertEquals(1, registry.timer("replay.duration").count());
    }
}
