package com.flagship.transaction_engine.observability;

import com.flagship.transaction_engine.engine.TransactionOutcome;
import com.flagship.transaction_engine.transaction.TransactionType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for transaction replays.
 *
 * Metrics exposed:
 * - transactions.applied: Counter of applied transactions, tagged by type
 * - transactions.ignored: Counter of no-op transactions, tagged by type and outcome
 * - transactions.rejected: Counter of log rows that could not be decoded, tagged by reason
 * - replay.duration: Timer for complete replays
 */
@Component
public class ReplayMetrics {

    private final MeterRegistry registry;
    private final Timer replayTimer;

    public ReplayMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replayTimer = Timer.builder("replay.duration")
                .description("Time taken to replay a transaction log")
                .register(registry);
    }

    /**
     * Records the outcome of one applied or ignored transaction.
     */
    public void recordOutcome(TransactionType type, TransactionOutcome outcome) {
        if (outcome.isApplied()) {
            registry.counter("transactions.applied",
                    "type", tag(type.name())
            ).increment();
        } else {
            registry.counter("transactions.ignored",
                    "type", tag(type.name()),
                    "outcome", tag(outcome.name())
            ).increment();
        }
    }

    /**
     * Records a log row that was skipped because it could not be decoded.
     */
    public void recordRejected(String reason) {
        registry.counter("transactions.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordReplayDuration(Duration duration) {
        replayTimer.record(duration);
    }

    private static String tag(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private static String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
