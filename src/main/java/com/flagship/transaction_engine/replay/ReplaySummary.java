package com.flagship.transaction_engine.replay;

import com.flagship.transaction_engine.account.AccountSnapshot;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Result of one replay: the final accounts plus counters of what happened to each row.
 */
@Value
public class ReplaySummary {
    List<AccountSnapshot> accounts;
    long applied;
    long ignored;
    long rejected;
    Duration duration;

    public long getProcessed() {
        return applied + ignored;
    }
}
