package com.flagship.transaction_engine.replay;

import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.flagship.transaction_engine.csv.AccountCsvWriter;
import com.flagship.transaction_engine.csv.TransactionCsvReader;
import com.flagship.transaction_engine.engine.TransactionEngine;
import com.flagship.transaction_engine.engine.TransactionOutcome;
import com.flagship.transaction_engine.engine.TransactionOutcomeListener;
import com.flagship.transaction_engine.observability.ReplayMetrics;
import com.flagship.transaction_engine.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs a transaction log through a fresh engine and reports the resulting accounts.
 *
 * Each replay:
 * 1. Decodes the CSV log row by row, skipping malformed rows
 * 2. Applies every decoded transaction in input order
 * 3. Writes the final account snapshot as CSV
 *
 * The service itself is stateless; all balance state lives in the engine created for
 * the replay and is discarded afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayService {

    static final String INPUT_FILE_MDC_KEY = "inputFile";

    private final TransactionCsvReader reader;
    private final AccountCsvWriter writer;
    private final ReplayMetrics metrics;

    /**
     * Replays the log at the given path and writes the report to the output.
     *
     * @throws ReplayException if the log cannot be read or the report cannot be written
     */
    public ReplaySummary replay(Path input, Writer output) {
        MDC.put(INPUT_FILE_MDC_KEY, input.toString());
        try (Reader source = openLog(input)) {
            return replay(source, output);
        } catch (IOException e) {
            throw new ReplayException("Cannot read transaction log " + input + ": " + e.getMessage(), e);
        } finally {
            MDC.remove(INPUT_FILE_MDC_KEY);
        }
    }

    /**
     * Opens the log as UTF-8, replacing undecodable bytes so that a bad row fails
     * on its own during conversion.
     */
    private static Reader openLog(Path input) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(input), decoder));
    }

    /**
     * Replays the log from the source and writes the report to the output.
     *
     * @throws ReplayException if the log cannot be read or the report cannot be written
     */
    public ReplaySummary replay(Reader source, Writer output) {
        ReplaySummary summary = process(source);
        try {
            writer.write(summary.getAccounts(), output);
        } catch (IOException e) {
            throw new ReplayException("Cannot write account report: " + e.getMessage(), e);
        }
        return summary;
    }

    /**
     * Replays the log from the source without writing anything.
     *
     * @throws ReplayException if the log cannot be read
     */
    public ReplaySummary process(Reader source) {
        long startTime = System.currentTimeMillis();
        log.info("Starting replay");

        OutcomeCounter counter = new OutcomeCounter();
        TransactionEngine engine = new TransactionEngine(counter);

        int rejected;
        try {
            rejected = reader.read(source, engine::apply);
        } catch (IOException | RuntimeJsonMappingException e) {
            log.error("Replay aborted: error={}", e.getMessage());
            throw new ReplayException("Cannot read transaction log: " + e.getMessage(), e);
        }

        Duration duration = Duration.ofMillis(System.currentTimeMillis() - startTime);
        metrics.recordReplayDuration(duration);

        ReplaySummary summary = new ReplaySummary(
            engine.snapshot(), counter.applied, counter.ignored, rejected, duration);

        log.info("Replay finished: accounts={}, applied={}, ignored={}, rejected={}, duration={}ms",
                summary.getAccounts().size(), summary.getApplied(), summary.getIgnored(),
                summary.getRejected(), duration.toMillis());
        return summary;
    }

    /**
     * Counts outcomes for the summary and forwards them to metrics.
     */
    private class OutcomeCounter implements TransactionOutcomeListener {
        private long applied;
        private long ignored;

        @Override
        public void onOutcome(Transaction transaction, TransactionOutcome outcome) {
            metrics.recordOutcome(transaction.getType(), outcome);
            if (outcome.isApplied()) {
                applied++;
                return;
            }
            ignored++;
            log.debug("Ignored {}: client={}, tx={}, outcome={}",
                    transaction.getType(), transaction.getClientId(), transaction.getTxId(), outcome);
        }
    }
}
