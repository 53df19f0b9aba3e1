package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.observability.ReplayMetrics;
import com.flagship.transaction_engine.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.function.Consumer;

/**
 * Decodes a CSV transaction log into transactions.
 *
 * The first row is a header and is skipped; columns are read positionally as
 * {@code type, client, tx, amount}. Rows that cannot be decoded are logged, counted
 * and skipped, so one bad row never stops the replay.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionCsvReader {

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn("type")
            .addColumn("client")
            .addColumn("tx")
            .addColumn("amount")
            .build()
            .withSkipFirstDataRow(true);

    private final CsvMapper csvMapper;
    private final ReplayMetrics metrics;

    /**
     * Reads every row of the source and hands each decoded transaction to the sink,
     * in input order.
     *
     * @param source CSV text, header first
     * @param sink Receives decoded transactions
     * @return Number of rows that were rejected as malformed
     * @throws IOException if the source cannot be read or is not valid CSV
     */
    public int read(Reader source, Consumer<Transaction> sink) throws IOException {
        ObjectReader reader = csvMapper.readerFor(TransactionRecord.class).with(SCHEMA);

        int row = 0;
        int rejected = 0;
        MappingIterator<TransactionRecord> rows = reader.readValues(source);
        while (rows.hasNextValue()) {
            TransactionRecord record = rows.nextValue();
            row++;

            Transaction transaction;
            try {
                transaction = record.toTransaction();
            } catch (MalformedTransactionException e) {
                rejected++;
                metrics.recordRejected(e.getReason());
                log.warn("Skipping malformed transaction at row {}: {}", row, e.getMessage());
                continue;
            }

            sink.accept(transaction);
        }

        return rejected;
    }
}
