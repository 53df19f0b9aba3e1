package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_engine.account.AccountSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Encodes account snapshots as CSV.
 *
 * Output has a {@code client,available,held,total,locked} header and one row per
 * account, ordered by client id. Amounts are rounded for display only, to
 * {@code transaction-engine.output.scale} decimal places.
 */
@Component
@Slf4j
public class AccountCsvWriter {

    private final ObjectWriter writer;
    private final int scale;

    public AccountCsvWriter(CsvMapper csvMapper,
                            @Value("${transaction-engine.output.scale:4}") int scale) {
        if (scale < 0) {
            throw new IllegalArgumentException("Output scale must not be negative: " + scale);
        }
        this.writer = csvMapper.writer(csvMapper.schemaFor(AccountRecord.class).withHeader())
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.scale = scale;
    }

    /**
     * Writes the header and every account to the target, then flushes it.
     * The target is left open.
     */
    public void write(Collection<AccountSnapshot> accounts, Writer target) throws IOException {
        List<AccountRecord> rows = accounts.stream()
                .sorted(Comparator.comparingInt(AccountSnapshot::getClientId))
                .map(snapshot -> AccountRecord.from(snapshot, scale))
                .toList();

        writer.writeValue(target, rows);
        target.flush();
        log.debug("Wrote {} account rows", rows.size());
    }
}
