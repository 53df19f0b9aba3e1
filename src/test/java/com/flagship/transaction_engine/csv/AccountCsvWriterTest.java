package com.flagship.transaction_engine.csv;

import com.flagship.transaction_engine.account.AccountSnapshot;
import com.flagship.transaction_engine.config.CsvConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountCsvWriterTest {

    private static AccountSnapshot snapshot(int client, String available, String held, boolean locked) {
        BigDecimal a = new BigDecimal(available);
        BigDecimal h = new BigDecimal(held);
        return new AccountSnapshot(client, a, h, a.add(h), locked);
    }

    private static String write(AccountCsvWriter writer, List<AccountSnapshot> accounts) throws IOException {
        StringWriter out = new StringWriter();
        writer.write(accounts, out);
        return out.toString();
    }

    @Test
    @DisplayName("Accounts should be written with header, sorted by client, four decimals")
    void testWrite() throws IOException {
        AccountCsvWriter writer = new AccountCsvWriter(new CsvConfig().csvMapper(), 4);

        String csv = write(writer, List.of(
            snapshot(2, "2", "0", false),
            snapshot(1, "1.5", "0.25", true)));

        assertEquals("client,available,held,total,locked\n"
            + "1,1.5000,0.2500,1.7500,true\n"
            + "2,2.0000,0.0000,2.0000,false\n", csv);
    }

    @Test
    @DisplayName("Rounding should only happen on output, half to even")
    void testRounding() throws IOException {
        AccountCsvWriter writer = new AccountCsvWriter(new CsvConfig().csvMapper(), 2);

        String csv = write(writer, List.of(snapshot(1, "0.125", "0.135", false)));

        assertTrue(csv.endsWith("1,0.12,0.14,0.26,false\n"), csv);
    }

    @Test
    @DisplayName("Large amounts should never use exponent notation")
    void testPlainNotation() throws IOException {
        AccountCsvWriter writer = new AccountCsvWriter(new CsvConfig().csvMapper(), 0);

        String csv = write(writer, List.of(snapshot(1, "1E+10", "0", false)));

        assertTrue(csv.endsWith("1,10000000000,0,10000000000,false\n"), csv);
    }

    @Test
    @DisplayName("Negative scale should be rejected")
    void testNegativeScale() {
        assertThrows(IllegalArgumentException.class,
            () -> new AccountCsvWriter(new CsvConfig().csvMapper(), -1));
    }
}
