package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_engine.account.AccountSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One output row of the account report.
 *
 * Amounts are pre-formatted in plain notation so that large or small values never
 * come out in exponent form.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRecord {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    /**
     * Formats a snapshot, rounding amounts to the given number of decimal places.
     */
    public static AccountRecord from(AccountSnapshot snapshot, int scale) {
        return new AccountRecord(
            snapshot.getClientId(),
            format(snapshot.getAvailable(), scale),
            format(snapshot.getHeld(), scale),
            format(snapshot.getTotal(), scale),
            snapshot.isLocked()
        );
    }

    private static String format(BigDecimal amount, int scale) {
        return amount.setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }
}
