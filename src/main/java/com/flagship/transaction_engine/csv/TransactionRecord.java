package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.transaction_engine.transaction.Transaction;
import com.flagship.transaction_engine.transaction.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One raw row of the transaction log.
 *
 * <p>CSV column order:
 * <pre>
 *   type, client, tx, amount
 * </pre>
 *
 * Every column binds as text so that a bad value fails in {@link #toTransaction()}
 * for this row only, instead of breaking the whole read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TransactionRecord {

    static final int MAX_AMOUNT_SCALE = 18;
    static final int MAX_AMOUNT_INTEGER_DIGITS = 20;

    private String type;
    private String client;
    private String tx;
    private String amount;

    /**
     * Converts the row into a transaction.
     *
     * @throws MalformedTransactionException if any column is missing or invalid
     */
    public Transaction toTransaction() {
        TransactionType transactionType = parseType();
        int clientId = (int) parseId("client", client, Transaction.MAX_CLIENT_ID);
        long txId = parseId("tx", tx, Transaction.MAX_TX_ID);
        BigDecimal parsedAmount = transactionType.carriesAmount() ? parseAmount(transactionType) : null;

        return Transaction.of(transactionType, clientId, txId, parsedAmount);
    }

    private TransactionType parseType() {
        if (isBlank(type)) {
            throw new MalformedTransactionException("missing_type", "Transaction type is missing");
        }
        try {
            return TransactionType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedTransactionException("unknown_type",
                "Unknown transaction type: " + type, e);
        }
    }

    private static long parseId(String column, String value, long max) {
        if (isBlank(value)) {
            throw new MalformedTransactionException("missing_" + column,
                "Column '" + column + "' is missing");
        }
        long id;
        try {
            id = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedTransactionException("invalid_" + column,
                "Column '" + column + "' is not a number: " + value, e);
        }
        if (id < 0 || id > max) {
            throw new MalformedTransactionException("invalid_" + column,
                String.format("Column '%s' out of range [0, %d]: %s", column, max, value));
        }
        return id;
    }

    private BigDecimal parseAmount(TransactionType transactionType) {
        if (isBlank(amount)) {
            throw new MalformedTransactionException("missing_amount",
                transactionType + " requires an amount");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new MalformedTransactionException("invalid_amount",
                "Amount is not a decimal number: " + amount, e);
        }
        if (parsed.signum() < 0) {
            throw new MalformedTransactionException("invalid_amount",
                "Amount must not be negative: " + amount);
        }

        // Exponent notation is accepted only inside a fixed scale window
        BigDecimal stripped = parsed.stripTrailingZeros();
        if (stripped.scale() > MAX_AMOUNT_SCALE) {
            throw new MalformedTransactionException("invalid_amount",
                String.format("Amount has more than %d decimal places: %s", MAX_AMOUNT_SCALE, amount));
        }
        if (stripped.precision() - stripped.scale() > MAX_AMOUNT_INTEGER_DIGITS) {
            throw new MalformedTransactionException("invalid_amount",
                String.format("Amount has more than %d integer digits: %s", MAX_AMOUNT_INTEGER_DIGITS, amount));
        }
        if (parsed.scale() < 0 || parsed.scale() > MAX_AMOUNT_SCALE) {
            return stripped.setScale(Math.max(stripped.scale(), 0));
        }
        return parsed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
