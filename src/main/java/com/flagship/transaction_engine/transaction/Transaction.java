package com.flagship.transaction_engine.transaction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A single, already decoded transaction record fed to the engine.
 *
 * Instances can only be built through the per-kind factory methods, which enforce
 * the record shape:
 * - client id in 0..65535, transaction id in 0..4294967295
 * - deposits and withdrawals carry a non-negative amount
 * - disputes, resolves and chargebacks carry none
 */
@Value
public class Transaction {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    private Transaction(TransactionType type, int clientId, long txId, BigDecimal amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + txId);
        }
        if (type.carriesAmount()) {
            if (amount == null) {
                throw new IllegalArgumentException(type + " requires an amount");
            }
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("Amount must not be negative: " + amount);
            }
        } else if (amount != null) {
            throw new IllegalArgumentException(type + " does not carry an amount");
        }
        this.type = type;
        this.clientId = clientId;
        this.txId = txId;
        this.amount = amount;
    }

    public static Transaction deposit(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static Transaction withdrawal(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static Transaction dispute(int clientId, long txId) {
        return new Transaction(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static Transaction resolve(int clientId, long txId) {
        return new Transaction(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static Transaction chargeback(int clientId, long txId) {
        return new Transaction(TransactionType.CHARGEBACK, clientId, txId, null);
    }

    /**
     * Builds a transaction of the given kind. The amount is ignored for kinds that
     * do not carry one.
     */
    public static Transaction of(TransactionType type, int clientId, long txId, BigDecimal amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        return new Transaction(type, clientId, txId, type.carriesAmount() ? amount : null);
    }
}
