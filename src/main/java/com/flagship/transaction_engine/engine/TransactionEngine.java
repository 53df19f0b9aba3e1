package com.flagship.transaction_engine.engine;

import com.flagship.transaction_engine.account.Account;
import com.flagship.transaction_engine.account.AccountSnapshot;
import com.flagship.transaction_engine.account.AccountStore;
import com.flagship.transaction_engine.ledger.DisputeState;
import com.flagship.transaction_engine.ledger.LedgerEntry;
import com.flagship.transaction_engine.ledger.TransactionLedger;
import com.flagship.transaction_engine.transaction.Transaction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Replays transactions, one at a time and in input order, into account balances.
 *
 * The engine exclusively owns its account store and transaction ledger. Every handler
 * is total: a transaction that cannot be applied (locked account, insufficient funds,
 * unknown transaction id, wrong dispute state) is absorbed as a no-op and leaves
 * both stores unchanged. Nothing is thrown or returned to the caller; outcomes are only
 * visible through the {@link TransactionOutcomeListener}.
 *
 * Account addressing:
 * - deposits and withdrawals use the client id of the transaction itself
 * - disputes, resolves and chargebacks use the client id of the recorded deposit,
 *   the client id on the dispute record is never trusted
 *
 * Locked accounts reject deposits and withdrawals only. Disputes against deposits of
 * a locked account still move funds between available and held.
 *
 * Not thread-safe. Create one engine per replay.
 */
public class TransactionEngine {

    private final AccountStore accounts;
    private final TransactionLedger ledger;
    private final TransactionOutcomeListener listener;

    public TransactionEngine() {
        this(new AccountStore(), new TransactionLedger(), TransactionOutcomeListener.NONE);
    }

    public TransactionEngine(TransactionOutcomeListener listener) {
        this(new AccountStore(), new TransactionLedger(), listener);
    }

    public TransactionEngine(AccountStore accounts, TransactionLedger ledger,
                             TransactionOutcomeListener listener) {
        this.accounts = Objects.requireNonNull(accounts);
        this.ledger = Objects.requireNonNull(ledger);
        this.listener = listener != null ? listener : TransactionOutcomeListener.NONE;
    }

    /**
     * Applies a single transaction.
     *
     * @param transaction Decoded transaction, never null
     */
    public void apply(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction");

        TransactionOutcome outcome = switch (transaction.getType()) {
            case DEPOSIT -> deposit(transaction);
            case WITHDRAWAL -> withdraw(transaction);
            case DISPUTE -> dispute(transaction);
            case RESOLVE -> resolve(transaction);
            case CHARGEBACK -> chargeback(transaction);
        };

        listener.onOutcome(transaction, outcome);
    }

    /**
     * Copies every account referenced so far. No ordering is guaranteed.
     */
    public List<AccountSnapshot> snapshot() {
        return accounts.snapshot();
    }

    private TransactionOutcome deposit(Transaction deposit) {
        Account account = accounts.getOrCreate(deposit.getClientId());
        if (account.isLocked()) {
            return TransactionOutcome.ACCOUNT_LOCKED;
        }

        account.credit(deposit.getAmount());
        ledger.record(deposit.getTxId(),
            LedgerEntry.deposit(deposit.getClientId(), deposit.getTxId(), deposit.getAmount()));
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome withdraw(Transaction withdrawal) {
        Account account = accounts.getOrCreate(withdrawal.getClientId());
        if (account.isLocked()) {
            return TransactionOutcome.ACCOUNT_LOCKED;
        }
        if (!account.hasAvailable(withdrawal.getAmount())) {
            return TransactionOutcome.INSUFFICIENT_FUNDS;
        }

        account.debit(withdrawal.getAmount());
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome dispute(Transaction dispute) {
        Optional<LedgerEntry> found = ledger.lookup(dispute.getTxId());
        if (found.isEmpty()) {
            return TransactionOutcome.UNKNOWN_TRANSACTION;
        }
        LedgerEntry entry = found.get();
        if (entry.getDisputeState() != DisputeState.NONE) {
            return TransactionOutcome.INVALID_DISPUTE_STATE;
        }

        accounts.getOrCreate(entry.getClientId()).hold(entry.getAmount());
        ledger.record(entry.getTxId(), entry.withDisputeState(DisputeState.DISPUTED));
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome resolve(Transaction resolve) {
        Optional<LedgerEntry> found = ledger.lookup(resolve.getTxId());
        if (found.isEmpty()) {
            return TransactionOutcome.UNKNOWN_TRANSACTION;
        }
        LedgerEntry entry = found.get();
        if (!entry.isDisputed()) {
            return TransactionOutcome.INVALID_DISPUTE_STATE;
        }

        accounts.getOrCreate(entry.getClientId()).release(entry.getAmount());
        ledger.record(entry.getTxId(), entry.withDisputeState(DisputeState.NONE));
        return TransactionOutcome.APPLIED;
    }

    private TransactionOutcome chargeback(Transaction chargeback) {
        Optional<LedgerEntry> found = ledger.lookup(chargeback.getTxId());
        if (found.isEmpty()) {
            return TransactionOutcome.UNKNOWN_TRANSACTION;
        }
        LedgerEntry entry = found.get();
        if (!entry.isDisputed()) {
            return TransactionOutcome.INVALID_DISPUTE_STATE;
        }

        accounts.getOrCreate(entry.getClientId()).reverse(entry.getAmount());
        ledger.record(entry.getTxId(), entry.withDisputeState(DisputeState.NONE));
        return TransactionOutcome.APPLIED;
    }
}
