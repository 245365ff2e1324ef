package com.gamebank.ledger.service;

import com.gamebank.ledger.config.LedgerProperties;
import com.gamebank.ledger.exception.AccountNotFoundException;
import com.gamebank.ledger.exception.InsufficientFundsException;
import com.gamebank.ledger.exception.InvalidAmountException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.model.Reconciliation;
import com.gamebank.ledger.model.TransactionKind;
import com.gamebank.ledger.model.TransactionRecord;
import com.gamebank.ledger.model.TransactionView;
import com.gamebank.ledger.repository.AccountRepository;
import com.gamebank.ledger.repository.TransactionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    static final int AMOUNT_SCALE = 2;
    static final int AMOUNT_INTEGER_DIGITS = 16;
    static final BigDecimal BALANCE_LIMIT = BigDecimal.TEN.pow(AMOUNT_INTEGER_DIGITS);

    private final AccountRepository accountRepo;
    private final TransactionRecordRepository txRepo;
    private final AccountService accountService;
    private final LedgerProperties properties;
    private final Clock clock;

    // =========================================================================
    // TRANSFER PROTOCOL
    // =========================================================================

    /**
     * Moves {@code amount} from sender to recipient.
     *
     * Algorithm (inside a single DB transaction):
     *   1. Resolve both parties; both must be active
     *   2. Lock both account rows in ascending id order (deadlock prevention)
     *   3. Re-check both parties are still active on the locked rows, since a
     *      soft delete may have committed between steps 1 and 2
     *   4. Read the sender balance INSIDE the lock
     *   5. If balance < amount → throw InsufficientFundsException (rollback, nothing written)
     *   6. Debit sender, credit recipient, append one transfer record
     *   7. Commit
     *
     * A self-transfer locks one row, passes the same balance check and is logged;
     * its two balance updates cancel out.
     *
     * Joins the caller's transaction when there is one, which is how payment-request
     * redemption makes the claim and the transfer a single unit.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TransactionRecord transfer(long senderExternalId, long recipientExternalId,
                                      BigDecimal amount, String note) {
        BigDecimal normalized = requirePositiveAmount(amount);

        Account sender = accountService.requireActive(senderExternalId);
        Account recipient = accountService.requireActive(recipientExternalId);

        List<Long> sortedIds = Stream.of(sender.getId(), recipient.getId())
                .distinct()
                .sorted()
                .toList();
        Map<Long, Account> locked = lockAll(sortedIds);
        Account lockedSender = requireStillActive(locked, sender.getId(), senderExternalId);
        Account lockedRecipient = requireStillActive(locked, recipient.getId(), recipientExternalId);

        BigDecimal available = accountRepo.getBalance(lockedSender.getId());
        if (available.compareTo(normalized) < 0) {
            log.warn("Transfer {} -> {} of {} rejected: balance {}",
                    senderExternalId, recipientExternalId, normalized, available);
            throw new InsufficientFundsException(senderExternalId, available, normalized);
        }
        if (!sender.getId().equals(recipient.getId())) {
            requireStorableBalance(accountRepo.getBalance(lockedRecipient.getId()).add(normalized), recipientExternalId);
        }

        accountRepo.applyDelta(sender.getId(), normalized.negate());
        accountRepo.applyDelta(recipient.getId(), normalized);

        TransactionRecord record = txRepo.insert(
                TransactionKind.TRANSFER, sender.getId(), recipient.getId(), normalized, note, Timestamps.now(clock));
        log.info("Transfer #{}: {} -> {} amount={}", record.getId(), senderExternalId, recipientExternalId, normalized);
        return record;
    }

    // =========================================================================
    // ADMIN ADJUSTMENT PROTOCOL
    // =========================================================================

    /**
     * Credits or debits the target unconditionally on behalf of an admin.
     *
     * The admin flag is read from the store, never taken from the caller. A debit
     * may drive the balance negative. Admin actions do not touch the admin's own
     * balance: the admin is named only in the note, and the record carries the
     * target as {@code to} (credit) or {@code from} (debit).
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public TransactionRecord adjust(long adminExternalId, long targetExternalId,
                                    BigDecimal amount, boolean credit, String note) {
        accountService.requireAdmin(adminExternalId, "adjust balances");
        BigDecimal normalized = requirePositiveAmount(amount);

        Account target = accountRepo.findByExternalId(targetExternalId)
                .filter(account -> !account.isDeleted())
                .orElseThrow(() -> new AccountNotFoundException(targetExternalId));

        Account locked = lockAll(List.of(target.getId())).get(target.getId());
        if (locked == null || locked.isDeleted()) {
            throw new AccountNotFoundException(targetExternalId);
        }
        BigDecimal delta = credit ? normalized : normalized.negate();
        requireStorableBalance(accountRepo.getBalance(locked.getId()).add(delta), targetExternalId);
        accountRepo.applyDelta(target.getId(), delta);

        TransactionRecord record = txRepo.insert(
                credit ? TransactionKind.ADMIN_CREDIT : TransactionKind.ADMIN_DEBIT,
                credit ? null : target.getId(),
                credit ? target.getId() : null,
                normalized,
                adminNote(adminExternalId, note),
                Timestamps.now(clock));
        log.info("Admin {} #{}: admin={} target={} amount={}",
                record.getKind().code(), record.getId(), adminExternalId, targetExternalId, normalized);
        return record;
    }

    // =========================================================================
    // QUERY OPERATIONS
    // =========================================================================

    @Transactional(readOnly = true)
    public BigDecimal balance(long externalId) {
        return accountService.currentBalance(externalId);
    }

    /**
     * Most recent records first. The limit is clamped to [1, max-limit];
     * a null limit falls back to the configured default.
     */
    @Transactional(readOnly = true)
    public List<TransactionView> history(long externalId, Integer limit) {
        Account account = accountRepo.findByExternalId(externalId)
                .orElseThrow(() -> new AccountNotFoundException(externalId));
        LedgerProperties.HistorySettings settings = properties.getHistory();
        int effective = limit == null ? settings.getDefaultLimit() : limit;
        effective = Math.max(1, Math.min(effective, settings.getMaxLimit()));
        return txRepo.findHistory(account.getId(), effective);
    }

    @Transactional(readOnly = true)
    public long transactionCount(long externalId) {
        Account account = accountRepo.findByExternalId(externalId)
                .orElseThrow(() -> new AccountNotFoundException(externalId));
        return txRepo.countByAccount(account.getId());
    }

    /**
     * Compares the stored balance with the one rebuilt from the log.
     */
    @Transactional(readOnly = true)
    public Reconciliation reconcile(long externalId) {
        Account account = accountRepo.findByExternalId(externalId)
                .orElseThrow(() -> new AccountNotFoundException(externalId));
        Reconciliation result = new Reconciliation(
                externalId, accountRepo.getBalance(account.getId()), txRepo.replayBalance(account.getId()));
        if (!result.isConsistent()) {
            log.error("Ledger mismatch for account {}: balance={} replayed={}",
                    externalId, result.getBalance(), result.getReplayedBalance());
        }
        return result;
    }

    // =========================================================================
    // VALIDATION HELPERS
    // =========================================================================

    /**
     * Amounts must be positive with at most two decimal places; they are
     * returned at scale 2.
     */
    static BigDecimal requirePositiveAmount(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException("amount must be positive, got " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new InvalidAmountException("amount must have at most " + AMOUNT_SCALE
                    + " decimal places, got " + amount.toPlainString());
        }
        BigDecimal scaled = amount.setScale(AMOUNT_SCALE);
        if (scaled.precision() - scaled.scale() > AMOUNT_INTEGER_DIGITS) {
            throw new InvalidAmountException("amount is too large: " + amount.toPlainString());
        }
        return scaled;
    }

    /**
     * Balances share the {@code NUMERIC(18,2)} column type of amounts; a change that
     * would leave 17 or more integer digits is rejected before anything is written.
     */
    static void requireStorableBalance(BigDecimal resultingBalance, long externalId) {
        if (resultingBalance.abs().compareTo(BALANCE_LIMIT) >= 0) {
            throw new InvalidAmountException("resulting balance of account " + externalId
                    + " would be out of range: " + resultingBalance.toPlainString());
        }
    }

    private Map<Long, Account> lockAll(List<Long> sortedIds) {
        return accountRepo.lockForUpdate(sortedIds).stream()
                .collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    private static Account requireStillActive(Map<Long, Account> locked, Long id, long externalId) {
        Account account = locked.get(id);
        if (account == null || !account.isActive()) {
            log.warn("Account {} became inactive before its row was locked", externalId);
            throw new AccountNotFoundException(externalId);
        }
        return account;
    }

    private static String adminNote(long adminExternalId, String note) {
        String tag = "admin:" + adminExternalId;
        if (note == null || note.isBlank()) {
            return tag;
        }
        return note.strip() + " (" + tag + ")";
    }
}
