package com.gamebank.ledger.service;

import com.gamebank.ledger.config.LedgerProperties;
import com.gamebank.ledger.exception.AccountNotFoundException;
import com.gamebank.ledger.exception.InvalidRegistrationException;
import com.gamebank.ledger.exception.UnauthorizedException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Balance store: account resolution, first contact, registration and soft delete.
 * Balances themselves are only moved by {@link LedgerService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository accountRepo;
    private final LedgerProperties properties;
    private final Clock clock;

    // =========================================================================
    // RESOLUTION
    // =========================================================================

    @Transactional(readOnly = true)
    public Optional<Account> resolve(long externalId) {
        return accountRepo.findByExternalId(externalId);
    }

    @Transactional(readOnly = true)
    public Optional<Account> resolveById(long id) {
        return accountRepo.findById(id);
    }

    /**
     * Resolves an active account by handle. A leading '@' is ignored and the
     * comparison is case-insensitive.
     */
    @Transactional(readOnly = true)
    public Optional<Account> resolveByHandle(String handle) {
        String normalized = normalizeHandle(handle);
        if (normalized == null) {
            return Optional.empty();
        }
        return accountRepo.findActiveByHandle(normalized);
    }

    @Transactional(readOnly = true)
    public Optional<Account> resolveByGameId(String gameId) {
        if (gameId == null || gameId.isBlank()) {
            return Optional.empty();
        }
        return accountRepo.findActiveByGameId(gameId.strip());
    }

    @Transactional(readOnly = true)
    public Optional<Account> resolveByDisplayName(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return Optional.empty();
        }
        return accountRepo.findActiveByDisplayName(displayName.strip());
    }

    @Transactional(readOnly = true)
    public List<Account> listActive(int limit) {
        return accountRepo.findActive(Math.max(1, Math.min(limit, properties.getHistory().getMaxLimit())));
    }

    /**
     * Re-reads the stored balance; never trusts a previously loaded snapshot.
     */
    @Transactional(readOnly = true)
    public BigDecimal currentBalance(long externalId) {
        Account account = accountRepo.findByExternalId(externalId)
                .orElseThrow(() -> new AccountNotFoundException(externalId));
        return accountRepo.getBalance(account.getId());
    }

    // =========================================================================
    // LIFECYCLE
    // =========================================================================

    /**
     * Returns the account for this identity, creating an unregistered zero-balance
     * one on first contact. A non-null handle different from the stored one
     * replaces it. The bootstrap identity is created with the admin flag.
     */
    @Transactional
    public Account createOrGet(long externalId, String handle) {
        String normalized = normalizeHandle(handle);
        int created = accountRepo.insertIfAbsent(
                externalId, normalized, properties.isBootstrapAdmin(externalId), Timestamps.now(clock));
        Account account = accountRepo.findByExternalId(externalId)
                .orElseThrow(() -> new IllegalStateException("Account should exist after createOrGet"));

        if (created == 1) {
            log.info("Created account external_id={} admin={}", externalId, account.isAdmin());
            return account;
        }
        if (normalized != null && !normalized.equals(account.getHandle())) {
            accountRepo.updateHandle(account.getId(), normalized);
            return account.toBuilder().handle(normalized).build();
        }
        return account;
    }

    /**
     * Completes registration: stores the in-game display name and id and marks the
     * account registered. Creates the account if this is the first contact.
     * An existing admin flag is kept; the bootstrap identity always ends up admin.
     */
    @Transactional
    public Account completeRegistration(long externalId, String handle, String displayName, String gameId) {
        if (displayName == null || displayName.isBlank()) {
            throw new InvalidRegistrationException("display_name must not be blank");
        }
        if (gameId == null || gameId.isBlank()) {
            throw new InvalidRegistrationException("game_id must not be blank");
        }

        Account account = createOrGet(externalId, handle);
        accountRepo.updateRegistration(
                account.getId(),
                account.getHandle(),
                displayName.strip(),
                gameId.strip(),
                properties.isBootstrapAdmin(externalId)
        );
        Account registered = accountRepo.findById(account.getId()).orElseThrow();
        log.info("Registered account external_id={} display_name='{}' game_id={}",
                externalId, registered.getDisplayName(), registered.getGameId());
        return registered;
    }

    /**
     * Soft-deletes the target: it disappears from lookups used for new transfers
     * and requests, while its transaction history stays intact.
     */
    @Transactional
    public Account softDelete(long adminExternalId, long targetExternalId) {
        return setDeleted(adminExternalId, targetExternalId, true);
    }

    @Transactional
    public Account restore(long adminExternalId, long targetExternalId) {
        return setDeleted(adminExternalId, targetExternalId, false);
    }

    // =========================================================================
    // GUARDS
    // =========================================================================

    /**
     * Loads the acting account and checks its admin flag from the store.
     * Unknown and soft-deleted identities are treated as non-admins.
     */
    @Transactional(readOnly = true)
    public Account requireAdmin(long externalId, String action) {
        return accountRepo.findByExternalId(externalId)
                .filter(Account::isAdmin)
                .filter(account -> !account.isDeleted())
                .orElseThrow(() -> new UnauthorizedException(externalId, action));
    }

    /**
     * Loads an account that may currently send, receive or request funds.
     */
    @Transactional(readOnly = true)
    public Account requireActive(long externalId) {
        return accountRepo.findByExternalId(externalId)
                .filter(Account::isActive)
                .orElseThrow(() -> new AccountNotFoundException(externalId));
    }

    private Account setDeleted(long adminExternalId, long targetExternalId, boolean deleted) {
        requireAdmin(adminExternalId, deleted ? "delete accounts" : "restore accounts");
        Account target = accountRepo.findByExternalId(targetExternalId)
                .orElseThrow(() -> new AccountNotFoundException(targetExternalId));

        accountRepo.updateDeleted(target.getId(), deleted);
        log.info("Account external_id={} deleted={} by admin external_id={}",
                targetExternalId, deleted, adminExternalId);
        return target.toBuilder().deleted(deleted).build();
    }

    private static String normalizeHandle(String handle) {
        if (handle == null) {
            return null;
        }
        String stripped = handle.strip();
        if (stripped.startsWith("@")) {
            stripped = stripped.substring(1);
        }
        return stripped.isEmpty() ? null : stripped;
    }
}
