package com.gamebank.ledger.service;

import com.gamebank.ledger.config.LedgerProperties;
import com.gamebank.ledger.exception.InvalidAmountException;
import com.gamebank.ledger.exception.InvalidPaymentRequestException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.model.PaymentRequest;
import com.gamebank.ledger.model.PaymentRequestStatus;
import com.gamebank.ledger.model.Redemption;
import com.gamebank.ledger.model.TransactionRecord;
import com.gamebank.ledger.repository.AccountRepository;
import com.gamebank.ledger.repository.PaymentRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Issues, validates and redeems single-use payment-request tokens.
 * Expiry is evaluated lazily against the injected clock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentRequestService {

    static final int MAX_TOKEN_ATTEMPTS = 3;

    private final PaymentRequestRepository requestRepo;
    private final AccountRepository accountRepo;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final RequestTokenGenerator tokenGenerator;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Issues a request for the requester to receive {@code amount}, or any amount
     * the payer chooses when {@code amount} is null. Valid for the configured TTL.
     */
    @Transactional
    public PaymentRequest create(long requesterExternalId, BigDecimal amount) {
        Account requester = accountService.requireActive(requesterExternalId);
        BigDecimal fixedAmount = amount == null ? null : LedgerService.requirePositiveAmount(amount);

        OffsetDateTime createdAt = Timestamps.now(clock);
        OffsetDateTime expiresAt = createdAt.plus(properties.getPaymentRequest().getTtl());

        for (int attempt = 1; attempt <= MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.nextToken();
            if (requestRepo.insertIfNew(token, requester.getId(), fixedAmount, createdAt, expiresAt) == 1) {
                PaymentRequest request = requestRepo.findByToken(token).orElseThrow();
                log.info("Payment request #{} issued for account {} amount={} expires_at={}",
                        request.getId(), requesterExternalId,
                        fixedAmount == null ? "open" : fixedAmount.toPlainString(), expiresAt);
                return request;
            }
            log.warn("Token collision on attempt {}, regenerating", attempt);
        }
        throw new IllegalStateException("Could not allocate a unique payment-request token");
    }

    /**
     * Returns the request only while it is redeemable. Unknown, expired and used
     * tokens all yield an empty result.
     */
    @Transactional(readOnly = true)
    public Optional<PaymentRequest> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return requestRepo.findRedeemable(token, Timestamps.now(clock));
    }

    @Transactional(readOnly = true)
    public PaymentRequestStatus describe(String token) {
        if (token == null || token.isBlank()) {
            return PaymentRequestStatus.UNKNOWN;
        }
        return requestRepo.findByToken(token)
                .map(request -> {
                    if (request.isUsed()) {
                        return PaymentRequestStatus.USED;
                    }
                    return request.isExpiredAt(clock.instant())
                            ? PaymentRequestStatus.EXPIRED
                            : PaymentRequestStatus.REDEEMABLE;
                })
                .orElse(PaymentRequestStatus.UNKNOWN);
    }

    /**
     * Pays the request from the payer's balance.
     *
     * Algorithm (inside a single DB transaction):
     *   1. Claim the token: UPDATE used = TRUE WHERE used = FALSE AND not expired.
     *      Zero rows → InvalidPaymentRequestException. The row count alone decides
     *      which of several concurrent redeemers wins.
     *   2. Lock payer and requester rows in ascending id order; the requester
     *      must still be active on its locked row
     *   3. Effective amount: the fixed amount, else {@code offeredAmount}
     *   4. Transfer payer → requester (joins this transaction)
     *   5. Commit: transfer and used flag become visible together
     *
     * Any failure in steps 2-4 rolls back the claim as well, so the request stays
     * redeemable until it expires.
     *
     * @param offeredAmount amount collected from the payer; required for open
     *                      requests, must match (or be null) for fixed ones
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Redemption redeem(String token, long payerExternalId, BigDecimal offeredAmount) {
        if (token == null || token.isBlank()) {
            throw new InvalidPaymentRequestException();
        }

        OffsetDateTime now = Timestamps.now(clock);
        if (requestRepo.claim(token, now) == 0) {
            log.warn("Redemption by {} rejected: token not redeemable", payerExternalId);
            throw new InvalidPaymentRequestException();
        }
        PaymentRequest request = requestRepo.findByToken(token)
                .orElseThrow(() -> new IllegalStateException("Claimed payment request vanished"));

        Account payer = accountService.requireActive(payerExternalId);
        List<Long> sortedIds = Stream.of(payer.getId(), request.getRequesterId())
                .distinct()
                .sorted()
                .toList();
        Account requester = accountRepo.lockForUpdate(sortedIds).stream()
                .filter(account -> account.getId().equals(request.getRequesterId()))
                .filter(Account::isActive)
                .findFirst()
                .orElseThrow(() -> {
                    log.warn("Redemption of request #{} rejected: requester no longer active", request.getId());
                    return new InvalidPaymentRequestException();
                });

        BigDecimal amount = effectiveAmount(request, offeredAmount);
        TransactionRecord transfer = ledgerService.transfer(
                payerExternalId, requester.getExternalId(), amount, "payment-request #" + request.getId());

        log.info("Payment request #{} redeemed by {} amount={}", request.getId(), payerExternalId, amount);
        return new Redemption(request, transfer);
    }

    /**
     * Storage hygiene only: removes requests that expired more than
     * {@code retention} ago. Redeemability of live requests is unaffected.
     */
    @Transactional
    public int purgeExpired(Duration retention) {
        OffsetDateTime cutoff = Timestamps.now(clock).minus(retention);
        int removed = requestRepo.deleteExpiredBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} payment requests expired before {}", removed, cutoff);
        }
        return removed;
    }

    private static BigDecimal effectiveAmount(PaymentRequest request, BigDecimal offeredAmount) {
        if (request.isOpenAmount()) {
            if (offeredAmount == null) {
                throw new InvalidAmountException("amount is required for an open payment request");
            }
            return LedgerService.requirePositiveAmount(offeredAmount);
        }
        if (offeredAmount != null && offeredAmount.compareTo(request.getAmount()) != 0) {
            throw new InvalidAmountException("payment request is fixed at " + request.getAmount().toPlainString()
                    + ", got " + offeredAmount.toPlainString());
        }
        return request.getAmount();
    }
}
