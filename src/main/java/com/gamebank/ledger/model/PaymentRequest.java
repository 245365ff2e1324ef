package com.gamebank.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Single-use, time-limited capability token: whoever holds {@code token}
 * may pay the requester. A null {@code amount} lets the payer choose.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRequest {
    Long id;
    String token;
    Long requesterId;
    BigDecimal amount;
    OffsetDateTime createdAt;
    OffsetDateTime expiresAt;
    boolean used;

    public boolean isOpenAmount() {
        return amount == null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt.toInstant());
    }

    public boolean isRedeemableAt(Instant now) {
        return !used && !isExpiredAt(now);
    }
}
