package com.gamebank.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One ledger participant.
 *
 * Instances are snapshots of the stored row. Every change (handle refresh,
 * registration, soft delete, balance movement) is written through
 * {@code AccountRepository} inside a transaction and re-read afterwards.
 * Display fields (handle, display name, game id) are informational only and
 * never used for authorization.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    Long id;
    long externalId;
    String handle;
    String displayName;
    String gameId;
    boolean registered;
    boolean deleted;
    boolean admin;
    BigDecimal balance;
    OffsetDateTime createdAt;

    /**
     * Registered and not soft-deleted: may send, receive and request funds.
     */
    public boolean isActive() {
        return registered && !deleted;
    }
}
