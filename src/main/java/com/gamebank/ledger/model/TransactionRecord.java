package com.gamebank.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Immutable audit entry of one balance-affecting event.
 * {@code fromAccountId} is null for admin credits, {@code toAccountId} for admin debits.
 */
@Value
@Builder
public class TransactionRecord {
    Long id;
    Long fromAccountId;
    Long toAccountId;
    BigDecimal amount;
    TransactionKind kind;
    String note;
    OffsetDateTime createdAt;
}
