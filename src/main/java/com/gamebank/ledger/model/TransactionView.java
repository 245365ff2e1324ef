package com.gamebank.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Denormalized history row carrying both parties' identities,
 * returned by the transaction history accessor for display.
 */
@Value
@Builder
public class TransactionView {
    Long id;
    TransactionKind kind;
    BigDecimal amount;
    String note;
    Long fromExternalId;
    String fromHandle;
    String fromDisplayName;
    Long toExternalId;
    String toHandle;
    String toDisplayName;
    OffsetDateTime createdAt;
}
