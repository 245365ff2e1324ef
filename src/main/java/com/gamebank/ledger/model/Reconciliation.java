package com.gamebank.ledger.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Stored balance next to the balance obtained by replaying the
 * transaction log from zero (+to, -from).
 */
@Value
public class Reconciliation {
    long externalId;
    BigDecimal balance;
    BigDecimal replayedBalance;

    public boolean isConsistent() {
        return balance.compareTo(replayedBalance) == 0;
    }
}
