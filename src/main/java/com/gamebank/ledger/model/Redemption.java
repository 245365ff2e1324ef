package com.gamebank.ledger.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Redemption {
    PaymentRequest request;
    TransactionRecord transaction;

    public BigDecimal getAmount() {
        return transaction.getAmount();
    }
}
