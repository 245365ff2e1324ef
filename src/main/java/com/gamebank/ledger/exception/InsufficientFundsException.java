package com.gamebank.ledger.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends RuntimeException {
    public InsufficientFundsException(long externalId, BigDecimal available, BigDecimal requested) {
        super(String.format(
            "Insufficient funds for account %d: available=%s, requested=%s",
            externalId, available.toPlainString(), requested.toPlainString()
        ));
    }
}
