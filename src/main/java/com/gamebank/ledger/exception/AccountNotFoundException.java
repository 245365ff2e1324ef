package com.gamebank.ledger.exception;

public class AccountNotFoundException extends RuntimeException {
    public AccountNotFoundException(long externalId) {
        super("Account not found: external_id=" + externalId);
    }

    public AccountNotFoundException(String field, String value) {
        super("Account not found: " + field + "='" + value + "'");
    }
}
