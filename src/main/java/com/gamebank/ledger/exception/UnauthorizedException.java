package com.gamebank.ledger.exception;

public class UnauthorizedException extends RuntimeException {
    public UnauthorizedException(long externalId, String action) {
        super("Account " + externalId + " is not allowed to " + action);
    }
}
