package com.gamebank.ledger.exception;

/**
 * The token is unknown, expired or already used. The three cases are
 * deliberately reported with the same message.
 */
public class InvalidPaymentRequestException extends RuntimeException {
    public InvalidPaymentRequestException() {
        super("Payment request is invalid or has expired");
    }
}
