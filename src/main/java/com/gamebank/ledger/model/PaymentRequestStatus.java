package com.gamebank.ledger.model;

/**
 * Detailed state of a token, for front-ends that want to tell the user
 * why a request cannot be paid. Redemption itself never distinguishes these.
 */
public enum PaymentRequestStatus {
    UNKNOWN,
    EXPIRED,
    USED,
    REDEEMABLE
}
