package com.gamebank.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TransactionKind {
    TRANSFER("transfer"),
    ADMIN_CREDIT("admin_credit"),
    ADMIN_DEBIT("admin_debit");

    private final String code;

    TransactionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static TransactionKind fromCode(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction kind: " + code));
    }
}
