package com.gamebank.ledger.service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

final class Timestamps {

    private Timestamps() {
    }

    /**
     * Current UTC time at the store's precision (PostgreSQL keeps microseconds),
     * so a value written and read back compares equal.
     */
    static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.ofInstant(clock.instant().truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }
}
