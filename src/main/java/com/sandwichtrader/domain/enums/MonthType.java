package com.sandwichtrader.domain.enums;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Expiry cycle length. A cycle whose next monthly expiry is more than 28 days after
 * the current one is a LONG_CYCLE (five-week month); anything else is SHORT_CYCLE.
 * Distances, rally thresholds and the passive window all scale with the cycle.
 */
public enum MonthType {
    SHORT_CYCLE,
    LONG_CYCLE;

    static final long SHORT_CYCLE_MAX_DAYS = 28;

    public static MonthType classify(LocalDate currentExpiry, LocalDate nextExpiry) {
        long gapDays = ChronoUnit.DAYS.between(currentExpiry, nextExpiry);
        return gapDays > SHORT_CYCLE_MAX_DAYS ? LONG_CYCLE : SHORT_CYCLE;
    }
}
