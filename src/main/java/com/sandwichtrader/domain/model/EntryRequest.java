package com.sandwichtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Optional overrides for an entry attempt. Every field may be null.
 *
 * <p>{@code force} bypasses the expiry-day and 15:00 time gate (backtests, manual entry).
 * Price overrides replace the market data lookups for the reference spot and future.
 * Expiry overrides replace the calendar lookups.
 */
@Data
@Builder
public class EntryRequest {

    private boolean force;
    private BigDecimal spotOverride;
    private BigDecimal futureOverride;
    private LocalDate currentExpiry;
    private LocalDate nextExpiry;

    public static EntryRequest scheduled() {
        return EntryRequest.builder().build();
    }
}
