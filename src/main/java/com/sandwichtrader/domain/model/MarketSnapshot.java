package com.sandwichtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time view of the underlying used by one monitor cycle.
 *
 * <p>Built by the strategy after refreshing leg prices, then passed to the adjustment
 * engine so every rule in the cycle sees the same spot and the same clock.
 */
@Data
@Builder
public class MarketSnapshot {

    /** Underlying spot price (BANKNIFTY index value). */
    private BigDecimal spotPrice;

    /** Aggregate P&L of open legs after the price refresh. */
    private BigDecimal totalPnl;

    /** Open P&L plus the realised P&L of every closed leg. */
    private BigDecimal netPnl;

    /** Net P&L as a percentage of configured capital. */
    private BigDecimal pnlPct;

    /** The cycle's clock. */
    private LocalDateTime timestamp;
}
