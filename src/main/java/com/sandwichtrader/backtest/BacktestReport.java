package com.sandwichtrader.backtest;

import com.sandwichtrader.domain.enums.AdjustmentType;
import com.sandwichtrader.domain.enums.ExitReason;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a sandwich backtest over a range of monthly expiries.
 *
 * <p>Only entered cycles count towards wins, win rate and averages. Cycles that could not
 * be entered (no spot known yet, future below spot) are listed in {@code skippedExpiries}.
 * Cycle P&L is in index points x lots: realised P&L of every closed leg plus the mark of any
 * leg still open when the cycle stopped.
 */
@Data
@Builder
public class BacktestReport {

    private LocalDate from;
    private LocalDate to;
    private int cycles;
    private int wins;
    private int losses;

    /** Percentage of entered cycles with positive P&L, 2 decimals. */
    private BigDecimal winRate;

    private BigDecimal totalPnl;
    private BigDecimal avgPnl;
    private BigDecimal bestCycle;
    private BigDecimal worstCycle;

    /** Largest peak-to-trough fall of cumulative P&L across cycles, in points. */
    private BigDecimal maxDrawdown;

    private List<CycleResult> results;
    private List<LocalDate> skippedExpiries;

    /** One monthly cycle, entered at {@code entryExpiry} and held towards {@code nextExpiry}. */
    @Data
    @Builder
    public static class CycleResult {

        private LocalDate entryExpiry;
        private LocalDate nextExpiry;
        private MonthType monthType;
        private BigDecimal entrySpot;
        private BigDecimal entryFuture;
        private LifecycleState finalState;
        private ExitReason exitReason;
        private LocalDate closedOn;
        private BigDecimal totalPnl;
        private BigDecimal pnlPct;
        private List<AdjustmentType> adjustments;
        private int failedOrders;
    }
}
