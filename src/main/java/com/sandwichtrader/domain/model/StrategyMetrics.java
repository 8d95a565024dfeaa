package com.sandwichtrader.domain.model;

import com.sandwichtrader.domain.enums.ExitReason;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time summary of a sandwich cycle, built by the MetricsAggregator.
 *
 * <p>{@code totalPnl} and {@code pnlPctOfCapital} only count open legs.
 * {@code realizedPnl} is what closed legs locked in. {@code netPnl} is the sum of the two
 * and {@code netPnlPct} is the figure the profit target compares against.
 * {@code netPnlConsistency} is long + short - total and is zero by construction.
 */
@Data
@Builder
public class StrategyMetrics {

    private LifecycleState state;
    private MonthType monthType;
    private int openLegCount;
    private int closedLegCount;
    private Map<LegRole, Integer> roleBreakdown;
    private BigDecimal totalPnl;
    private BigDecimal pnlPctOfCapital;
    private BigDecimal longPnl;
    private BigDecimal shortPnl;
    private BigDecimal netPnlConsistency;
    private BigDecimal realizedPnl;
    private BigDecimal netPnl;
    private BigDecimal netPnlPct;
    private long daysSinceEntry;
    private BigDecimal futureSpotBasis;
    private BigDecimal rallyPoints;
    private ExitReason exitReason;
}
