package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.domain.model.SandwichContext;
import com.sandwichtrader.domain.model.StrategyMetrics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * P&L and position statistics over the leg book.
 *
 * <p>Only open legs count towards total, long and short P&L. Closed legs show up in the
 * closed count and in realised P&L. Net P&L is total plus realised: it is what the
 * profit target is measured on, since every defense books the legs it replaces.
 */
public class MetricsAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SandwichConfig config;

    public MetricsAggregator(SandwichConfig config) {
        this.config = config;
    }

    public BigDecimal totalPnl(List<Leg> legs) {
        return legs.stream()
                .filter(Leg::isOpen)
                .map(Leg::unrealizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal realizedPnl(List<Leg> legs) {
        return legs.stream()
                .filter(leg -> !leg.isOpen())
                .map(Leg::realizedPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Open plus closed legs: unrealised P&L of what is held and what the closes locked in. */
    public BigDecimal netPnl(List<Leg> legs) {
        return totalPnl(legs).add(realizedPnl(legs));
    }

    /** A P&L amount as a percentage of capital, 4 decimals. */
    public BigDecimal pnlPct(BigDecimal pnl) {
        return pnl.multiply(HUNDRED).divide(config.getCapital(), 4, RoundingMode.HALF_EVEN);
    }

    public StrategyMetrics aggregate(
            SandwichContext context, List<Leg> legs, BigDecimal spot, LocalDate today) {
        BigDecimal longPnl = BigDecimal.ZERO;
        BigDecimal shortPnl = BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;
        int open = 0;
        int closed = 0;
        Map<LegRole, Integer> breakdown = new EnumMap<>(LegRole.class);

        for (Leg leg : legs) {
            if (leg.isOpen()) {
                open++;
                breakdown.merge(leg.getRole(), 1, Integer::sum);
                if (leg.isLong()) {
                    longPnl = longPnl.add(leg.unrealizedPnl());
                } else {
                    shortPnl = shortPnl.add(leg.unrealizedPnl());
                }
            } else {
                closed++;
                realized = realized.add(leg.realizedPnl());
            }
        }

        BigDecimal total = totalPnl(legs);
        BigDecimal basis = context.getReferenceFuture() != null && context.getReferenceSpot() != null
                ? context.getReferenceFuture().subtract(context.getReferenceSpot())
                : null;
        BigDecimal rally = spot != null && context.getReferenceSpot() != null
                ? spot.subtract(context.getReferenceSpot())
                : null;

        return StrategyMetrics.builder()
                .state(context.getState())
                .monthType(context.getMonthType())
                .openLegCount(open)
                .closedLegCount(closed)
                .roleBreakdown(breakdown)
                .totalPnl(total)
                .pnlPctOfCapital(pnlPct(total))
                .longPnl(longPnl)
                .shortPnl(shortPnl)
                .netPnlConsistency(longPnl.add(shortPnl).subtract(total))
                .realizedPnl(realized)
                .netPnl(total.add(realized))
                .netPnlPct(pnlPct(total.add(realized)))
                .daysSinceEntry(context.daysSinceEntry(today))
                .futureSpotBasis(basis)
                .rallyPoints(rally)
                .exitReason(context.getExitReason())
                .build();
    }
}
