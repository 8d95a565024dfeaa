package com.sandwichtrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.domain.model.SandwichContext;
import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.strategy.sandwich.MetricsAggregator;
import com.sandwichtrader.strategy.sandwich.SandwichConfig;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

    private static final LocalDateTime ENTRY = LocalDateTime.of(2025, 10, 28, 15, 0);

    private MetricsAggregator metricsAggregator;
    private SandwichContext context;

    @BeforeEach
    void setUp() {
        metricsAggregator = new MetricsAggregator(SandwichConfig.builder().build());
        context = new SandwichContext();
        context.begin(
                ENTRY,
                new BigDecimal("45000"),
                new BigDecimal("45090"),
                MonthType.SHORT_CYCLE,
                LocalDate.of(2025, 10, 28),
                LocalDate.of(2025, 11, 25));
    }

    private static Leg leg(long id, LegRole role, String entry, String last) {
        Leg leg = Leg.builder()
                .id(id)
                .tradingSymbol(role.name())
                .instrumentType(role.getInstrumentType())
                .side(role.getSide())
                .quantity(role.getLots())
                .role(role)
                .openedAt(ENTRY)
                .build();
        leg.markPrice(new BigDecimal(entry));
        leg.markPrice(new BigDecimal(last));
        return leg;
    }

    @Test
    @DisplayName("Short legs gain when price falls, longs when it rises, scaled by lots")
    void signedPnl() {
        Leg shortFuture = leg(1, LegRole.CORE_FUTURE, "45090", "45000");
        Leg longCall = leg(2, LegRole.OUTER_CALL_LONG, "80", "100");

        assertThat(shortFuture.unrealizedPnl()).isEqualByComparingTo("90");
        assertThat(longCall.unrealizedPnl()).isEqualByComparingTo("40");
        assertThat(metricsAggregator.totalPnl(List.of(shortFuture, longCall))).isEqualByComparingTo("130");
    }

    @Test
    @DisplayName("Closed legs count only as realised P&L")
    void closedLegsExcludedFromTotal() {
        Leg open = leg(1, LegRole.CORE_CALL_LONG, "80", "130");
        Leg closed = leg(2, LegRole.OUTER_PUT_SHORT, "80", "200");
        closed.close(new BigDecimal("200"), ENTRY.plusDays(14));

        StrategyMetrics metrics = metricsAggregator.aggregate(
                context, List.of(open, closed), new BigDecimal("45500"), LocalDate.of(2025, 11, 11));

        assertThat(metrics.getTotalPnl()).isEqualByComparingTo("50");
        assertThat(metrics.getRealizedPnl()).isEqualByComparingTo("-240");
        assertThat(metrics.getNetPnl()).isEqualByComparingTo("-190");
        assertThat(metrics.getNetPnlPct()).isEqualByComparingTo("-0.019");
        assertThat(metricsAggregator.netPnl(List.of(open, closed))).isEqualByComparingTo("-190");
        assertThat(metrics.getOpenLegCount()).isEqualTo(1);
        assertThat(metrics.getClosedLegCount()).isEqualTo(1);
        assertThat(metrics.getRoleBreakdown()).containsOnlyKeys(LegRole.CORE_CALL_LONG);
    }

    @Test
    @DisplayName("Long + short equals total, and the consistency check is zero")
    void longShortSplit() {
        List<Leg> legs = List.of(
                leg(1, LegRole.CORE_FUTURE, "45090", "45590"),
                leg(2, LegRole.CORE_CALL_LONG, "80", "300"),
                leg(3, LegRole.OUTER_CALL_SHORT, "80", "60"));

        StrategyMetrics metrics =
                metricsAggregator.aggregate(context, legs, new BigDecimal("45500"), LocalDate.of(2025, 11, 11));

        assertThat(metrics.getLongPnl()).isEqualByComparingTo("220");
        assertThat(metrics.getShortPnl()).isEqualByComparingTo("-460");
        assertThat(metrics.getTotalPnl()).isEqualByComparingTo("-240");
        assertThat(metrics.getNetPnlConsistency()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Reports basis, rally, days since entry and P&L % of capital")
    void derivedFields() {
        List<Leg> legs = List.of(leg(1, LegRole.CORE_CALL_LONG, "80", "5080"));

        StrategyMetrics metrics =
                metricsAggregator.aggregate(context, legs, new BigDecimal("46600"), LocalDate.of(2025, 11, 11));

        assertThat(metrics.getState()).isEqualTo(LifecycleState.ACTIVE);
        assertThat(metrics.getMonthType()).isEqualTo(MonthType.SHORT_CYCLE);
        assertThat(metrics.getFutureSpotBasis()).isEqualByComparingTo("90");
        assertThat(metrics.getRallyPoints()).isEqualByComparingTo("1600");
        assertThat(metrics.getDaysSinceEntry()).isEqualTo(14);
        assertThat(metrics.getPnlPctOfCapital()).isEqualByComparingTo("0.5");
    }

    @Test
    @DisplayName("Leg without an entry price contributes nothing")
    void pendingEntryContributesZero() {
        Leg pending = Leg.builder()
                .id(1)
                .role(LegRole.OUTER_CALL_SHORT)
                .side(LegRole.OUTER_CALL_SHORT.getSide())
                .quantity(2)
                .build();

        assertThat(metricsAggregator.totalPnl(List.of(pending))).isEqualByComparingTo("0");
    }
}
