package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for the sandwich strategy.
 *
 * <p>Bound from the {@code sandwich.*} prefix in application.yml. Every field has a
 * default matching the strategy rules, so tests can build one with
 * {@code SandwichConfig.builder().build()} and override only what they exercise.
 *
 * <p>Distances come in pairs: the SHORT_CYCLE value applies to four-week months, the
 * LONG_CYCLE value to five-week months (see {@link MonthType}).
 *
 * <p><b>Strike layout example (spot 45000, future 45090, short cycle):</b>
 * <pre>
 *   Buy PE 42500 | Sell PE 43000 | Sell PE 44600 | F 45090 | Buy CE 45600 | Sell CE 47000 | Buy CE 47500
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandwichConfig {

    /** Root underlying symbol used for instrument names. */
    @Builder.Default
    private String underlying = "BANKNIFTY";

    /** Kite instrument key of the spot index, used by the LIVE market data source. */
    @Builder.Default
    private String spotInstrument = "NSE:NIFTY BANK";

    @Builder.Default
    private TradingMode tradingMode = TradingMode.PAPER;

    /** Exchange time zone; the strategy clock runs in it. */
    @Builder.Default
    private String timezone = "Asia/Kolkata";

    /** Starting spot for the synthetic market in PAPER mode. Null leaves spot unset until supplied. */
    private BigDecimal paperSpot;

    /** Strike grid. BANKNIFTY: 100. */
    @Builder.Default
    private int strikeInterval = 100;

    /** Exchange lot size; order quantity = lots x lotSize. */
    @Builder.Default
    private int lotSize = 35;

    /** Capital the P&L percentage is measured against. */
    @Builder.Default
    private BigDecimal capital = new BigDecimal("1000000");

    /** Fraction of capital at which everything is closed. 0.12 = 12%. */
    @Builder.Default
    private BigDecimal profitTargetPct = new BigDecimal("0.12");

    /** Points from the future price to the core call (above) and core put (below). */
    @Builder.Default
    private int callOffset = 500;

    /** Points between each short bread option and its protective long. */
    @Builder.Default
    private int hedgeOffset = 500;

    @Builder.Default
    private int breadDistanceShortCycle = 2000;

    @Builder.Default
    private int breadDistanceLongCycle = 2500;

    /** Spot rally from the entry spot that arms the first defense. */
    @Builder.Default
    private int rallyThresholdShortCycle = 1500;

    @Builder.Default
    private int rallyThresholdLongCycle = 2000;

    /** Weeks after entry during which no defense is considered. */
    @Builder.Default
    private int passiveWeeksShortCycle = 2;

    @Builder.Default
    private int passiveWeeksLongCycle = 3;

    /** Candidate upward rolls for the core short put; the one landing nearest the entry future wins. */
    @Builder.Default
    private List<Integer> corePutRollCandidates = new ArrayList<>(List.of(400, 500, 600));

    /** Additional upward shift of the bread puts in the second defense. */
    @Builder.Default
    private int secondaryPutShift = 1000;

    /** Minimum calendar days between the first and second defense. */
    @Builder.Default
    private int defense2MinDays = 4;

    /** Spot must sit this far above the bread short put for the second defense. */
    @Builder.Default
    private int defense2Buffer = 250;

    /** Straddle conversion only runs on a Monday at most this many days before expiry. */
    @Builder.Default
    private int straddleWindowDays = 4;

    /** Time of day at which entry and the final-expiry exit happen (IST). */
    @Builder.Default
    private LocalTime entryTime = LocalTime.of(15, 0);

    @Builder.Default
    private LocalTime exitTime = LocalTime.of(15, 0);

    /** Minutes either side of entryTime / exitTime that still count. */
    @Builder.Default
    private int timeToleranceMinutes = 5;

    /** Carry applied to spot by the synthetic future price: 0.002 = 0.2%. */
    @Builder.Default
    private BigDecimal syntheticCarry = new BigDecimal("0.002");

    /** Flat time value the synthetic option price adds to intrinsic value. */
    @Builder.Default
    private BigDecimal syntheticTimeValue = new BigDecimal("80");

    public int breadDistance(MonthType monthType) {
        return monthType == MonthType.LONG_CYCLE ? breadDistanceLongCycle : breadDistanceShortCycle;
    }

    public int rallyThreshold(MonthType monthType) {
        return monthType == MonthType.LONG_CYCLE ? rallyThresholdLongCycle : rallyThresholdShortCycle;
    }

    public int passiveDays(MonthType monthType) {
        int weeks = monthType == MonthType.LONG_CYCLE ? passiveWeeksLongCycle : passiveWeeksShortCycle;
        return weeks * 7;
    }

    /** True if {@code actual} is within the tolerance either side of {@code target}. */
    public boolean isWithinTolerance(LocalTime actual, LocalTime target) {
        long seconds = Math.abs(Duration.between(target, actual).getSeconds());
        return seconds <= timeToleranceMinutes * 60L;
    }

    /** Profit target as a percentage value comparable to pnlPct (0.12 -> 12). */
    public BigDecimal profitTargetPercent() {
        return profitTargetPct.multiply(BigDecimal.valueOf(100));
    }
}
