package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.AdjustmentType;
import com.sandwichtrader.domain.enums.ExitReason;
import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.domain.model.MarketSnapshot;
import com.sandwichtrader.domain.model.SandwichContext;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exit checks and the three scripted defenses.
 *
 * <p>Each monitor cycle is evaluated in a fixed order and stops at the first rule that fires:
 * <ol>
 *   <li>Profit target: net P&L (open plus realised) as % of capital at or above the
 *       target closes everything</li>
 *   <li>Final expiry: on the next expiry date inside the exit window, close everything</li>
 *   <li>At most one adjustment per calendar day</li>
 *   <li>The single rule for the current state (ACTIVE, DEFENSE_1 or DEFENSE_2)</li>
 * </ol>
 *
 * <p>Every adjustment closes the open legs of a role before opening their replacement, so a
 * role never has two open legs.
 */
public class AdjustmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AdjustmentEngine.class);

    private final SandwichConfig config;
    private final StrikeResolver strikeResolver;
    private final LegBook legBook;
    private final LegExecutor legExecutor;
    private final DecisionJournal journal;

    public AdjustmentEngine(
            SandwichConfig config,
            StrikeResolver strikeResolver,
            LegBook legBook,
            LegExecutor legExecutor,
            DecisionJournal journal) {
        this.config = config;
        this.strikeResolver = strikeResolver;
        this.legBook = legBook;
        this.legExecutor = legExecutor;
        this.journal = journal;
    }

    /** What a monitor cycle did. At most one of the two fields is set. */
    public record Outcome(ExitReason exitReason, AdjustmentType adjustment) {

        static final Outcome NONE = new Outcome(null, null);

        public boolean exited() {
            return exitReason != null;
        }

        public boolean adjusted() {
            return adjustment != null;
        }
    }

    /**
     * Runs the rules for one cycle and applies whatever fires, updating the context.
     * A context that is not live (IDLE or CLOSED) is left untouched.
     */
    public Outcome evaluate(SandwichContext context, MarketSnapshot snapshot) {
        if (!context.getState().isLive()) {
            return Outcome.NONE;
        }
        LocalDateTime now = snapshot.getTimestamp();
        LocalDate today = now.toLocalDate();

        // ========================
        // EXITS
        // ========================

        if (snapshot.getPnlPct().compareTo(config.profitTargetPercent()) >= 0) {
            journal.decision(
                    "EXIT",
                    "Profit target reached: " + snapshot.getPnlPct().stripTrailingZeros().toPlainString() + "% >= "
                            + config.profitTargetPercent().stripTrailingZeros().toPlainString() + "%",
                    Map.of("netPnl", snapshot.getNetPnl(), "pnlPct", snapshot.getPnlPct()),
                    now);
            return exit(context, ExitReason.PROFIT_TARGET, now);
        }

        if (today.equals(context.getNextExpiry())
                && config.isWithinTolerance(now.toLocalTime(), config.getExitTime())) {
            journal.decision(
                    "EXIT",
                    "Final expiry " + context.getNextExpiry() + " reached",
                    Map.of("totalPnl", snapshot.getTotalPnl()),
                    now);
            return exit(context, ExitReason.FINAL_EXPIRY, now);
        }

        // ========================
        // ADJUSTMENTS
        // ========================

        if (context.adjustedOn(today)) {
            log.debug("Already adjusted on {}, skipping rules", today);
            return Outcome.NONE;
        }

        BigDecimal spot = snapshot.getSpotPrice();
        if (spot == null) {
            log.warn("No spot price for {}, skipping adjustment rules", now);
            return Outcome.NONE;
        }

        return switch (context.getState()) {
            case ACTIVE -> shouldApplyDefense1(context, snapshot)
                    ? applyDefense1(context, snapshot)
                    : Outcome.NONE;
            case DEFENSE_1 -> shouldApplyDefense2(context, spot, today)
                    ? applyDefense2(context, snapshot)
                    : Outcome.NONE;
            case DEFENSE_2 -> shouldConvertToStraddle(context, spot, today)
                    ? applyStraddleConversion(context, snapshot)
                    : Outcome.NONE;
            default -> Outcome.NONE;
        };
    }

    // ========================
    // RULES
    // ========================

    boolean shouldApplyDefense1(SandwichContext context, MarketSnapshot snapshot) {
        LocalDate today = snapshot.getTimestamp().toLocalDate();
        if (context.daysSinceEntry(today) < config.passiveDays(context.getMonthType())) {
            return false;
        }
        if (snapshot.getTotalPnl().signum() >= 0) {
            return false;
        }
        BigDecimal rally = snapshot.getSpotPrice().subtract(context.getReferenceSpot());
        return rally.compareTo(BigDecimal.valueOf(config.rallyThreshold(context.getMonthType()))) >= 0;
    }

    boolean shouldApplyDefense2(SandwichContext context, BigDecimal spot, LocalDate today) {
        if (context.daysSinceLastAdjustment(today) < config.getDefense2MinDays()) {
            return false;
        }
        Optional<Leg> outerPutShort = legBook.findOpen(LegRole.OUTER_PUT_SHORT);
        if (outerPutShort.isEmpty()) {
            return false;
        }
        BigDecimal trigger = BigDecimal.valueOf((long) outerPutShort.get().getStrike() + config.getDefense2Buffer());
        return spot.compareTo(trigger) > 0;
    }

    boolean shouldConvertToStraddle(SandwichContext context, BigDecimal spot, LocalDate today) {
        if (today.getDayOfWeek() != DayOfWeek.MONDAY) {
            return false;
        }
        long daysToExpiry = ChronoUnit.DAYS.between(today, context.getNextExpiry());
        if (daysToExpiry < 0 || daysToExpiry > config.getStraddleWindowDays()) {
            return false;
        }
        return legBook.findOpen(LegRole.OUTER_CALL_SHORT)
                .map(call -> spot.compareTo(BigDecimal.valueOf(call.getStrike())) > 0)
                .orElse(false);
    }

    // ========================
    // ACTIONS
    // ========================

    private Outcome applyDefense1(SandwichContext context, MarketSnapshot snapshot) {
        LocalDateTime now = snapshot.getTimestamp();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalPnl", snapshot.getTotalPnl());
        details.put("rally", snapshot.getSpotPrice().subtract(context.getReferenceSpot()));

        Optional<Leg> corePut = legBook.findOpen(LegRole.CORE_PUT_SHORT);
        if (corePut.isPresent()) {
            int oldStrike = corePut.get().getStrike();
            int target = strikeResolver.roundToStrike(context.getReferenceFuture());
            int shift = selectRollShift(oldStrike, target, config.getCorePutRollCandidates());
            int newStrike = strikeResolver.roundToStrike((long) oldStrike + shift);
            legExecutor.close(corePut.get(), now);
            openOption(LegRole.CORE_PUT_SHORT, newStrike, context, now);
            details.put("corePutRoll", oldStrike + " -> " + newStrike);
        } else {
            log.warn("Defense 1 without an open core short put, rolling bread puts only");
        }

        String outerShift = shiftOuterPuts(config.breadDistance(context.getMonthType()), context, now);
        details.put("outerPutShift", outerShift);

        return adjusted(context, AdjustmentType.DEFENSE_1_ROLL, "Defense 1 applied", details, now);
    }

    private Outcome applyDefense2(SandwichContext context, MarketSnapshot snapshot) {
        LocalDateTime now = snapshot.getTimestamp();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("spot", snapshot.getSpotPrice());
        details.put("outerPutShift", shiftOuterPuts(config.getSecondaryPutShift(), context, now));
        return adjusted(context, AdjustmentType.DEFENSE_2_SHIFT, "Defense 2 applied", details, now);
    }

    private Outcome applyStraddleConversion(SandwichContext context, MarketSnapshot snapshot) {
        LocalDateTime now = snapshot.getTimestamp();
        int callStrike = legBook.findOpen(LegRole.OUTER_CALL_SHORT).orElseThrow().getStrike();
        int longPut = strikeResolver.roundToStrike((long) callStrike - config.getHedgeOffset());

        legExecutor.closeRole(LegRole.OUTER_PUT_SHORT, now);
        legExecutor.closeRole(LegRole.OUTER_PUT_LONG, now);
        openOption(LegRole.OUTER_PUT_SHORT, callStrike, context, now);
        openOption(LegRole.OUTER_PUT_LONG, longPut, context, now);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("spot", snapshot.getSpotPrice());
        details.put("straddleStrike", callStrike);
        details.put("longPut", longPut);
        return adjusted(context, AdjustmentType.STRADDLE_CONVERSION, "Converted to short straddle", details, now);
    }

    /**
     * Moves the bread puts up by {@code distance} from the currently open short put.
     *
     * @return "old -> new" short strike, for the decision log
     */
    private String shiftOuterPuts(int distance, SandwichContext context, LocalDateTime now) {
        Optional<Leg> shortPut = legBook.findOpen(LegRole.OUTER_PUT_SHORT);
        if (shortPut.isEmpty()) {
            log.warn("No open outer short put to shift");
            return "none";
        }
        int oldShort = shortPut.get().getStrike();
        int newShort = strikeResolver.roundToStrike((long) oldShort + distance);
        int newLong = strikeResolver.roundToStrike((long) newShort - config.getHedgeOffset());

        legExecutor.close(shortPut.get(), now);
        legExecutor.closeRole(LegRole.OUTER_PUT_LONG, now);
        openOption(LegRole.OUTER_PUT_SHORT, newShort, context, now);
        openOption(LegRole.OUTER_PUT_LONG, newLong, context, now);
        return oldShort + " -> " + newShort;
    }

    /**
     * Picks the candidate roll that lands the strike nearest {@code target}.
     * Ties go to the candidate listed first.
     */
    public static int selectRollShift(int strike, int target, List<Integer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No core put roll candidates configured");
        }
        int best = candidates.get(0);
        long bestDistance = Math.abs((long) strike + best - target);
        for (int candidate : candidates) {
            long distance = Math.abs((long) strike + candidate - target);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    private void openOption(LegRole role, int strike, SandwichContext context, LocalDateTime now) {
        InstrumentType type = role.getInstrumentType();
        legExecutor.open(role, strikeResolver.optionSymbol(strike, type, context.getNextExpiry()), strike, now);
    }

    private Outcome exit(SandwichContext context, ExitReason reason, LocalDateTime now) {
        legExecutor.closeAll(now);
        context.close(reason);
        log.info("Sandwich closed: {}", reason);
        return new Outcome(reason, null);
    }

    private Outcome adjusted(
            SandwichContext context,
            AdjustmentType type,
            String message,
            Map<String, Object> details,
            LocalDateTime now) {
        LifecycleState previous = context.getState();
        context.transitionTo(type.getResultingState());
        context.recordAdjustment(now.toLocalDate());
        journal.decision("ADJUSTMENT", message + ": " + previous + " -> " + context.getState(), details, now);
        return new Outcome(null, type);
    }
}
