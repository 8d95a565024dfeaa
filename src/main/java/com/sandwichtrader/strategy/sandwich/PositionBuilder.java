package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.model.Leg;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the initial seven-leg sandwich.
 *
 * <p>Core strikes are measured from the future, bread strikes from spot:
 * <pre>
 *   coreCall      = round(F0 + callOffset)        coreShortPut  = round(F0 - callOffset)
 *   outerCallShort = round(S0 + D)                outerCallLong = round(outerCallShort + hedge)
 *   outerPutShort  = round(S0 - D)                outerPutLong  = round(outerPutShort - hedge)
 * </pre>
 * Legs are opened in role order, future first. The future is sold at the reference
 * future price; options take their current quote.
 */
public class PositionBuilder {

    private final SandwichConfig config;
    private final StrikeResolver strikeResolver;
    private final LegExecutor legExecutor;

    public PositionBuilder(SandwichConfig config, StrikeResolver strikeResolver, LegExecutor legExecutor) {
        this.config = config;
        this.strikeResolver = strikeResolver;
        this.legExecutor = legExecutor;
    }

    /** Strikes of the initial structure, before any order is placed. */
    public record StrikeLadder(
            int coreCallLong,
            int corePutShort,
            int outerCallShort,
            int outerCallLong,
            int outerPutShort,
            int outerPutLong) {}

    public StrikeLadder ladder(BigDecimal spot, BigDecimal future, MonthType monthType) {
        int distance = config.breadDistance(monthType);
        int outerCallShort = strikeResolver.roundToStrike(spot.add(BigDecimal.valueOf(distance)));
        int outerPutShort = strikeResolver.roundToStrike(spot.subtract(BigDecimal.valueOf(distance)));
        return new StrikeLadder(
                strikeResolver.roundToStrike(future.add(BigDecimal.valueOf(config.getCallOffset()))),
                strikeResolver.roundToStrike(future.subtract(BigDecimal.valueOf(config.getCallOffset()))),
                outerCallShort,
                strikeResolver.roundToStrike((long) outerCallShort + config.getHedgeOffset()),
                outerPutShort,
                strikeResolver.roundToStrike((long) outerPutShort - config.getHedgeOffset()));
    }

    /**
     * Opens the seven legs against {@code instrumentExpiry} (the next monthly expiry).
     *
     * @return the opened legs in the order they were placed
     */
    public List<Leg> build(
            BigDecimal spot, BigDecimal future, MonthType monthType, LocalDate instrumentExpiry, LocalDateTime at) {
        StrikeLadder ladder = ladder(spot, future, monthType);
        List<Leg> legs = new ArrayList<>(7);
        legs.add(legExecutor.open(LegRole.CORE_FUTURE, strikeResolver.futureSymbol(instrumentExpiry), null, future, at));
        legs.add(openOption(LegRole.CORE_CALL_LONG, ladder.coreCallLong(), instrumentExpiry, at));
        legs.add(openOption(LegRole.CORE_PUT_SHORT, ladder.corePutShort(), instrumentExpiry, at));
        legs.add(openOption(LegRole.OUTER_CALL_SHORT, ladder.outerCallShort(), instrumentExpiry, at));
        legs.add(openOption(LegRole.OUTER_CALL_LONG, ladder.outerCallLong(), instrumentExpiry, at));
        legs.add(openOption(LegRole.OUTER_PUT_SHORT, ladder.outerPutShort(), instrumentExpiry, at));
        legs.add(openOption(LegRole.OUTER_PUT_LONG, ladder.outerPutLong(), instrumentExpiry, at));
        return legs;
    }

    Leg openOption(LegRole role, int strike, LocalDate expiry, LocalDateTime at) {
        InstrumentType type = role.getInstrumentType();
        return legExecutor.open(role, strikeResolver.optionSymbol(strike, type, expiry), strike, at);
    }
}
