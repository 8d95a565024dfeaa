package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Maps price levels to strikes and strikes to NFO trading symbols.
 *
 * <p>Rounding is half-even to the strike interval: 45050 -> 45000, 45150 -> 45200.
 * Every strike the strategy computes goes through {@link #roundToStrike}, so the same
 * inputs always produce the same ladder. Strikes are ints, so prices are accepted up to
 * {@link #MAX_PRICE} in magnitude; entry rejects anything outside that range before a
 * strike is computed.
 *
 * <p>Symbols follow the NSE monthly contract format:
 * {@code BANKNIFTY25OCTFUT}, {@code BANKNIFTY25OCT45600CE}.
 */
public class StrikeResolver {

    /** Largest price magnitude a strike is derived from. Leaves room for every ladder offset. */
    public static final BigDecimal MAX_PRICE = BigDecimal.valueOf(1_000_000_000L);

    private static final DateTimeFormatter MONTHLY_CODE = DateTimeFormatter.ofPattern("yyMMM", Locale.ENGLISH);

    private final String underlying;
    private final BigDecimal interval;

    public StrikeResolver(String underlying, int strikeInterval) {
        if (strikeInterval <= 0) {
            throw new IllegalArgumentException("Strike interval must be positive: " + strikeInterval);
        }
        this.underlying = underlying;
        this.interval = BigDecimal.valueOf(strikeInterval);
    }

    public boolean inRange(BigDecimal price) {
        return price.abs().compareTo(MAX_PRICE) <= 0;
    }

    /**
     * Rounds a price to the nearest strike. Example: roundToStrike(45590) = 45600.
     *
     * @throws IllegalArgumentException if the strike does not fit an int
     */
    public int roundToStrike(BigDecimal price) {
        BigDecimal strike = price.divide(interval, 0, RoundingMode.HALF_EVEN).multiply(interval);
        if (strike.abs().compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            throw new IllegalArgumentException("Price " + price.toPlainString() + " is outside the strike range");
        }
        return strike.intValue();
    }

    public int roundToStrike(long price) {
        return roundToStrike(BigDecimal.valueOf(price));
    }

    public String futureSymbol(LocalDate expiry) {
        return underlying + monthlyCode(expiry) + InstrumentType.FUT.name();
    }

    public String optionSymbol(int strike, InstrumentType optionType, LocalDate expiry) {
        if (!optionType.isOption()) {
            throw new IllegalArgumentException("Not an option type: " + optionType);
        }
        return underlying + monthlyCode(expiry) + strike + optionType.name();
    }

    private String monthlyCode(LocalDate expiry) {
        return expiry.format(MONTHLY_CODE).toUpperCase(Locale.ENGLISH);
    }
}
