package com.sandwichtrader.marketdata;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.exception.BrokerException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link MarketDataSource} lookups into the values the strategy consumes.
 *
 * <p>Lookups never throw: a {@link BrokerException} or an empty result is logged at WARN
 * and reported as empty. {@link #refresh} marks every open leg it can price and leaves the
 * rest at their previous price. The last spot seen is remembered so a monitor cycle with a
 * failed spot lookup can still run on the previous value.
 */
public class PricingAdapter {

    private static final Logger log = LoggerFactory.getLogger(PricingAdapter.class);

    private final MarketDataSource marketDataSource;
    private BigDecimal lastSpot;

    public PricingAdapter(MarketDataSource marketDataSource) {
        this.marketDataSource = marketDataSource;
    }

    public Optional<BigDecimal> spot() {
        Optional<BigDecimal> spot = lookup("spot", marketDataSource::getSpot);
        spot.ifPresent(value -> lastSpot = value);
        return spot;
    }

    /** Fresh spot if available, otherwise the last one seen (may be empty before the first lookup). */
    public Optional<BigDecimal> spotOrLast() {
        Optional<BigDecimal> spot = spot();
        return spot.isPresent() ? spot : Optional.ofNullable(lastSpot);
    }

    /** Last spot seen, without a new lookup. */
    public Optional<BigDecimal> lastSpot() {
        return Optional.ofNullable(lastSpot);
    }

    /** Records a spot obtained elsewhere (an entry override). */
    public void rememberSpot(BigDecimal spot) {
        if (spot != null) {
            lastSpot = spot;
        }
    }

    public Optional<BigDecimal> future(String symbol) {
        return lookup(symbol, () -> marketDataSource.getFuture(symbol));
    }

    public Optional<BigDecimal> option(String symbol, int strike, InstrumentType optionType) {
        return lookup(symbol, () -> marketDataSource.getOptionPrice(symbol, strike, optionType));
    }

    public Optional<BigDecimal> quote(String symbol, InstrumentType type, Integer strike) {
        if (type == InstrumentType.FUT) {
            return future(symbol);
        }
        return option(symbol, strike, type);
    }

    /**
     * Marks every open leg with a fresh quote.
     *
     * @return the number of legs that could not be priced
     */
    public int refresh(List<Leg> openLegs) {
        int missing = 0;
        for (Leg leg : openLegs) {
            Optional<BigDecimal> price = quote(leg.getTradingSymbol(), leg.getInstrumentType(), leg.getStrike());
            if (price.isPresent()) {
                leg.markPrice(price.get());
            } else {
                missing++;
                log.warn(
                        "Keeping last price {} for leg {} {}",
                        leg.getLastPrice(),
                        leg.getId(),
                        leg.getTradingSymbol());
            }
        }
        return missing;
    }

    private Optional<BigDecimal> lookup(String what, Supplier<Optional<BigDecimal>> call) {
        try {
            Optional<BigDecimal> price = call.get();
            if (price.isEmpty()) {
                log.warn("No price available for {}", what);
            }
            return price;
        } catch (BrokerException e) {
            log.warn("Price lookup for {} failed: {}", what, e.getMessage());
            return Optional.empty();
        }
    }
}
