package com.sandwichtrader.marketdata;

import com.sandwichtrader.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Deterministic prices for paper trading and backtests.
 *
 * <p>Spot is whatever was last set. Futures trade at {@code spot x (1 + carry)}. Options
 * are priced as intrinsic value against that future plus a flat time value. Any symbol
 * can be pinned to an explicit price with {@link #setPrice} or made to fail with
 * {@link #markUnavailable}.
 */
public class SyntheticMarketDataSource implements MarketDataSource {

    private final AtomicReference<BigDecimal> spot = new AtomicReference<>();
    private final Map<String, BigDecimal> pinnedPrices = new ConcurrentHashMap<>();
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();
    private final BigDecimal carry;
    private final BigDecimal timeValue;

    public SyntheticMarketDataSource(BigDecimal carry, BigDecimal timeValue) {
        this.carry = carry;
        this.timeValue = timeValue;
    }

    public void setSpot(BigDecimal value) {
        spot.set(value);
    }

    public void setPrice(String symbol, BigDecimal price) {
        pinnedPrices.put(symbol, price);
    }

    public void markUnavailable(String symbol) {
        unavailable.add(symbol);
    }

    public void markAvailable(String symbol) {
        unavailable.remove(symbol);
    }

    @Override
    public Optional<BigDecimal> getSpot() {
        return Optional.ofNullable(spot.get());
    }

    @Override
    public Optional<BigDecimal> getFuture(String symbol) {
        if (unavailable.contains(symbol)) {
            return Optional.empty();
        }
        BigDecimal pinned = pinnedPrices.get(symbol);
        if (pinned != null) {
            return Optional.of(pinned);
        }
        return getSpot().map(this::syntheticFuture);
    }

    @Override
    public Optional<BigDecimal> getOptionPrice(String symbol, int strike, InstrumentType optionType) {
        if (unavailable.contains(symbol)) {
            return Optional.empty();
        }
        BigDecimal pinned = pinnedPrices.get(symbol);
        if (pinned != null) {
            return Optional.of(pinned);
        }
        return getSpot().map(s -> intrinsic(syntheticFuture(s), strike, optionType).add(timeValue));
    }

    private BigDecimal syntheticFuture(BigDecimal spotValue) {
        return spotValue.multiply(BigDecimal.ONE.add(carry)).setScale(2, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal intrinsic(BigDecimal underlying, int strike, InstrumentType optionType) {
        BigDecimal k = BigDecimal.valueOf(strike);
        BigDecimal value = optionType == InstrumentType.CE ? underlying.subtract(k) : k.subtract(underlying);
        return value.max(BigDecimal.ZERO);
    }
}
