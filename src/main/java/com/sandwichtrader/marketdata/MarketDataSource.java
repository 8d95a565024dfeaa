package com.sandwichtrader.marketdata;

import com.sandwichtrader.domain.enums.InstrumentType;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Price lookups the strategy needs. An empty result means "no price right now"; the
 * caller keeps whatever it saw last.
 *
 * <p>Implementations may throw {@link com.sandwichtrader.exception.BrokerException} when
 * the upstream call fails; {@link PricingAdapter} treats that the same as empty.
 */
public interface MarketDataSource {

    /** Current value of the underlying index. */
    Optional<BigDecimal> getSpot();

    /** Last traded price of a futures contract, by trading symbol. */
    Optional<BigDecimal> getFuture(String symbol);

    /** Last traded price of an option contract. */
    Optional<BigDecimal> getOptionPrice(String symbol, int strike, InstrumentType optionType);
}
