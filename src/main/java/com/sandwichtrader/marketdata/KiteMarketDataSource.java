package com.sandwichtrader.marketdata;

import com.sandwichtrader.domain.enums.InstrumentType;
import com.sandwichtrader.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.LTPQuote;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last traded prices from Kite Connect's LTP endpoint.
 *
 * <p>The spot index is looked up by its NSE key (e.g. {@code NSE:NIFTY BANK}); futures and
 * options by {@code NFO:<tradingsymbol>}. A symbol missing from the response is empty;
 * a failed call is a {@link BrokerException}.
 */
public class KiteMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(KiteMarketDataSource.class);

    private static final String NFO_PREFIX = "NFO:";

    private final KiteConnect kiteConnect;
    private final String spotInstrument;

    public KiteMarketDataSource(KiteConnect kiteConnect, String spotInstrument) {
        this.kiteConnect = kiteConnect;
        this.spotInstrument = spotInstrument;
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    public Optional<BigDecimal> getSpot() {
        return lastPrice(spotInstrument);
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    public Optional<BigDecimal> getFuture(String symbol) {
        return lastPrice(NFO_PREFIX + symbol);
    }

    @Override
    @CircuitBreaker(name = "kiteApi")
    public Optional<BigDecimal> getOptionPrice(String symbol, int strike, InstrumentType optionType) {
        return lastPrice(NFO_PREFIX + symbol);
    }

    private Optional<BigDecimal> lastPrice(String instrumentKey) {
        try {
            Map<String, LTPQuote> quotes = kiteConnect.getLTP(new String[] {instrumentKey});
            LTPQuote quote = quotes.get(instrumentKey);
            if (quote == null) {
                log.debug("No LTP returned for {}", instrumentKey);
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(quote.lastPrice));
        } catch (KiteException e) {
            log.error("Kite LTP lookup failed for {}: {}", instrumentKey, e.message);
            throw new BrokerException("LTP lookup failed: " + e.message, instrumentKey, e);
        } catch (JSONException | IOException e) {
            log.error("LTP lookup error for {}", instrumentKey, e);
            throw new BrokerException("LTP lookup error: " + e.getMessage(), instrumentKey, e);
        }
    }
}
