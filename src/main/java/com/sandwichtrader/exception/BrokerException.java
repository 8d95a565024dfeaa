package com.sandwichtrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * An order or LTP call to Kite failed. Carries the instrument involved: the NFO trading
 * symbol for orders, the exchange-prefixed key for quotes.
 */
@Getter
public class BrokerException extends BaseException {

    private final String instrument;

    public BrokerException(String message, String instrument) {
        this(message, instrument, null);
    }

    public BrokerException(String message, String instrument, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, null, cause);
        this.instrument = instrument;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = super.getDetails();
        if (instrument != null) {
            details.put("instrument", instrument);
        }
        return details;
    }
}
