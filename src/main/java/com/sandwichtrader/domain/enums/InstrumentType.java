package com.sandwichtrader.domain.enums;

/**
 * Type of derivative contract traded on NFO.
 * Maps to Kite API's instrument_type field in the instruments dump.
 */
public enum InstrumentType {
    FUT,
    CE,
    PE;

    public boolean isOption() {
        return this != FUT;
    }
}
