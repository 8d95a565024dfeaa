package com.sandwichtrader.event;

/**
 * Classifies the lifecycle moment that produced a {@link StrategyEvent}.
 */
public enum StrategyEventType {

    /** The seven initial legs were placed; state is now ACTIVE. */
    ENTERED,

    /** An entry attempt was aborted (gate closed, prices missing, future below spot). */
    ENTRY_REJECTED,

    /** A scripted defense was applied. */
    ADJUSTED,

    /** Every open leg was closed (profit target or final expiry). */
    CLOSED,

    /** An order was rejected or the broker call failed; the leg was recorded anyway. */
    ORDER_FAILED
}
