package com.sandwichtrader.domain.enums;

/** Buy or sell side of an order. Maps to Kite API's transaction_type field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for closing orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** P&L direction: +1 for a long (bought) leg, -1 for a short (sold) leg. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
