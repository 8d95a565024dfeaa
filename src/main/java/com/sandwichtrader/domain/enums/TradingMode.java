package com.sandwichtrader.domain.enums;

/**
 * Execution mode for the strategy.
 * LIVE sends real orders to Kite. PAPER simulates execution against synthetic prices.
 * HYBRID uses real Kite market data but simulated order execution.
 */
public enum TradingMode {
    LIVE,
    PAPER,
    HYBRID
}
