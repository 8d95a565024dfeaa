package com.sandwichtrader.domain.enums;

/** Why a sandwich cycle was closed. Checked in this order on every monitor cycle. */
public enum ExitReason {
    PROFIT_TARGET,
    FINAL_EXPIRY
}
