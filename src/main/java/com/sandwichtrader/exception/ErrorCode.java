package com.sandwichtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    PAPER_MODE_ONLY("PAPER_MODE_ONLY", 400),
    INVALID_BACKTEST_WINDOW("INVALID_BACKTEST_WINDOW", 400),
    STRATEGY_STATE_CONFLICT("STRATEGY_STATE_CONFLICT", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BROKER_ERROR("BROKER_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
