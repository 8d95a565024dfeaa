package com.sandwichtrader.exception;

import com.sandwichtrader.domain.enums.LifecycleState;

/** The sandwich is in a lifecycle state that does not allow the requested operation. */
public class StrategyStateException extends BaseException {

    public StrategyStateException(String message, LifecycleState state) {
        super(ErrorCode.STRATEGY_STATE_CONFLICT, message, state, null);
    }
}
