package com.sandwichtrader.domain.enums;

/**
 * The scripted defensive adjustments, in the order they can be applied.
 * DEFENSE_1_ROLL rolls the core put and lifts the bread puts by the bread distance,
 * DEFENSE_2_SHIFT lifts the bread puts by the secondary shift, and
 * STRADDLE_CONVERSION moves the bread puts up to the short call strike.
 */
public enum AdjustmentType {
    DEFENSE_1_ROLL(LifecycleState.DEFENSE_1),
    DEFENSE_2_SHIFT(LifecycleState.DEFENSE_2),
    STRADDLE_CONVERSION(LifecycleState.STRADDLE);

    private final LifecycleState resultingState;

    AdjustmentType(LifecycleState resultingState) {
        this.resultingState = resultingState;
    }

    public LifecycleState getResultingState() {
        return resultingState;
    }
}
