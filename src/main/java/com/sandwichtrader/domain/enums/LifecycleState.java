package com.sandwichtrader.domain.enums;

/**
 * Lifecycle of one sandwich cycle.
 * Transitions: IDLE → ACTIVE → DEFENSE_1 → DEFENSE_2 → STRADDLE → CLOSED.
 * Any non-terminal state may jump straight to CLOSED (profit target or final expiry).
 * No state is ever revisited.
 */
public enum LifecycleState {
    IDLE,
    ACTIVE,
    DEFENSE_1,
    DEFENSE_2,
    STRADDLE,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }

    /** True while legs are open and monitor() has work to do. */
    public boolean isLive() {
        return this != IDLE && this != CLOSED;
    }

    /**
     * Returns true if {@code target} is a legal next state: the immediate successor,
     * or CLOSED from any state that already holds positions.
     */
    public boolean canTransitionTo(LifecycleState target) {
        if (isTerminal()) {
            return false;
        }
        if (target == CLOSED) {
            return this != IDLE;
        }
        return target.ordinal() == ordinal() + 1;
    }
}
