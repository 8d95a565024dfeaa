package com.sandwichtrader.domain.model;

import com.sandwichtrader.domain.enums.ExitReason;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import lombok.Getter;
import lombok.ToString;

/**
 * State of one sandwich cycle: the reference prices captured at entry, the expiry
 * cycle, and where the cycle is in its lifecycle.
 *
 * <p>Reference spot/future, month type and expiries are written once by
 * {@link #begin} and never change afterwards. The lifecycle state only moves through
 * {@link #transitionTo}, which rejects anything {@link LifecycleState#canTransitionTo}
 * does not allow.
 */
@Getter
@ToString
public class SandwichContext {

    private LifecycleState state = LifecycleState.IDLE;

    private LocalDateTime entryTime;
    private BigDecimal referenceSpot;
    private BigDecimal referenceFuture;
    private MonthType monthType;
    private LocalDate currentExpiry;
    private LocalDate nextExpiry;

    private LocalDate lastAdjustmentDate;
    private ExitReason exitReason;

    /**
     * Captures the entry snapshot and moves IDLE → ACTIVE.
     *
     * @throws IllegalStateException if the cycle has already been entered
     */
    public void begin(
            LocalDateTime entryTime,
            BigDecimal referenceSpot,
            BigDecimal referenceFuture,
            MonthType monthType,
            LocalDate currentExpiry,
            LocalDate nextExpiry) {
        if (state != LifecycleState.IDLE) {
            throw new IllegalStateException("Cycle already entered, state=" + state);
        }
        this.entryTime = entryTime;
        this.referenceSpot = referenceSpot;
        this.referenceFuture = referenceFuture;
        this.monthType = monthType;
        this.currentExpiry = currentExpiry;
        this.nextExpiry = nextExpiry;
        transitionTo(LifecycleState.ACTIVE);
    }

    /**
     * @throws IllegalStateException on a backwards, skipping or post-CLOSED transition
     */
    public void transitionTo(LifecycleState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + target);
        }
        this.state = target;
    }

    public void recordAdjustment(LocalDate date) {
        this.lastAdjustmentDate = date;
    }

    public void close(ExitReason reason) {
        transitionTo(LifecycleState.CLOSED);
        this.exitReason = reason;
    }

    /** True if an adjustment was already applied on {@code date}. */
    public boolean adjustedOn(LocalDate date) {
        return lastAdjustmentDate != null && lastAdjustmentDate.equals(date);
    }

    /** Calendar days since entry, 0 before entry. */
    public long daysSinceEntry(LocalDate today) {
        if (entryTime == null) {
            return 0;
        }
        return ChronoUnit.DAYS.between(entryTime.toLocalDate(), today);
    }

    /** Calendar days since the last adjustment, or since entry if none was made. */
    public long daysSinceLastAdjustment(LocalDate today) {
        if (lastAdjustmentDate == null) {
            return daysSinceEntry(today);
        }
        return ChronoUnit.DAYS.between(lastAdjustmentDate, today);
    }
}
