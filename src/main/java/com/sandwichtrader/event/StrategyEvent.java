package com.sandwichtrader.event;

import com.sandwichtrader.domain.enums.LifecycleState;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the sandwich cycle enters, adjusts, closes, or fails to place an order.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: turns the event into a Telegram alert</li>
 *   <li>StrategyMetricsService: counts entries, adjustments and exits</li>
 * </ul>
 */
public class StrategyEvent extends ApplicationEvent {

    private final StrategyEventType eventType;
    private final LifecycleState previousState;
    private final LifecycleState state;
    private final String message;
    private final Map<String, Object> details;

    public StrategyEvent(
            Object source,
            StrategyEventType eventType,
            LifecycleState previousState,
            LifecycleState state,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.state = state;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public StrategyEventType getEventType() {
        return eventType;
    }

    public LifecycleState getPreviousState() {
        return previousState;
    }

    public LifecycleState getState() {
        return state;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Structured context. ADJUSTED carries "adjustment" (the AdjustmentType),
     * CLOSED carries "exitReason", "totalPnl" (open legs) and "netPnl".
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
