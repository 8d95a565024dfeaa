package com.sandwichtrader.event;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever the strategy makes, or declines to make, a decision.
 *
 * <p>Examples:
 * <ul>
 *   <li>"Entry aborted: future 44950 below spot 45000"</li>
 *   <li>"Defense 1: rally 1600 >= 1500 with P&L -5000, rolling core put 44600 -> 45100"</li>
 *   <li>"Profit target reached: 12.4% >= 12%"</li>
 * </ul>
 *
 * <p>DecisionLog keeps the most recent ones in memory for the REST API.
 */
public class DecisionEvent extends ApplicationEvent {

    private final String category;
    private final String message;
    private final Map<String, Object> context;
    private final LocalDateTime occurredAt;

    /**
     * @param source   the component that made the decision
     * @param category classification ("ENTRY", "EXIT", "ADJUSTMENT", "ORDER", "PRICE")
     * @param message  human-readable description
     * @param context  structured data for the decision log
     * @param occurredAt the strategy clock at the time of the decision
     */
    public DecisionEvent(
            Object source, String category, String message, Map<String, Object> context, LocalDateTime occurredAt) {
        super(source);
        this.category = category;
        this.message = message;
        this.context = context != null ? new HashMap<>(context) : new HashMap<>();
        this.occurredAt = occurredAt != null ? occurredAt : LocalDateTime.now();
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
