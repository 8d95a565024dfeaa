package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.event.EventPublisherHelper;
import com.sandwichtrader.event.StrategyEventType;
import java.time.LocalDateTime;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Where the sandwich components report decisions and lifecycle events.
 *
 * <p>With an {@link EventPublisherHelper} the entries become Spring events. Without one
 * (unit tests, backtests) they are only logged.
 */
public class DecisionJournal {

    private static final Logger log = LoggerFactory.getLogger(DecisionJournal.class);

    private final Object source;
    private final EventPublisherHelper eventPublisherHelper;

    public DecisionJournal(Object source, EventPublisherHelper eventPublisherHelper) {
        this.source = source;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** A journal that only logs. */
    public static DecisionJournal logging(Object source) {
        return new DecisionJournal(source, null);
    }

    public void decision(String category, String message, Map<String, Object> context, LocalDateTime at) {
        if (eventPublisherHelper != null) {
            eventPublisherHelper.publishDecision(source, category, message, context, at);
        } else {
            log.info("[{}] {} - {} | {}", at, category, message, context);
        }
    }

    public void strategyEvent(
            StrategyEventType type,
            LifecycleState previousState,
            LifecycleState state,
            String message,
            Map<String, Object> details) {
        if (eventPublisherHelper != null) {
            eventPublisherHelper.publishStrategyEvent(source, type, previousState, state, message, details);
        } else {
            log.info("{} {} -> {}: {}", type, previousState, state, message);
        }
    }
}
