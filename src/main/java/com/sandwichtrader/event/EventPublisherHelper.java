package com.sandwichtrader.event;

import com.sandwichtrader.domain.enums.LifecycleState;
import java.time.LocalDateTime;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the sandwich events.
 *
 * <p>Delivery depends on the listener: synchronous {@code @EventListener} or
 * {@code @Async @EventListener} on the "notificationExecutor" thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Strategy ----

    public void publishStrategyEvent(
            Object source,
            StrategyEventType eventType,
            LifecycleState previousState,
            LifecycleState state,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new StrategyEvent(source, eventType, previousState, state, message, details));
    }

    // ---- Decision ----

    public void publishDecision(
            Object source, String category, String message, Map<String, Object> context, LocalDateTime occurredAt) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message, context, occurredAt));
    }
}
