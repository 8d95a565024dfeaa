package com.sandwichtrader.notification;

import com.sandwichtrader.config.AsyncConfig;
import com.sandwichtrader.domain.enums.AlertSeverity;
import com.sandwichtrader.domain.enums.AlertType;
import com.sandwichtrader.event.StrategyEvent;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns strategy events into trader alerts (entry, adjustments, exit, failed orders).
 *
 * <p>Delivery runs on the single "notificationExecutor" thread so a slow Telegram call
 * never holds up a monitor cycle and alerts go out in the order the events happened. Delivery failures are logged, never rethrown.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final TelegramNotifier telegramNotifier;
    private final NotificationTemplateEngine notificationTemplateEngine;

    public NotificationService(
            TelegramNotifier telegramNotifier, NotificationTemplateEngine notificationTemplateEngine) {
        this.telegramNotifier = telegramNotifier;
        this.notificationTemplateEngine = notificationTemplateEngine;
    }

    public void notify(Alert alert) {
        try {
            String formattedMessage = notificationTemplateEngine.render(alert);
            telegramNotifier.send(formattedMessage, alert.getSeverity());
        } catch (RuntimeException e) {
            log.error("Failed to deliver alert {}: {}", alert.getTitle(), e.getMessage());
        }
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    @EventListener
    public void onStrategyEvent(StrategyEvent event) {
        Alert alert = Alert.builder()
                .type(alertType(event))
                .severity(severity(event))
                .title(title(event))
                .message(event.getMessage())
                .timestamp(LocalDateTime.now())
                .build();
        notify(alert);
    }

    private String title(StrategyEvent event) {
        if (event.getState() == null) {
            return event.getEventType().name();
        }
        if (event.getPreviousState() != null && event.getPreviousState() != event.getState()) {
            return event.getEventType().name() + " (" + event.getPreviousState() + " -> " + event.getState() + ")";
        }
        return event.getEventType().name() + " (" + event.getState() + ")";
    }

    private AlertType alertType(StrategyEvent event) {
        return switch (event.getEventType()) {
            case ENTERED -> AlertType.ENTRY;
            case ENTRY_REJECTED -> AlertType.ENTRY_REJECTED;
            case ADJUSTED -> AlertType.ADJUSTMENT;
            case CLOSED -> AlertType.EXIT;
            case ORDER_FAILED -> AlertType.ORDER_FAILURE;
        };
    }

    private AlertSeverity severity(StrategyEvent event) {
        return switch (event.getEventType()) {
            case ORDER_FAILED -> AlertSeverity.CRITICAL;
            case ENTRY_REJECTED, ADJUSTED -> AlertSeverity.WARNING;
            case ENTERED, CLOSED -> AlertSeverity.INFO;
        };
    }
}
