package com.sandwichtrader.notification;

import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Renders alerts as Telegram HTML ({@code <b>bold</b>}) messages.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("dd-MMM HH:mm");

    public String render(Alert alert) {
        String heading = switch (alert.getType()) {
            case ENTRY -> "SANDWICH ENTERED";
            case ENTRY_REJECTED -> "ENTRY ABORTED";
            case ADJUSTMENT -> "ADJUSTMENT";
            case EXIT -> "SANDWICH CLOSED";
            case ORDER_FAILURE -> "ORDER FAILED";
        };
        return String.format(
                "<b>%s</b>\n<b>Event:</b> %s\n<b>Details:</b> %s\n<b>Time:</b> %s",
                heading,
                alert.getTitle(),
                alert.getMessage(),
                alert.getTimestamp().format(TIME_FORMAT));
    }
}
