package com.sandwichtrader.notification;

import com.sandwichtrader.domain.enums.AlertSeverity;
import com.sandwichtrader.domain.enums.AlertType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An alert to be delivered to the trader. Built by NotificationService from strategy
 * events and rendered by NotificationTemplateEngine.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String title;
    private String message;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
