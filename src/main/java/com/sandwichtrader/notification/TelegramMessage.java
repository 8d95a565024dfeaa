package com.sandwichtrader.notification;

import com.sandwichtrader.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Data;

/** A message waiting for Telegram delivery, ordered by severity in the queue. */
@Data
@Builder
public class TelegramMessage {

    private String text;
    private AlertSeverity severity;
    private long timestamp;
}
