package com.sandwichtrader.domain.enums;

/**
 * Severity level for alerts in the notification system.
 *
 * <p>Ordinal ordering is used by TelegramNotifier's priority queue
 * so that CRITICAL messages are sent first when rate-limited.
 */
public enum AlertSeverity {

    /** Requires immediate attention. */
    CRITICAL,

    /** Requires trader attention but no automatic action. */
    WARNING,

    /** Informational, no action required. */
    INFO
}
