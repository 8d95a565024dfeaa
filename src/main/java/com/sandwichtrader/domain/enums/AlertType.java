package com.sandwichtrader.domain.enums;

/** What an alert is about; selects the message template. */
public enum AlertType {
    ENTRY,
    ENTRY_REJECTED,
    ADJUSTMENT,
    EXIT,
    ORDER_FAILURE
}
