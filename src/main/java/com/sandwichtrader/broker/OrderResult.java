package com.sandwichtrader.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Outcome of {@link OrderGateway#placeOrder}. {@code fillPrice} is null when the broker doesn't report one. */
@Getter
@Builder
@ToString
public class OrderResult {

    private final boolean accepted;
    private final String orderId;
    private final BigDecimal fillPrice;
    private final String message;

    public static OrderResult accepted(String orderId, BigDecimal fillPrice) {
        return OrderResult.builder()
                .accepted(true)
                .orderId(orderId)
                .fillPrice(fillPrice)
                .message("OK")
                .build();
    }

    public static OrderResult rejected(String message) {
        return OrderResult.builder().accepted(false).message(message).build();
    }
}
