package com.sandwichtrader.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated order execution. Every order is accepted and filled at its reference price;
 * order ids run {@code PAPER-000001}, {@code PAPER-000002}, ...
 */
public class PaperOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderGateway.class);

    private final AtomicLong orderCounter = new AtomicLong();
    private final List<OrderRequest> placedOrders = new ArrayList<>();

    @Override
    public synchronized OrderResult placeOrder(OrderRequest request) {
        String orderId = String.format("PAPER-%06d", orderCounter.incrementAndGet());
        placedOrders.add(request);
        log.info(
                "Paper order filled: orderId={} symbol={} side={} qty={} price={}",
                orderId,
                request.getTradingSymbol(),
                request.getSide(),
                request.getQuantity(),
                request.getReferencePrice());
        return OrderResult.accepted(orderId, request.getReferencePrice());
    }

    public synchronized List<OrderRequest> getPlacedOrders() {
        return List.copyOf(placedOrders);
    }
}
