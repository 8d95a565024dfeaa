package com.sandwichtrader.observability;

import com.sandwichtrader.event.StrategyEvent;
import com.sandwichtrader.service.SandwichStrategyService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the sandwich Micrometer metrics, exposed through Spring Boot Actuator.
 * <ul>
 *   <li><b>sandwich.entries</b> (counter): successful entries</li>
 *   <li><b>sandwich.adjustments</b> (counter, tag {@code type}): defenses applied</li>
 *   <li><b>sandwich.exits</b> (counter, tag {@code reason}): cycles closed</li>
 *   <li><b>sandwich.orders.failed</b> (counter): rejected or failed orders</li>
 *   <li><b>sandwich.pnl.total</b>, <b>sandwich.pnl.pct</b>, <b>sandwich.legs.open</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer on scrape.
 */
@Service
public class StrategyMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter entriesCounter;
    private final Counter failedOrdersCounter;

    public StrategyMetricsService(MeterRegistry meterRegistry, SandwichStrategyService sandwichStrategyService) {
        this.meterRegistry = meterRegistry;

        this.entriesCounter = Counter.builder("sandwich.entries")
                .description("Sandwich cycles entered")
                .register(meterRegistry);

        this.failedOrdersCounter = Counter.builder("sandwich.orders.failed")
                .description("Orders rejected by the broker or failed in transit")
                .register(meterRegistry);

        meterRegistry.gauge("sandwich.pnl.total", sandwichStrategyService, service -> service.getMetrics()
                .getTotalPnl()
                .doubleValue());
        meterRegistry.gauge("sandwich.pnl.pct", sandwichStrategyService, service -> service.getMetrics()
                .getPnlPctOfCapital()
                .doubleValue());
        meterRegistry.gauge("sandwich.pnl.net", sandwichStrategyService, service -> service.getMetrics()
                .getNetPnl()
                .doubleValue());
        meterRegistry.gauge("sandwich.legs.open", sandwichStrategyService, service -> service.getMetrics()
                .getOpenLegCount());
    }

    @EventListener
    @Order(20)
    public void onStrategyEvent(StrategyEvent event) {
        switch (event.getEventType()) {
            case ENTERED -> entriesCounter.increment();
            case ADJUSTED -> meterRegistry
                    .counter("sandwich.adjustments", "type", String.valueOf(event.getDetails().get("adjustment")))
                    .increment();
            case CLOSED -> meterRegistry
                    .counter("sandwich.exits", "reason", String.valueOf(event.getDetails().get("exitReason")))
                    .increment();
            case ORDER_FAILED -> failedOrdersCounter.increment();
            case ENTRY_REJECTED -> {}
        }
    }
}
