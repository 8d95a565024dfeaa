package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.broker.OrderGateway;
import com.sandwichtrader.broker.OrderRequest;
import com.sandwichtrader.broker.OrderResult;
import com.sandwichtrader.domain.enums.LegRole;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.event.StrategyEventType;
import com.sandwichtrader.exception.BrokerException;
import com.sandwichtrader.marketdata.PricingAdapter;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens and closes legs: one market order per leg, then the matching change in the
 * {@link LegBook}.
 *
 * <p>A rejected order or a broker failure is logged at ERROR and reported as an
 * ORDER_FAILED event, and the book is updated anyway. Positions are tracked as intended,
 * never rolled back; reconciling with the broker is left to the trader.
 *
 * <p>Entry price precedence: the fill price, else the current quote, else pending (null)
 * until the next price refresh.
 */
public class LegExecutor {

    private static final Logger log = LoggerFactory.getLogger(LegExecutor.class);

    private final LegBook legBook;
    private final OrderGateway orderGateway;
    private final PricingAdapter pricingAdapter;
    private final DecisionJournal journal;
    private final int lotSize;

    private int failedOrders;

    public LegExecutor(
            LegBook legBook,
            OrderGateway orderGateway,
            PricingAdapter pricingAdapter,
            DecisionJournal journal,
            int lotSize) {
        this.legBook = legBook;
        this.orderGateway = orderGateway;
        this.pricingAdapter = pricingAdapter;
        this.journal = journal;
        this.lotSize = lotSize;
    }

    /**
     * Places the opening order for a role and appends the new leg.
     *
     * @param strike option strike, null for the future
     */
    public Leg open(LegRole role, String tradingSymbol, Integer strike, LocalDateTime at) {
        return open(role, tradingSymbol, strike, null, at);
    }

    /**
     * Same as {@link #open(LegRole, String, Integer, LocalDateTime)} with a known price
     * (the entry reference future) used instead of a fresh quote.
     */
    public Leg open(LegRole role, String tradingSymbol, Integer strike, BigDecimal knownPrice, LocalDateTime at) {
        BigDecimal quote = knownPrice != null
                ? knownPrice
                : pricingAdapter.quote(tradingSymbol, role.getInstrumentType(), strike).orElse(null);

        OrderRequest request = OrderRequest.builder()
                .tradingSymbol(tradingSymbol)
                .instrumentType(role.getInstrumentType())
                .strike(strike)
                .side(role.getSide())
                .quantity(role.getLots() * lotSize)
                .referencePrice(quote)
                .role(role)
                .build();
        OrderResult result = execute(request, at);

        BigDecimal entryPrice = result != null && result.isAccepted() && result.getFillPrice() != null
                ? result.getFillPrice()
                : quote;

        Leg leg = Leg.builder()
                .id(legBook.nextId())
                .tradingSymbol(tradingSymbol)
                .instrumentType(role.getInstrumentType())
                .strike(strike)
                .side(role.getSide())
                .quantity(role.getLots())
                .role(role)
                .openedAt(at)
                .build();
        leg.markPrice(entryPrice);
        legBook.append(leg);
        log.info(
                "Opened leg {}: {} {} {} x{} @ {}",
                leg.getId(),
                role,
                role.getSide(),
                tradingSymbol,
                role.getLots(),
                entryPrice);
        return leg;
    }

    /** Places the offsetting order and marks the leg closed. No-op for a closed leg. */
    public void close(Leg leg, LocalDateTime at) {
        if (!leg.isOpen()) {
            return;
        }
        BigDecimal quote = pricingAdapter
                .quote(leg.getTradingSymbol(), leg.getInstrumentType(), leg.getStrike())
                .orElse(null);
        leg.markPrice(quote);

        OrderRequest request = OrderRequest.builder()
                .tradingSymbol(leg.getTradingSymbol())
                .instrumentType(leg.getInstrumentType())
                .strike(leg.getStrike())
                .side(leg.getSide().opposite())
                .quantity(leg.getQuantity() * lotSize)
                .referencePrice(leg.getLastPrice())
                .role(leg.getRole())
                .build();
        OrderResult result = execute(request, at);

        BigDecimal exitPrice = result != null && result.isAccepted() && result.getFillPrice() != null
                ? result.getFillPrice()
                : leg.getLastPrice();
        leg.close(exitPrice, at);
        log.info("Closed leg {}: {} {} @ {}", leg.getId(), leg.getRole(), leg.getTradingSymbol(), exitPrice);
    }

    /** Closes the open leg of a role, if any. */
    public void closeRole(LegRole role, LocalDateTime at) {
        legBook.findOpen(role).ifPresent(leg -> close(leg, at));
    }

    public void closeAll(LocalDateTime at) {
        List<Leg> open = legBook.open();
        for (Leg leg : open) {
            close(leg, at);
        }
    }

    public int getFailedOrders() {
        return failedOrders;
    }

    private OrderResult execute(OrderRequest request, LocalDateTime at) {
        try {
            OrderResult result = orderGateway.placeOrder(request);
            if (!result.isAccepted()) {
                reportFailure(request, "rejected: " + result.getMessage(), at);
            }
            return result;
        } catch (BrokerException e) {
            log.error("Order for {} failed", request.getTradingSymbol(), e);
            reportFailure(request, "failed: " + e.getMessage(), at);
            return null;
        }
    }

    private void reportFailure(OrderRequest request, String reason, LocalDateTime at) {
        failedOrders++;
        String message = request.getSide() + " " + request.getTradingSymbol() + " " + reason;
        log.error("Order {}; recording leg as intended", message);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("symbol", request.getTradingSymbol());
        context.put("side", request.getSide());
        context.put("quantity", request.getQuantity());
        context.put("role", request.getRole());
        journal.decision("ORDER", message, context, at);
        journal.strategyEvent(StrategyEventType.ORDER_FAILED, null, null, message, context);
    }
}
