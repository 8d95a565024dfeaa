package com.sandwichtrader.strategy.sandwich;

import com.sandwichtrader.broker.OrderGateway;
import com.sandwichtrader.calendar.ExpiryCalendarService;
import com.sandwichtrader.domain.enums.AdjustmentType;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.enums.MonthType;
import com.sandwichtrader.domain.model.EntryRequest;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.domain.model.MarketSnapshot;
import com.sandwichtrader.domain.model.SandwichContext;
import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.event.StrategyEventType;
import com.sandwichtrader.marketdata.MarketDataSource;
import com.sandwichtrader.marketdata.PricingAdapter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One sandwich cycle on BANKNIFTY monthly contracts: a short future hedged by a long call
 * and financed by a short put (the core), wrapped in short strangle wings with protective
 * longs (the bread).
 *
 * <p><b>Entry:</b> at 15:00 on the current monthly expiry, read spot (S0) and the next-month
 * future (F0). Abort if either is missing or F0 &lt; S0. Otherwise open the seven legs
 * built by {@link PositionBuilder} against the next expiry.
 *
 * <p><b>Monitoring:</b> each {@link #monitor} call refreshes leg prices, computes P&L, and
 * lets the {@link AdjustmentEngine} either exit (profit target, final expiry) or apply the
 * defense for the current state:
 * <pre>
 *   ACTIVE --defense 1--> DEFENSE_1 --defense 2--> DEFENSE_2 --straddle--> STRADDLE
 *      \___________________\_______________________\______________________\--> CLOSED
 * </pre>
 *
 * <p>Time is always passed in. The class holds no locks; {@code SandwichStrategyService}
 * serialises callers.
 */
public class SandwichStrategy {

    private static final Logger log = LoggerFactory.getLogger(SandwichStrategy.class);

    private final SandwichConfig config;
    private final ExpiryCalendarService expiryCalendarService;
    private final DecisionJournal journal;

    private final SandwichContext context = new SandwichContext();
    private final LegBook legBook = new LegBook();
    private final StrikeResolver strikeResolver;
    private final PricingAdapter pricingAdapter;
    private final LegExecutor legExecutor;
    private final PositionBuilder positionBuilder;
    private final AdjustmentEngine adjustmentEngine;
    private final MetricsAggregator metricsAggregator;

    private final List<AdjustmentType> adjustments = new ArrayList<>();

    public SandwichStrategy(
            SandwichConfig config,
            MarketDataSource marketDataSource,
            OrderGateway orderGateway,
            ExpiryCalendarService expiryCalendarService,
            DecisionJournal journal) {
        this.config = config;
        this.expiryCalendarService = expiryCalendarService;
        this.journal = journal != null ? journal : DecisionJournal.logging(this);
        this.strikeResolver = new StrikeResolver(config.getUnderlying(), config.getStrikeInterval());
        this.pricingAdapter = new PricingAdapter(marketDataSource);
        this.legExecutor = new LegExecutor(legBook, orderGateway, pricingAdapter, this.journal, config.getLotSize());
        this.positionBuilder = new PositionBuilder(config, strikeResolver, legExecutor);
        this.adjustmentEngine = new AdjustmentEngine(config, strikeResolver, legBook, legExecutor, this.journal);
        this.metricsAggregator = new MetricsAggregator(config);
    }

    // ========================
    // ENTRY
    // ========================

    /**
     * Attempts to open the sandwich.
     *
     * @return true if the seven legs were placed; false if the cycle was already entered or
     *     a precondition failed (the state then stays IDLE)
     */
    public boolean enter(EntryRequest request, LocalDateTime now) {
        EntryRequest entry = request != null ? request : EntryRequest.scheduled();
        if (context.getState() != LifecycleState.IDLE) {
            log.warn("Entry ignored, cycle already in state {}", context.getState());
            return false;
        }

        LocalDate today = now.toLocalDate();
        LocalDate currentExpiry = entry.getCurrentExpiry() != null
                ? entry.getCurrentExpiry()
                : expiryCalendarService.getCurrentMonthlyExpiry(today);

        if (!entry.isForce()) {
            if (!today.equals(currentExpiry)) {
                return skip("Not monthly expiry day (" + currentExpiry + ")");
            }
            if (!config.isWithinTolerance(now.toLocalTime(), config.getEntryTime())) {
                return skip("Time " + now.toLocalTime() + " outside entry window " + config.getEntryTime());
            }
        }

        LocalDate nextExpiry = entry.getNextExpiry() != null
                ? entry.getNextExpiry()
                : expiryCalendarService.getNextMonthlyExpiry(currentExpiry);
        MonthType monthType = MonthType.classify(currentExpiry, nextExpiry);

        Optional<BigDecimal> spot = entry.getSpotOverride() != null
                ? Optional.of(entry.getSpotOverride())
                : pricingAdapter.spot();
        if (spot.isEmpty()) {
            return reject("Spot price unavailable", now);
        }
        pricingAdapter.rememberSpot(spot.get());

        Optional<BigDecimal> future = entry.getFutureOverride() != null
                ? Optional.of(entry.getFutureOverride())
                : pricingAdapter.future(strikeResolver.futureSymbol(nextExpiry));
        if (future.isEmpty()) {
            return reject("Future price unavailable for " + strikeResolver.futureSymbol(nextExpiry), now);
        }

        BigDecimal s0 = spot.get();
        BigDecimal f0 = future.get();
        if (!strikeResolver.inRange(s0) || !strikeResolver.inRange(f0)) {
            return reject("Spot " + s0.toPlainString() + " or future " + f0.toPlainString()
                    + " outside the strike range", now);
        }
        if (f0.compareTo(s0) < 0) {
            return reject("Future " + f0.toPlainString() + " below spot " + s0.toPlainString(), now);
        }

        context.begin(now, s0, f0, monthType, currentExpiry, nextExpiry);
        positionBuilder.build(s0, f0, monthType, nextExpiry, now);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("spot", s0);
        details.put("future", f0);
        details.put("monthType", monthType);
        details.put("currentExpiry", currentExpiry);
        details.put("nextExpiry", nextExpiry);
        logDecision("ENTRY", "Sandwich entered, " + monthType + " cycle to " + nextExpiry, details, now);
        journal.strategyEvent(
                StrategyEventType.ENTERED,
                LifecycleState.IDLE,
                context.getState(),
                "Sandwich entered: spot " + s0.toPlainString() + ", future " + f0.toPlainString(),
                details);
        return true;
    }

    // ========================
    // MONITORING
    // ========================

    /**
     * Runs one monitoring cycle at {@code now}. No-op unless the cycle is live; in
     * particular, once CLOSED nothing changes.
     */
    public void monitor(LocalDateTime now) {
        LifecycleState before = context.getState();
        if (!before.isLive()) {
            log.debug("Monitor skipped in state {}", before);
            return;
        }

        pricingAdapter.refresh(legBook.open());
        BigDecimal spot = pricingAdapter.spotOrLast().orElse(null);
        List<Leg> legs = legBook.all();
        BigDecimal totalPnl = metricsAggregator.totalPnl(legs);
        BigDecimal netPnl = metricsAggregator.netPnl(legs);
        BigDecimal pnlPct = metricsAggregator.pnlPct(netPnl);
        log.info("State={} OpenPnL={} NetPnL={} ({}%) Spot={}", before, totalPnl, netPnl, pnlPct, spot);

        MarketSnapshot snapshot = MarketSnapshot.builder()
                .spotPrice(spot)
                .totalPnl(totalPnl)
                .netPnl(netPnl)
                .pnlPct(pnlPct)
                .timestamp(now)
                .build();
        AdjustmentEngine.Outcome outcome = adjustmentEngine.evaluate(context, snapshot);

        if (outcome.exited()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exitReason", outcome.exitReason());
            details.put("totalPnl", totalPnl);
            details.put("netPnl", netPnl);
            details.put("pnlPct", pnlPct);
            journal.strategyEvent(
                    StrategyEventType.CLOSED,
                    before,
                    context.getState(),
                    "Sandwich closed (" + outcome.exitReason() + "), net P&L " + netPnl.toPlainString(),
                    details);
        } else if (outcome.adjusted()) {
            adjustments.add(outcome.adjustment());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("adjustment", outcome.adjustment());
            details.put("spot", spot);
            details.put("totalPnl", totalPnl);
            journal.strategyEvent(
                    StrategyEventType.ADJUSTED,
                    before,
                    context.getState(),
                    outcome.adjustment() + " applied at spot " + spot,
                    details);
        }
    }

    // ========================
    // QUERIES
    // ========================

    /** Metrics as of the last observed prices. Does not fetch new quotes. */
    public StrategyMetrics getMetrics(LocalDateTime now) {
        BigDecimal spot = pricingAdapter.lastSpot().orElse(null);
        return metricsAggregator.aggregate(context, legBook.all(), spot, now.toLocalDate());
    }

    /** Every leg ever held, open and closed, in creation order. */
    public List<Leg> getLegs() {
        return legBook.all();
    }

    public LifecycleState getState() {
        return context.getState();
    }

    public SandwichContext getContext() {
        return context;
    }

    /** Adjustments applied so far, in order. */
    public List<AdjustmentType> getAdjustments() {
        return List.copyOf(adjustments);
    }

    public int getFailedOrders() {
        return legExecutor.getFailedOrders();
    }

    // ========================
    // HELPERS
    // ========================

    /** Routine gate miss (wrong day or time): logged, no event. */
    private boolean skip(String reason) {
        log.info("Sandwich entry skipped: {}", reason);
        return false;
    }

    private boolean reject(String reason, LocalDateTime now) {
        logDecision("ENTRY", "Entry aborted: " + reason, Map.of(), now);
        journal.strategyEvent(
                StrategyEventType.ENTRY_REJECTED, LifecycleState.IDLE, LifecycleState.IDLE, reason, null);
        return false;
    }

    private void logDecision(String category, String message, Map<String, Object> details, LocalDateTime now) {
        log.info("[{}] {}", category, message);
        journal.decision(category, message, details, now);
    }
}
