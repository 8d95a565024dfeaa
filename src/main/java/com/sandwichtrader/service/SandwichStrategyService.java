package com.sandwichtrader.service;

import com.sandwichtrader.broker.OrderGateway;
import com.sandwichtrader.calendar.ExpiryCalendarService;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.model.EntryRequest;
import com.sandwichtrader.domain.model.Leg;
import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.event.EventPublisherHelper;
import com.sandwichtrader.exception.BusinessException;
import com.sandwichtrader.exception.StrategyStateException;
import com.sandwichtrader.exception.ErrorCode;
import com.sandwichtrader.marketdata.MarketDataSource;
import com.sandwichtrader.marketdata.SyntheticMarketDataSource;
import com.sandwichtrader.strategy.sandwich.DecisionJournal;
import com.sandwichtrader.strategy.sandwich.SandwichConfig;
import com.sandwichtrader.strategy.sandwich.SandwichStrategy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the single sandwich instance and serialises every caller onto it.
 *
 * <p>The scheduler and the REST API both come through here; one {@link ReentrantLock}
 * guarantees that an entry, a monitor cycle and a metrics read never interleave. The clock
 * is the injected exchange-zone {@link Clock}.
 */
@Service
public class SandwichStrategyService {

    private static final Logger log = LoggerFactory.getLogger(SandwichStrategyService.class);

    private final SandwichConfig sandwichConfig;
    private final MarketDataSource marketDataSource;
    private final OrderGateway orderGateway;
    private final ExpiryCalendarService expiryCalendarService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private SandwichStrategy strategy;

    public SandwichStrategyService(
            SandwichConfig sandwichConfig,
            MarketDataSource marketDataSource,
            OrderGateway orderGateway,
            ExpiryCalendarService expiryCalendarService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.sandwichConfig = sandwichConfig;
        this.marketDataSource = marketDataSource;
        this.orderGateway = orderGateway;
        this.expiryCalendarService = expiryCalendarService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.strategy = newStrategy();
    }

    /**
     * Attempts an entry.
     *
     * @return true if the sandwich was entered
     * @throws StrategyStateException if a cycle is already running or closed (reset first)
     */
    public boolean enter(EntryRequest request) {
        return withLock(() -> {
            if (strategy.getState() != LifecycleState.IDLE) {
                throw new StrategyStateException("Sandwich already entered", strategy.getState());
            }
            return strategy.enter(request, now());
        });
    }

    /** Scheduled entry: a no-op unless the strategy is IDLE. */
    public boolean tryScheduledEntry() {
        return withLock(() -> strategy.getState() == LifecycleState.IDLE
                && strategy.enter(EntryRequest.scheduled(), now()));
    }

    /** Runs one monitor cycle and returns the metrics after it. */
    public StrategyMetrics monitor() {
        return withLock(() -> {
            LocalDateTime now = now();
            strategy.monitor(now);
            return strategy.getMetrics(now);
        });
    }

    public StrategyMetrics getMetrics() {
        return withLock(() -> strategy.getMetrics(now()));
    }

    public List<Leg> getLegs() {
        return withLock(() -> strategy.getLegs());
    }

    public LifecycleState getState() {
        return withLock(() -> strategy.getState());
    }

    /**
     * Replaces the instance with a fresh IDLE one.
     *
     * @throws StrategyStateException while a cycle holds open legs
     */
    public void reset() {
        withLock(() -> {
            LifecycleState state = strategy.getState();
            if (state.isLive()) {
                throw new StrategyStateException("Cannot reset while the sandwich is " + state, state);
            }
            strategy = newStrategy();
            log.info("Sandwich strategy reset");
            return null;
        });
    }

    /**
     * Sets the synthetic spot in PAPER mode.
     *
     * @throws BusinessException when market data is not synthetic
     */
    public void setPaperSpot(BigDecimal spot) {
        if (!(marketDataSource instanceof SyntheticMarketDataSource synthetic)) {
            throw new BusinessException(
                    ErrorCode.PAPER_MODE_ONLY, "Paper spot only applies in PAPER mode, mode is " + sandwichConfig.getTradingMode());
        }
        synthetic.setSpot(spot);
        log.info("Paper spot set to {}", spot);
    }

    private SandwichStrategy newStrategy() {
        return new SandwichStrategy(
                sandwichConfig,
                marketDataSource,
                orderGateway,
                expiryCalendarService,
                new DecisionJournal(this, eventPublisherHelper));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
