package com.sandwichtrader.backtest;

import com.sandwichtrader.broker.PaperOrderGateway;
import com.sandwichtrader.calendar.ExpiryCalendarService;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.model.EntryRequest;
import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.exception.BusinessException;
import com.sandwichtrader.exception.ErrorCode;
import com.sandwichtrader.marketdata.SyntheticMarketDataSource;
import com.sandwichtrader.strategy.sandwich.DecisionJournal;
import com.sandwichtrader.strategy.sandwich.SandwichConfig;
import com.sandwichtrader.strategy.sandwich.SandwichStrategy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays the sandwich over historical daily spot closes.
 *
 * <p>For every monthly expiry in {@code [from, to]} a fresh strategy is built on a
 * {@link SyntheticMarketDataSource} and a {@link PaperOrderGateway}. It is force-entered at
 * that expiry's entry time with the day's spot and a future of spot x (1 + carry), then
 * monitored once per calendar day at the exit time up to and including the next expiry.
 * Days missing from the series reuse the last known close.
 *
 * <p>Backtests never publish events: each strategy gets a logging-only journal.
 */
@Service
public class SandwichBacktestRunner {

    private static final Logger log = LoggerFactory.getLogger(SandwichBacktestRunner.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SandwichConfig sandwichConfig;
    private final ExpiryCalendarService expiryCalendarService;

    public SandwichBacktestRunner(SandwichConfig sandwichConfig, ExpiryCalendarService expiryCalendarService) {
        this.sandwichConfig = sandwichConfig;
        this.expiryCalendarService = expiryCalendarService;
    }

    /**
     * Runs the backtest.
     *
     * @param dailySpots spot close per date; need not cover every day
     * @throws BusinessException if {@code to} is before {@code from}
     */
    public BacktestReport run(LocalDate from, LocalDate to, Map<LocalDate, BigDecimal> dailySpots) {
        if (to.isBefore(from)) {
            throw new BusinessException(ErrorCode.INVALID_BACKTEST_WINDOW, "Backtest end " + to + " is before start " + from);
        }
        NavigableMap<LocalDate, BigDecimal> spots = new TreeMap<>(dailySpots);
        List<LocalDate> expiries = expiryCalendarService.getMonthlyExpiriesBetween(from, to);
        log.info("Backtest {} to {}: {} monthly expiries, {} spot points", from, to, expiries.size(), spots.size());

        List<BacktestReport.CycleResult> results = new ArrayList<>();
        List<LocalDate> skipped = new ArrayList<>();
        for (LocalDate expiry : expiries) {
            BacktestReport.CycleResult result = runCycle(expiry, spots);
            if (result != null) {
                results.add(result);
            } else {
                skipped.add(expiry);
            }
        }

        BacktestReport report = summarise(from, to, results, skipped);
        log.info(
                "Backtest complete: cycles={} wins={} winRate={}% avgPnl={} maxDrawdown={}",
                report.getCycles(),
                report.getWins(),
                report.getWinRate(),
                report.getAvgPnl(),
                report.getMaxDrawdown());
        return report;
    }

    /** Runs one cycle; null when the cycle could not be entered. */
    BacktestReport.CycleResult runCycle(LocalDate expiry, NavigableMap<LocalDate, BigDecimal> spots) {
        Map.Entry<LocalDate, BigDecimal> entrySpot = spots.floorEntry(expiry);
        if (entrySpot == null) {
            log.info("Skipping cycle {}: no spot data on or before it", expiry);
            return null;
        }

        SyntheticMarketDataSource market = new SyntheticMarketDataSource(
                sandwichConfig.getSyntheticCarry(), sandwichConfig.getSyntheticTimeValue());
        SandwichStrategy strategy = new SandwichStrategy(
                sandwichConfig,
                market,
                new PaperOrderGateway(),
                expiryCalendarService,
                DecisionJournal.logging(this));

        BigDecimal spot = entrySpot.getValue();
        BigDecimal future = spot.multiply(BigDecimal.ONE.add(sandwichConfig.getSyntheticCarry()))
                .setScale(2, RoundingMode.HALF_EVEN);
        LocalDate nextExpiry = expiryCalendarService.getNextMonthlyExpiry(expiry);
        market.setSpot(spot);

        EntryRequest request = EntryRequest.builder()
                .force(true)
                .spotOverride(spot)
                .futureOverride(future)
                .currentExpiry(expiry)
                .nextExpiry(nextExpiry)
                .build();
        if (!strategy.enter(request, expiry.atTime(sandwichConfig.getEntryTime()))) {
            log.info("Skipping cycle {}: entry rejected", expiry);
            return null;
        }

        LocalDate closedOn = null;
        for (LocalDate day = expiry.plusDays(1); !day.isAfter(nextExpiry); day = day.plusDays(1)) {
            Map.Entry<LocalDate, BigDecimal> close = spots.floorEntry(day);
            market.setSpot(close.getValue());
            strategy.monitor(at(day));
            if (strategy.getState() == LifecycleState.CLOSED) {
                closedOn = day;
                break;
            }
        }

        StrategyMetrics metrics = strategy.getMetrics(at(closedOn != null ? closedOn : nextExpiry));
        BigDecimal cyclePnl = metrics.getNetPnl();
        return BacktestReport.CycleResult.builder()
                .entryExpiry(expiry)
                .nextExpiry(nextExpiry)
                .monthType(metrics.getMonthType())
                .entrySpot(spot)
                .entryFuture(future)
                .finalState(metrics.getState())
                .exitReason(metrics.getExitReason())
                .closedOn(closedOn)
                .totalPnl(cyclePnl)
                .pnlPct(metrics.getNetPnlPct())
                .adjustments(strategy.getAdjustments())
                .failedOrders(strategy.getFailedOrders())
                .build();
    }

    private BacktestReport summarise(
            LocalDate from, LocalDate to, List<BacktestReport.CycleResult> results, List<LocalDate> skipped) {
        int cycles = results.size();
        int wins = (int) results.stream().filter(r -> r.getTotalPnl().signum() > 0).count();
        BigDecimal total = results.stream()
                .map(BacktestReport.CycleResult::getTotalPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal winRate = BigDecimal.ZERO;
        BigDecimal avg = BigDecimal.ZERO;
        if (cycles > 0) {
            winRate = BigDecimal.valueOf(wins).multiply(HUNDRED).divide(BigDecimal.valueOf(cycles), 2, RoundingMode.HALF_UP);
            avg = total.divide(BigDecimal.valueOf(cycles), 2, RoundingMode.HALF_UP);
        }

        return BacktestReport.builder()
                .from(from)
                .to(to)
                .cycles(cycles)
                .wins(wins)
                .losses(cycles - wins)
                .winRate(winRate)
                .totalPnl(total)
                .avgPnl(avg)
                .bestCycle(results.stream()
                        .map(BacktestReport.CycleResult::getTotalPnl)
                        .max(Comparator.naturalOrder())
                        .orElse(BigDecimal.ZERO))
                .worstCycle(results.stream()
                        .map(BacktestReport.CycleResult::getTotalPnl)
                        .min(Comparator.naturalOrder())
                        .orElse(BigDecimal.ZERO))
                .maxDrawdown(maxDrawdown(results))
                .results(results)
                .skippedExpiries(skipped)
                .build();
    }

    /** Peak-to-trough fall of the running P&L sum, starting from zero. */
    static BigDecimal maxDrawdown(List<BacktestReport.CycleResult> results) {
        BigDecimal equity = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        for (BacktestReport.CycleResult result : results) {
            equity = equity.add(result.getTotalPnl());
            peak = peak.max(equity);
            maxDrawdown = maxDrawdown.max(peak.subtract(equity));
        }
        return maxDrawdown;
    }

    /** Daily monitor time: the final-expiry exit time. */
    private LocalDateTime at(LocalDate date) {
        return date.atTime(sandwichConfig.getExitTime());
    }
}
