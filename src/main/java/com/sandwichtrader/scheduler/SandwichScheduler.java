package com.sandwichtrader.scheduler;

import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.exception.BaseException;
import com.sandwichtrader.service.SandwichStrategyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the sandwich on exchange time (IST):
 * <ul>
 *   <li>entry attempt at 15:00 on weekdays; the strategy itself checks for the monthly expiry</li>
 *   <li>monitor cycle every 5 minutes from 09:00 to 15:55</li>
 *   <li>end-of-day summary at 15:35</li>
 * </ul>
 *
 * <p>Enabled with {@code sandwich.scheduler.enabled=true}. A failing job is logged and the
 * next run goes ahead as scheduled.
 */
@Component
@ConditionalOnProperty(prefix = "sandwich.scheduler", name = "enabled", havingValue = "true")
public class SandwichScheduler {

    private static final Logger log = LoggerFactory.getLogger(SandwichScheduler.class);

    private final SandwichStrategyService sandwichStrategyService;

    public SandwichScheduler(SandwichStrategyService sandwichStrategyService) {
        this.sandwichStrategyService = sandwichStrategyService;
    }

    @Scheduled(cron = "${sandwich.scheduler.entry-cron:0 0 15 * * MON-FRI}", zone = "${sandwich.timezone:Asia/Kolkata}")
    public void attemptEntry() {
        try {
            boolean entered = sandwichStrategyService.tryScheduledEntry();
            log.info("Scheduled entry check: entered={}", entered);
        } catch (BaseException e) {
            log.error("Scheduled entry failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(
            cron = "${sandwich.scheduler.monitor-cron:0 0/5 9-15 * * MON-FRI}",
            zone = "${sandwich.timezone:Asia/Kolkata}")
    public void monitor() {
        try {
            StrategyMetrics metrics = sandwichStrategyService.monitor();
            log.debug("Monitor cycle: state={} pnl={}", metrics.getState(), metrics.getTotalPnl());
        } catch (BaseException e) {
            log.error("Monitor cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${sandwich.scheduler.summary-cron:0 35 15 * * MON-FRI}", zone = "${sandwich.timezone:Asia/Kolkata}")
    public void dailySummary() {
        StrategyMetrics metrics = sandwichStrategyService.getMetrics();
        log.info(
                "Daily summary: state={} openLegs={} pnl={} ({}%) realised={} net={} ({}%) daysSinceEntry={}",
                metrics.getState(),
                metrics.getOpenLegCount(),
                metrics.getTotalPnl(),
                metrics.getPnlPctOfCapital(),
                metrics.getRealizedPnl(),
                metrics.getNetPnl(),
                metrics.getNetPnlPct(),
                metrics.getDaysSinceEntry());
    }
}
