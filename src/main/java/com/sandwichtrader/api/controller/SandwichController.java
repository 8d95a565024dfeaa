package com.sandwichtrader.api.controller;

import com.sandwichtrader.api.dto.request.BacktestRequestDto;
import com.sandwichtrader.api.dto.request.EntryRequestDto;
import com.sandwichtrader.api.dto.request.PaperSpotRequest;
import com.sandwichtrader.api.dto.response.EntryResponse;
import com.sandwichtrader.api.dto.response.LegResponse;
import com.sandwichtrader.backtest.BacktestReport;
import com.sandwichtrader.backtest.SandwichBacktestRunner;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.domain.model.EntryRequest;
import com.sandwichtrader.domain.model.StrategyMetrics;
import com.sandwichtrader.observability.DecisionLog;
import com.sandwichtrader.observability.DecisionRecord;
import com.sandwichtrader.service.SandwichStrategyService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the sandwich strategy.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/sandwich/enter -- attempt an entry (optionally forced, with price overrides)</li>
 *   <li>POST /api/sandwich/monitor -- run one monitor cycle now</li>
 *   <li>GET /api/sandwich/metrics -- P&L and position summary</li>
 *   <li>GET /api/sandwich/legs -- every leg, open and closed</li>
 *   <li>GET /api/sandwich/decisions -- most recent strategy decisions</li>
 *   <li>POST /api/sandwich/reset -- start a fresh IDLE cycle</li>
 *   <li>POST /api/sandwich/backtest -- replay over daily spot closes</li>
 *   <li>PUT /api/sandwich/paper/spot -- move the synthetic spot (PAPER mode)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/sandwich")
public class SandwichController {

    private static final Logger log = LoggerFactory.getLogger(SandwichController.class);

    private final SandwichStrategyService sandwichStrategyService;
    private final SandwichBacktestRunner sandwichBacktestRunner;
    private final DecisionLog decisionLog;

    public SandwichController(
            SandwichStrategyService sandwichStrategyService,
            SandwichBacktestRunner sandwichBacktestRunner,
            DecisionLog decisionLog) {
        this.sandwichStrategyService = sandwichStrategyService;
        this.sandwichBacktestRunner = sandwichBacktestRunner;
        this.decisionLog = decisionLog;
    }

    @PostMapping("/enter")
    public ResponseEntity<EntryResponse> enter(@Valid @RequestBody(required = false) EntryRequestDto request) {
        EntryRequest entry = request != null ? request.toEntryRequest() : EntryRequest.scheduled();
        log.info("Manual entry requested: force={}", entry.isForce());
        boolean entered = sandwichStrategyService.enter(entry);
        return ResponseEntity.ok(EntryResponse.builder()
                .entered(entered)
                .state(sandwichStrategyService.getState())
                .build());
    }

    @PostMapping("/monitor")
    public ResponseEntity<StrategyMetrics> monitor() {
        return ResponseEntity.ok(sandwichStrategyService.monitor());
    }

    @GetMapping("/metrics")
    public ResponseEntity<StrategyMetrics> getMetrics() {
        return ResponseEntity.ok(sandwichStrategyService.getMetrics());
    }

    @GetMapping("/legs")
    public ResponseEntity<List<LegResponse>> getLegs() {
        List<LegResponse> legs = sandwichStrategyService.getLegs().stream()
                .map(LegResponse::from)
                .toList();
        return ResponseEntity.ok(legs);
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<DecisionRecord>> getDecisions(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(decisionLog.getRecent(limit));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, LifecycleState>> reset() {
        sandwichStrategyService.reset();
        return ResponseEntity.ok(Map.of("state", sandwichStrategyService.getState()));
    }

    /** Runs synchronously on the request thread. */
    @PostMapping("/backtest")
    public ResponseEntity<BacktestReport> backtest(@Valid @RequestBody BacktestRequestDto request) {
        return ResponseEntity.ok(
                sandwichBacktestRunner.run(request.getFrom(), request.getTo(), request.getDailySpots()));
    }

    @PutMapping("/paper/spot")
    public ResponseEntity<Map<String, Object>> setPaperSpot(@Valid @RequestBody PaperSpotRequest request) {
        sandwichStrategyService.setPaperSpot(request.getSpot());
        return ResponseEntity.ok(Map.of("spot", request.getSpot()));
    }
}
