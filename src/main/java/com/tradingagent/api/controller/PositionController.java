package com.tradingagent.api.controller;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.Position;
import com.tradingagent.domain.model.PositionSummary;
import com.tradingagent.domain.model.ReconciliationResult;
import com.tradingagent.domain.model.StrategyPerformanceBreakdown;
import com.tradingagent.exception.ResourceNotFoundException;
import com.tradingagent.ledger.PositionLedger;
import com.tradingagent.reconciliation.ReconciliationMonitor;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger views and operator actions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions?universe=&amp;strategy= -- open positions</li>
 *   <li>GET /api/positions/{ticker}?universe= -- one ledger row</li>
 *   <li>GET /api/positions/performance?universe=&amp;strategy=&amp;date= -- aggregate or daily performance</li>
 *   <li>GET /api/positions/performance/all -- real vs simulated per strategy</li>
 *   <li>GET /api/positions/summary?universe=&amp;strategy= -- open exposure plus performance</li>
 *   <li>POST /api/positions/reconcile -- sync both universes with the exchange now</li>
 *   <li>POST /api/positions/simulated/reset?backup= -- clear the simulated ledger</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final PositionLedger positionLedger;
    private final ReconciliationMonitor reconciliationMonitor;

    public PositionController(PositionLedger positionLedger, ReconciliationMonitor reconciliationMonitor) {
        this.positionLedger = positionLedger;
        this.reconciliationMonitor = reconciliationMonitor;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listOpenPositions(
            @RequestParam(defaultValue = "REAL") Universe universe,
            @RequestParam(required = false) String strategy) {
        return ResponseEntity.ok(positionLedger.getOpenPositions(strategy, universe));
    }

    @GetMapping("/{ticker}")
    public ResponseEntity<Position> getPosition(
            @PathVariable String ticker, @RequestParam(defaultValue = "REAL") Universe universe) {
        return positionLedger.getPosition(ticker, universe)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Position", ticker));
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceSummary> getPerformance(
            @RequestParam(defaultValue = "REAL") Universe universe,
            @RequestParam(required = false) String strategy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PerformanceSummary summary = date != null
                ? positionLedger.getDailyPerformance(strategy, universe, date)
                : positionLedger.getPerformance(strategy, universe);
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/performance/all")
    public ResponseEntity<List<StrategyPerformanceBreakdown>> getAllPerformance() {
        return ResponseEntity.ok(positionLedger.getAllPerformance());
    }

    @GetMapping("/summary")
    public ResponseEntity<PositionSummary> getSummary(
            @RequestParam(defaultValue = "REAL") Universe universe,
            @RequestParam(required = false) String strategy) {
        return ResponseEntity.ok(reconciliationMonitor.getPositionSummary(strategy, universe));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<List<ReconciliationResult>> reconcile() {
        log.info("Manual reconciliation requested");
        return ResponseEntity.ok(reconciliationMonitor.reconcileAll());
    }

    @PostMapping("/simulated/reset")
    public ResponseEntity<Map<String, Integer>> resetSimulated(@RequestParam(defaultValue = "true") boolean backup) {
        int removed = positionLedger.clearSimulatedPositions(backup);
        log.info("Simulated ledger reset via API: {} rows removed (backup={})", removed, backup);
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
