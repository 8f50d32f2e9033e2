package com.tradingagent.api.controller;

import com.tradingagent.core.engine.SchedulerReport;
import com.tradingagent.core.engine.StrategyScheduler;
import com.tradingagent.domain.model.StrategyResult;
import com.tradingagent.exception.ResourceNotFoundException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Scheduler state: registered strategies, their results and capital allocations. */
@RestController
@RequestMapping("/api/strategies")
public class StrategyController {

    private final StrategyScheduler strategyScheduler;

    public StrategyController(StrategyScheduler strategyScheduler) {
        this.strategyScheduler = strategyScheduler;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listStrategies() {
        Map<String, Double> allocations = strategyScheduler.getAllocations();
        List<Map<String, Object>> strategies = strategyScheduler.getStrategies().stream()
                .map(s -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("name", s.getName());
                    row.put("mode", s.getExecutionMode());
                    row.put("universe", s.getUniverse());
                    row.put("allocation", allocations.get(s.getName()));
                    row.put("performance", s.getPerformance());
                    return row;
                })
                .toList();
        return ResponseEntity.ok(strategies);
    }

    @GetMapping("/{name}/results")
    public ResponseEntity<List<StrategyResult>> getResults(@PathVariable String name) {
        if (strategyScheduler.getStrategies().stream().noneMatch(s -> s.getName().equals(name))) {
            throw new ResourceNotFoundException("Strategy", name);
        }
        return ResponseEntity.ok(strategyScheduler.getHistory(name));
    }

    @GetMapping("/allocations")
    public ResponseEntity<Map<String, Double>> getAllocations() {
        return ResponseEntity.ok(strategyScheduler.getAllocations());
    }

    @PostMapping("/allocations/optimize")
    public ResponseEntity<Map<String, Double>> optimizeAllocations() {
        return ResponseEntity.ok(strategyScheduler.optimizeAllocations());
    }

    @GetMapping("/best")
    public ResponseEntity<Map<String, String>> getBestStrategy() {
        String best = strategyScheduler.getBestStrategy()
                .orElseThrow(() -> new ResourceNotFoundException("Strategy results", "best"));
        return ResponseEntity.ok(Map.of("strategy", best));
    }

    @GetMapping("/export")
    public ResponseEntity<SchedulerReport> export() {
        return ResponseEntity.ok(strategyScheduler.exportResults());
    }
}
