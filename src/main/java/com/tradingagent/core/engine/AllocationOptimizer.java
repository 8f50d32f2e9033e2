package com.tradingagent.core.engine;

import com.tradingagent.domain.model.StrategyResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebalances capital toward strategies that have been doing well.
 *
 * <p>A strategy with at least {@code minResults} results is scored on its last
 * {@code window} results as {@code 0.7 * avg(P&L) + 0.3 * avg(win rate) * 100}. Scores are
 * shifted by {@code |min score|} and normalized into weights, then blended into the previous
 * allocation as {@code 0.7 * old + 0.3 * weight}. The result is projected onto allocations that
 * sum to 1 with each inside [0.1, 0.9]; with more than ten strategies the lower bound becomes
 * {@code 1/n}, and a single strategy always gets 1.0.
 */
public class AllocationOptimizer {

    private static final Logger log = LoggerFactory.getLogger(AllocationOptimizer.class);

    static final double MIN_ALLOCATION = 0.1;
    static final double MAX_ALLOCATION = 0.9;
    private static final double PNL_WEIGHT = 0.7;
    private static final double WIN_RATE_WEIGHT = 0.3;
    private static final double SMOOTHING = 0.7;
    private static final int PROJECTION_ITERATIONS = 200;

    private final int window;
    private final int minResults;

    public AllocationOptimizer(int window, int minResults) {
        this.window = window;
        this.minResults = minResults;
    }

    public Map<String, Double> optimize(Map<String, Double> current, Map<String, List<StrategyResult>> history) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String strategy : current.keySet()) {
            List<StrategyResult> results = history.getOrDefault(strategy, List.of());
            if (results.size() >= minResults) {
                scores.put(strategy, score(results.subList(Math.max(0, results.size() - window), results.size())));
            }
        }
        if (scores.isEmpty()) {
            log.debug("No strategy has {} results yet, keeping allocations", minResults);
            return clampAndNormalize(current);
        }

        double shift = Math.abs(scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(0));
        double total = scores.values().stream().mapToDouble(s -> s + shift).sum();

        Map<String, Double> blended = new LinkedHashMap<>(current);
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            double weight = total > 0 ? (entry.getValue() + shift) / total : 1.0 / scores.size();
            double previous = current.getOrDefault(entry.getKey(), 0.0);
            blended.put(entry.getKey(), SMOOTHING * previous + (1 - SMOOTHING) * weight);
        }
        Map<String, Double> updated = clampAndNormalize(blended);
        log.info("Allocations rebalanced: scores={} -> {}", scores, updated);
        return updated;
    }

    /**
     * Projects {@code raw} onto allocations summing to 1 within the bounds, keeping the relative
     * order of the inputs.
     */
    public Map<String, Double> clampAndNormalize(Map<String, Double> raw) {
        int n = raw.size();
        Map<String, Double> result = new LinkedHashMap<>();
        if (n == 0) {
            return result;
        }
        double lower = Math.min(MIN_ALLOCATION, 1.0 / n);
        double upper = Math.max(MAX_ALLOCATION, 1.0 / n);

        double sum = raw.values().stream().mapToDouble(v -> Math.max(0, v)).sum();
        Map<String, Double> normalized = new LinkedHashMap<>();
        raw.forEach((k, v) -> normalized.put(k, sum > 0 ? Math.max(0, v) / sum : 1.0 / n));

        // Find shift so that sum(clamp(v + shift)) == 1; the clamped sum is monotone in the shift.
        double lo = -1.0;
        double hi = 1.0;
        for (int i = 0; i < PROJECTION_ITERATIONS; i++) {
            double mid = (lo + hi) / 2;
            if (clampedSum(normalized, mid, lower, upper) > 1.0) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        double shift = (lo + hi) / 2;
        normalized.forEach((k, v) -> result.put(k, clamp(v + shift, lower, upper)));

        // Push the rounding residue into one entry that has room for it.
        double residue = 1.0 - result.values().stream().mapToDouble(Double::doubleValue).sum();
        if (residue != 0) {
            for (Map.Entry<String, Double> entry : result.entrySet()) {
                double adjusted = entry.getValue() + residue;
                if (adjusted >= lower && adjusted <= upper) {
                    entry.setValue(adjusted);
                    break;
                }
            }
        }
        return result;
    }

    private static double score(List<StrategyResult> results) {
        double avgPnl = results.stream().mapToDouble(r -> r.getProfitLoss().doubleValue()).average().orElse(0);
        double avgWinRate = results.stream().mapToDouble(StrategyResult::getWinRate).average().orElse(0);
        return PNL_WEIGHT * avgPnl + WIN_RATE_WEIGHT * avgWinRate * 100;
    }

    private static double clampedSum(Map<String, Double> values, double shift, double lower, double upper) {
        return values.values().stream().mapToDouble(v -> clamp(v + shift, lower, upper)).sum();
    }

    private static double clamp(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }
}
