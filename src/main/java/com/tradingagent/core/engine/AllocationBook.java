package com.tradingagent.core.engine;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Current capital fraction per strategy. Written by the scheduler, read by strategies. */
@Component
public class AllocationBook {

    private final Map<String, Double> allocations = new ConcurrentHashMap<>();

    /** Allocation of {@code strategy}; a strategy that was never registered gets the whole bankroll. */
    public double get(String strategy) {
        return allocations.getOrDefault(strategy, 1.0);
    }

    public void set(String strategy, double allocation) {
        allocations.put(strategy, allocation);
    }

    public synchronized void replaceAll(Map<String, Double> updated) {
        allocations.keySet().retainAll(updated.keySet());
        allocations.putAll(updated);
    }

    public Map<String, Double> snapshot() {
        return new TreeMap<>(allocations);
    }
}
