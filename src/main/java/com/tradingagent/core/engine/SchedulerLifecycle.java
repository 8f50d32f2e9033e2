package com.tradingagent.core.engine;

import com.tradingagent.ledger.LedgerConfig;
import com.tradingagent.strategy.base.Strategy;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Registers every {@link Strategy} bean with the scheduler when the context starts, and stops
 * the scheduler (exporting its results) when the context shuts down.
 *
 * <p>Strategies without a configured allocation share the remainder equally; the scheduler
 * normalizes the result on start.
 */
@Component
public class SchedulerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private static final String RESULTS_FILE = "strategy_results.json";

    private final StrategyScheduler strategyScheduler;
    private final ObjectProvider<Strategy> strategyProvider;
    private final SchedulerConfig schedulerConfig;
    private final LedgerConfig ledgerConfig;

    private volatile boolean running;

    public SchedulerLifecycle(
            StrategyScheduler strategyScheduler,
            ObjectProvider<Strategy> strategyProvider,
            SchedulerConfig schedulerConfig,
            LedgerConfig ledgerConfig) {
        this.strategyScheduler = strategyScheduler;
        this.strategyProvider = strategyProvider;
        this.schedulerConfig = schedulerConfig;
        this.ledgerConfig = ledgerConfig;
    }

    @Override
    public void start() {
        List<Strategy> strategies = strategyProvider.orderedStream().toList();
        if (strategies.isEmpty()) {
            log.warn("No strategies enabled, scheduler not started");
            running = true;
            return;
        }
        registerNew(strategies);
        strategyScheduler.start();
        running = true;
    }

    // A restart after stop() keeps the earlier registrations and their allocations
    private void registerNew(List<Strategy> strategies) {
        double configured = strategies.stream()
                .mapToDouble(s -> schedulerConfig.getAllocations().getOrDefault(s.getName(), 0.0))
                .sum();
        long unconfigured = strategies.stream()
                .filter(s -> !schedulerConfig.getAllocations().containsKey(s.getName()))
                .count();
        double share = unconfigured > 0 ? Math.max(0, 1.0 - configured) / unconfigured : 0;
        for (Strategy strategy : strategies) {
            if (strategyScheduler.isRegistered(strategy.getName())) {
                continue;
            }
            Double allocation = schedulerConfig.getAllocations().get(strategy.getName());
            strategyScheduler.register(strategy, allocation != null ? allocation : share);
        }
    }

    @Override
    public void stop() {
        if (strategyScheduler.isRunning()) {
            strategyScheduler.stop();
            try {
                strategyScheduler.exportResults(Paths.get(ledgerConfig.getDataDir(), RESULTS_FILE));
            } catch (RuntimeException e) {
                log.error("Could not export strategy results on shutdown: {}", e.getMessage(), e);
            }
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier: strategies wind down before other components
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return schedulerConfig.isAutoStart();
    }
}
