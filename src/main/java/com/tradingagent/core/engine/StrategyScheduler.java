package com.tradingagent.core.engine;

import com.tradingagent.domain.enums.ExecutionMode;
import com.tradingagent.domain.model.HedgeRecommendation;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.domain.model.PerformanceSummary;
import com.tradingagent.domain.model.PositionAnalysis;
import com.tradingagent.domain.model.StrategyResult;
import com.tradingagent.exception.BusinessException;
import com.tradingagent.exception.ErrorCode;
import com.tradingagent.exception.PersistenceException;
import com.tradingagent.mapper.LedgerJson;
import com.tradingagent.reconciliation.ReconciliationMonitor;
import com.tradingagent.strategy.base.CancellationToken;
import com.tradingagent.strategy.base.Strategy;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every registered strategy on its own thread, plus one housekeeping thread.
 *
 * <p>Cyclic strategies run scan, then execute, then sleep for their interval. Continuous
 * strategies are handed the stop token and run their own loop. Any exception escaping a strategy
 * is caught at the loop boundary, logged with the strategy name and recorded as an error result;
 * the loop resumes after one interval. No strategy can stop another or the scheduler.
 *
 * <p>Housekeeping reconciles each strategy's positions with the exchange, grades its open
 * positions, and every {@code rebalanceEveryCycles} cycles rebalances allocations.
 *
 * <p>Stopping raises the shared {@link CancellationToken}, which wakes every sleeping loop, calls
 * each strategy's cancel hook and waits for the threads to finish their in-flight work.
 */
@Service
public class StrategyScheduler {

    private static final Logger log = LoggerFactory.getLogger(StrategyScheduler.class);

    private final Map<String, Strategy> strategies = new ConcurrentHashMap<>();
    private final Map<String, Deque<StrategyResult>> history = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastCumulativePnl = new ConcurrentHashMap<>();
    private final List<Thread> workers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong housekeepingCycles = new AtomicLong();

    private final AllocationBook allocationBook;
    private final ReconciliationMonitor reconciliationMonitor;
    private final SchedulerConfig schedulerConfig;
    private final AllocationOptimizer allocationOptimizer;
    private final Clock clock;

    private volatile CancellationToken stopToken = new CancellationToken();

    public StrategyScheduler(
            AllocationBook allocationBook,
            ReconciliationMonitor reconciliationMonitor,
            SchedulerConfig schedulerConfig,
            Clock clock) {
        this.allocationBook = allocationBook;
        this.reconciliationMonitor = reconciliationMonitor;
        this.schedulerConfig = schedulerConfig;
        this.allocationOptimizer =
                new AllocationOptimizer(schedulerConfig.getHistoryWindow(), schedulerConfig.getMinResultsForScoring());
        this.clock = clock;
    }

    // ========================
    // REGISTRATION AND LIFECYCLE
    // ========================

    public void register(Strategy strategy, double initialAllocation) {
        if (strategies.putIfAbsent(strategy.getName(), strategy) != null) {
            throw new BusinessException(
                    ErrorCode.DUPLICATE_STRATEGY, "Strategy already registered: " + strategy.getName());
        }
        history.put(strategy.getName(), new ArrayDeque<>());
        allocationBook.set(strategy.getName(), initialAllocation);
        log.info("Registered strategy {} ({}, {}, allocation {})", strategy.getName(), strategy.getExecutionMode(),
                strategy.getUniverse(), initialAllocation);
    }

    public boolean isRegistered(String name) {
        return strategies.containsKey(name);
    }

    /** Starts one thread per strategy and the housekeeping thread. Returns immediately. */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        CancellationToken token = new CancellationToken();
        stopToken = token;
        allocationBook.replaceAll(allocationOptimizer.clampAndNormalize(allocationBook.snapshot()));

        for (Strategy strategy : strategies.values()) {
            spawn("strategy-" + strategy.getName(), () -> strategyLoop(strategy, token));
        }
        spawn("strategy-housekeeping", () -> housekeepingLoop(token));
        log.info("Scheduler started with {} strategies, allocations {}", strategies.size(), allocationBook.snapshot());
    }

    /** Starts the scheduler and blocks until {@link #stop()} is called. */
    public void run() {
        start();
        CancellationToken token = stopToken;
        while (!token.isCancelled()) {
            token.awaitCancellation(Duration.ofSeconds(1));
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping scheduler");
        stopToken.cancel();
        for (Strategy strategy : strategies.values()) {
            try {
                strategy.cancel();
            } catch (RuntimeException e) {
                log.error("Cancel hook of {} failed: {}", strategy.getName(), e.getMessage(), e);
            }
        }
        long deadline = System.currentTimeMillis() + schedulerConfig.getShutdownTimeout().toMillis();
        for (Thread worker : workers) {
            try {
                worker.join(Math.max(1, deadline - System.currentTimeMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (worker.isAlive()) {
                log.warn("Thread {} still running after shutdown timeout", worker.getName());
            }
        }
        workers.clear();
        log.info("Scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========================
    // LOOPS
    // ========================

    private void strategyLoop(Strategy strategy, CancellationToken token) {
        Duration interval = intervalFor(strategy);
        while (!token.isCancelled()) {
            try {
                if (strategy.getExecutionMode() == ExecutionMode.CONTINUOUS) {
                    strategy.runContinuously(token);
                    if (!token.isCancelled()) {
                        log.warn("Continuous strategy {} returned, restarting after {}s",
                                strategy.getName(), interval.toSeconds());
                    }
                } else {
                    runCycle(strategy);
                }
            } catch (Exception e) {
                log.error("Strategy {} failed: {}", strategy.getName(), e.getMessage(), e);
                recordResult(StrategyResult.builder()
                        .strategyName(strategy.getName())
                        .completedAt(LocalDateTime.now(clock))
                        .errors(new ArrayList<>(List.of(String.valueOf(e.getMessage()))))
                        .build());
            }
            if (token.awaitCancellation(interval)) {
                break;
            }
        }
        log.info("Strategy {} loop exited", strategy.getName());
    }

    private void housekeepingLoop(CancellationToken token) {
        while (!token.isCancelled()) {
            try {
                runHousekeeping();
            } catch (Exception e) {
                log.error("Housekeeping failed: {}", e.getMessage(), e);
            }
            if (token.awaitCancellation(schedulerConfig.getHousekeepingInterval())) {
                break;
            }
        }
    }

    /** One scan-then-execute cycle of a cyclic strategy. */
    public StrategyResult runCycle(Strategy strategy) {
        Instant started = clock.instant();
        List<Opportunity> opportunities = strategy.scan();
        int executed = strategy.execute(opportunities);
        StrategyResult result = snapshotResult(strategy, opportunities.size(), executed, started);
        recordResult(result);
        log.info("Cycle {}: {} opportunities, {} executed, P&L ${}, win rate {}",
                strategy.getName(), result.getOpportunitiesFound(), result.getTradesExecuted(),
                result.getProfitLoss(), String.format("%.2f", result.getWinRate()));
        return result;
    }

    /** One housekeeping pass: reconcile and grade per strategy, then rebalance when due. */
    public void runHousekeeping() {
        long cycle = housekeepingCycles.incrementAndGet();
        for (Strategy strategy : strategies.values()) {
            try {
                reconciliationMonitor.syncWithExchange(strategy.getName(), strategy.getUniverse());
                List<PositionAnalysis> analyses = reconciliationMonitor.checkAllPositions(
                        strategy.getName(), strategy.getUniverse(), strategy::marketSnapshot);
                List<HedgeRecommendation> hedges = reconciliationMonitor.generateHedgeRecommendations(analyses);
                for (HedgeRecommendation hedge : hedges) {
                    log.info("Hedge suggestion for {}: buy {} x{} {} ({})", strategy.getName(),
                            hedge.getHedgeSide(), hedge.getHedgeSize(), hedge.getTicker(), hedge.getReason());
                }
                if (strategy.getExecutionMode() == ExecutionMode.CONTINUOUS) {
                    recordResult(snapshotResult(strategy, 0, 0, clock.instant()));
                }
            } catch (Exception e) {
                log.error("Housekeeping for {} failed: {}", strategy.getName(), e.getMessage(), e);
            }
        }
        if (cycle % schedulerConfig.getRebalanceEveryCycles() == 0) {
            optimizeAllocations();
        }
    }

    // ========================
    // RESULTS AND ALLOCATIONS
    // ========================

    public Map<String, Double> optimizeAllocations() {
        Map<String, Double> updated = allocationOptimizer.optimize(allocationBook.snapshot(), getAllResults());
        allocationBook.replaceAll(updated);
        return updated;
    }

    public Map<String, Double> getAllocations() {
        return allocationBook.snapshot();
    }

    public List<StrategyResult> getHistory(String strategy) {
        Deque<StrategyResult> results = history.get(strategy);
        if (results == null) {
            return List.of();
        }
        synchronized (results) {
            return new ArrayList<>(results);
        }
    }

    public Map<String, List<StrategyResult>> getAllResults() {
        Map<String, List<StrategyResult>> all = new LinkedHashMap<>();
        history.keySet().stream().sorted().forEach(name -> all.put(name, getHistory(name)));
        return all;
    }

    /** Strategy with the highest cumulative P&L over its recorded results. */
    public Optional<String> getBestStrategy() {
        return getAllResults().entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .max(Comparator.comparing(e -> e.getValue().stream()
                        .map(StrategyResult::getProfitLoss)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)))
                .map(Map.Entry::getKey);
    }

    public List<Strategy> getStrategies() {
        return strategies.values().stream().sorted(Comparator.comparing(Strategy::getName)).toList();
    }

    public SchedulerReport exportResults() {
        return SchedulerReport.builder()
                .exportedAt(LocalDateTime.now(clock))
                .allocations(getAllocations())
                .results(getAllResults())
                .bestStrategy(getBestStrategy().orElse(null))
                .housekeepingCycles(housekeepingCycles.get())
                .build();
    }

    /** Writes {@link #exportResults()} as JSON to {@code file}. */
    public void exportResults(Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.write(file, LedgerJson.writeReport(exportResults()));
            log.info("Strategy results exported to {}", file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to export strategy results", file.toString(), e);
        }
    }

    void recordResult(StrategyResult result) {
        Deque<StrategyResult> results = history.computeIfAbsent(result.getStrategyName(), k -> new ArrayDeque<>());
        synchronized (results) {
            results.addLast(result);
            while (results.size() > schedulerConfig.getMaxHistory()) {
                results.removeFirst();
            }
        }
    }

    private StrategyResult snapshotResult(Strategy strategy, int found, int executed, Instant started) {
        PerformanceSummary performance = strategy.getPerformance();
        BigDecimal cumulative = performance.getTotalPnl() != null ? performance.getTotalPnl() : BigDecimal.ZERO;
        BigDecimal previous = lastCumulativePnl.put(strategy.getName(), cumulative);
        BigDecimal delta = previous != null ? cumulative.subtract(previous) : cumulative;
        return StrategyResult.builder()
                .strategyName(strategy.getName())
                .opportunitiesFound(found)
                .tradesExecuted(executed)
                .profitLoss(delta)
                .winRate(performance.getWinRate())
                .runtime(Duration.between(started, clock.instant()))
                .completedAt(LocalDateTime.now(clock))
                .build();
    }

    private Duration intervalFor(Strategy strategy) {
        Duration interval = strategy.getScanInterval();
        return interval != null ? interval : schedulerConfig.getDefaultScanInterval();
    }

    private void spawn(String name, Runnable loop) {
        Thread thread = new Thread(loop, name);
        thread.setDaemon(true);
        workers.add(thread);
        thread.start();
    }
}
