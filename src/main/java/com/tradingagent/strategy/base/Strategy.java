package com.tradingagent.strategy.base;

import com.tradingagent.domain.enums.ExecutionMode;
import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.MarketSnapshot;
import com.tradingagent.domain.model.Opportunity;
import com.tradingagent.domain.model.PerformanceSummary;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A pluggable trading strategy run by the {@code StrategyScheduler}.
 *
 * <p>Cyclic strategies implement {@link #scan()} and {@link #execute(List)}; the scheduler calls
 * them in that order once per interval. Continuous strategies also override
 * {@link #getExecutionMode()} and {@link #runContinuously(CancellationToken)}, which the
 * scheduler starts once and stops through the token and {@link #cancel()}.
 */
public interface Strategy {

    // ---- Identity ----

    String getName();

    /** SIMULATED for dry-run strategies. */
    Universe getUniverse();

    // ---- Scheduling ----

    default ExecutionMode getExecutionMode() {
        return ExecutionMode.CYCLIC;
    }

    /** Sleep between cycles. Null uses the scheduler default. */
    default Duration getScanInterval() {
        return null;
    }

    // ---- Cyclic ----

    List<Opportunity> scan();

    /** @return number of trades placed */
    int execute(List<Opportunity> opportunities);

    // ---- Continuous ----

    /** Runs until {@code token} is cancelled. Only called for CONTINUOUS strategies. */
    default void runContinuously(CancellationToken token) {
        throw new UnsupportedOperationException(getName() + " has no continuous loop");
    }

    /** Shutdown hook, invoked by the scheduler when it stops. */
    default void cancel() {}

    // ---- Reporting ----

    PerformanceSummary getPerformance();

    /** Current view of a market this strategy trades, used to grade its open positions. */
    default Optional<MarketSnapshot> marketSnapshot(String ticker) {
        return Optional.empty();
    }
}
