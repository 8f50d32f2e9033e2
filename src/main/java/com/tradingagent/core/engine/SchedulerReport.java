package com.tradingagent.core.engine;

import com.tradingagent.domain.model.StrategyResult;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Snapshot of scheduler state, exported on shutdown and served over the API. */
@Value
@Builder
public class SchedulerReport {

    LocalDateTime exportedAt;
    Map<String, Double> allocations;
    Map<String, List<StrategyResult>> results;
    String bestStrategy;
    long housekeepingCycles;
}
