package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Real and simulated performance of one strategy side by side. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyPerformanceBreakdown {

    private String strategy;
    private PerformanceSummary real;
    private PerformanceSummary simulated;
    private int combinedTrades;
    private BigDecimal combinedPnl;
}
