package com.tradingagent.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregate over closed ledger rows, optionally filtered by strategy and day. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSummary {

    private int totalTrades;
    private int winningTrades;
    private double winRate;
    private BigDecimal totalPnl;
    private int openPositions;
    private BigDecimal avgPnlPerTrade;

    public static PerformanceSummary empty() {
        return PerformanceSummary.builder()
                .totalPnl(BigDecimal.ZERO)
                .avgPnlPerTrade(BigDecimal.ZERO)
                .build();
    }
}
