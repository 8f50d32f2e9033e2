package com.tradingagent.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of one strategy cycle, kept in the scheduler's trailing history. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyResult {

    private String strategyName;
    private int opportunitiesFound;
    private int tradesExecuted;

    @Builder.Default
    private BigDecimal profitLoss = BigDecimal.ZERO;

    private double winRate;
    private Duration runtime;
    private LocalDateTime completedAt;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
