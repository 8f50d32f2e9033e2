package com.tradingagent.reconciliation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position monitor thresholds. Prefix: {@code agent.monitor.*}.
 *
 * <p>Percentages are fractions of the entry price: {@code takeProfitPct = 0.50} exits once the
 * held side is up 50%.
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent.monitor")
public class MonitorConfig {

    private double edgeThreshold = 0.05;
    private double takeProfitPct = 0.50;
    private double stopLossPct = -0.30;

    /** Edge above which a position is simply held. */
    private double holdEdge = 0.15;

    /** Minimum absolute move before a weak-edge position is hedged. */
    private double hedgeMovePct = 0.10;

    private int baseHedgeSize = 5;
}
