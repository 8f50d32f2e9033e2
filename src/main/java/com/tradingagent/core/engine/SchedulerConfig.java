package com.tradingagent.core.engine;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strategy scheduler settings. Prefix: {@code agent.scheduler.*}.
 *
 * <p>{@code allocations} seeds the initial capital split by strategy name; strategies not listed
 * start with an equal share.
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent.scheduler")
public class SchedulerConfig {

    private boolean autoStart = true;
    private Duration defaultScanInterval = Duration.ofSeconds(300);
    private Duration housekeepingInterval = Duration.ofSeconds(300);
    private int rebalanceEveryCycles = 12;
    private int historyWindow = 10;
    private int minResultsForScoring = 3;
    private int maxHistory = 100;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private Map<String, Double> allocations = new HashMap<>();
}
