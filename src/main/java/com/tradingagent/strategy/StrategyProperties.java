package com.tradingagent.strategy;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Per-strategy switches. Prefix: {@code agent.strategies.*}. */
@Data
@Component
@ConfigurationProperties(prefix = "agent.strategies")
public class StrategyProperties {

    private EdgeTaking edgeTaking = new EdgeTaking();
    private SignalFollow signalFollow = new SignalFollow();

    @Data
    public static class EdgeTaking {
        private boolean enabled = true;
        private boolean dryRun = true;
        private Duration scanInterval = Duration.ofSeconds(300);
        private int maxTradesPerCycle = 3;
        private double minEdge = 0.05;
    }

    @Data
    public static class SignalFollow {
        private boolean enabled = false;
        private boolean dryRun = true;
        private Duration pollInterval = Duration.ofSeconds(5);

        /** Upper bound on contracts copied from a single signal. */
        private int maxContracts = 10;
    }
}
