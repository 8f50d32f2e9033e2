package com.tradingagent.risk;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bankroll and circuit-breaker settings. Prefix: {@code agent.risk.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>initialBankroll: 100 (the reference for every tier boundary)</li>
 *   <li>dailyLossLimit: 0.20 of initial bankroll</li>
 *   <li>drawdownFloor: trading stops below 0.5 of initial bankroll</li>
 *   <li>minTradeDollars: sizes under $1 are not traded</li>
 *   <li>maxExposurePct: at most 25% of bankroll committed across open positions</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent.risk")
public class RiskSizingConfig {

    private BigDecimal initialBankroll = new BigDecimal("100");
    private double dailyLossLimit = 0.20;
    private double drawdownFloor = 0.5;
    private BigDecimal minTradeDollars = BigDecimal.ONE;
    private double maxExposurePct = 0.25;
}
