package com.tradingagent.ledger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ledger storage settings. Prefix: {@code agent.ledger.*}.
 *
 * <p>{@code dataDir} holds {@code positions.json}, {@code simulated_positions.json}, quarantined
 * corrupt files and simulated-ledger backups.
 */
@Data
@Component
@ConfigurationProperties(prefix = "agent.ledger")
public class LedgerConfig {

    private String dataDir = "data";
}
