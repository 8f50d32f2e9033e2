package com.tradingagent.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ledger partition. REAL rows mirror orders placed on the exchange; SIMULATED rows come from
 * dry-run strategies and never touch the exchange.
 */
@Getter
@RequiredArgsConstructor
public enum Universe {
    REAL("positions.json"),
    SIMULATED("simulated_positions.json");

    private final String fileName;

    public boolean isSimulated() {
        return this == SIMULATED;
    }

    public static Universe of(boolean simulated) {
        return simulated ? SIMULATED : REAL;
    }
}
