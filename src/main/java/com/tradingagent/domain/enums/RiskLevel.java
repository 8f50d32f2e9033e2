package com.tradingagent.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Risk tiers selected from bankroll relative to the initial bankroll. */
@Getter
@RequiredArgsConstructor
public enum RiskLevel {
    TIGHT("tight"),
    CONSERVATIVE("conservative"),
    MODERATE("moderate"),
    MODERATE_AGGRESSIVE("moderate-aggressive"),
    AGGRESSIVE("aggressive");

    @JsonValue
    private final String label;
}
