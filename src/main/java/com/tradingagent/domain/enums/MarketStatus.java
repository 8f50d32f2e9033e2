package com.tradingagent.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Market lifecycle as reported by the exchange. */
public enum MarketStatus {
    @JsonProperty("open")
    OPEN,
    @JsonProperty("closed")
    CLOSED,
    @JsonProperty("finalized")
    FINALIZED,
    @JsonProperty("settled")
    SETTLED,
    @JsonProperty("unknown")
    UNKNOWN
}
