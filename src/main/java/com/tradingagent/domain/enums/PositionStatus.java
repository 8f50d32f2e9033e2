package com.tradingagent.domain.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Lifecycle of a ledger row. Serialized in lowercase to stay compatible with existing ledger files. */
public enum PositionStatus {
    @JsonProperty("open")
    OPEN,
    @JsonProperty("closed")
    CLOSED,
    @JsonProperty("cancelled")
    CANCELLED
}
