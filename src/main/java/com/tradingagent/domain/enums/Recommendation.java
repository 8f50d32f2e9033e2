package com.tradingagent.domain.enums;

public enum Recommendation {
    HOLD,
    WATCH,
    HEDGE,
    EXIT,
    SETTLED
}
