package com.tradingagent.domain.enums;

/** Contract side of a binary market. */
public enum Side {
    YES,
    NO;

    public Side opposite() {
        return this == YES ? NO : YES;
    }
}
