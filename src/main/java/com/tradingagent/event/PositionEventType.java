package com.tradingagent.event;

public enum PositionEventType {
    OPENED,
    CLOSED
}
