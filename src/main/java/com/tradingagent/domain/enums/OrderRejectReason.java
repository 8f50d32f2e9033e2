package com.tradingagent.domain.enums;

/**
 * Why the exchange refused an order. The gateway maps its wire errors onto these values so the
 * retry logic never has to inspect message text.
 */
public enum OrderRejectReason {
    MARKET_NOT_FOUND,
    MARKET_CLOSED,
    INSUFFICIENT_FUNDS,
    INVALID_ORDER,
    UNKNOWN
}
