package com.tradingagent.exception;

import java.util.Map;

/**
 * Raised by an {@code ExchangeGateway} when a call to the exchange fails outright
 * (transport error, unexpected payload). Order rejections are not exceptions; they come back
 * as an {@code OrderResult} with a reject reason.
 */
public class ExchangeException extends AgentException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message, Map.of(), cause);
    }
}
