package com.tradingagent.exception;

/** A request that conflicts with agent state or fails validation. */
public class BusinessException extends AgentException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
