package com.tradingagent.exception;

import java.util.Map;
import lombok.Getter;

/** Root of the agent's unchecked exceptions; each carries the {@link ErrorCode} the API reports. */
@Getter
public abstract class AgentException extends RuntimeException {

    private final ErrorCode errorCode;

    /** Extra context for operators, such as the ledger file involved. Never null. */
    private final Map<String, Object> context;

    protected AgentException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected AgentException(ErrorCode errorCode, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? context : Map.of();
    }
}
