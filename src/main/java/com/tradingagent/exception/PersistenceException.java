package com.tradingagent.exception;

import java.util.Map;

/**
 * A ledger file could not be written. The mutation that triggered the write is aborted and the
 * in-memory ledger keeps its previous state.
 */
public class PersistenceException extends AgentException {

    public PersistenceException(String message, String path, Throwable cause) {
        super(ErrorCode.LEDGER_WRITE_FAILED, message, Map.of("path", path), cause);
    }
}
