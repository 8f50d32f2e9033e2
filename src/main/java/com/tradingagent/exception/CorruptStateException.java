package com.tradingagent.exception;

import java.util.Map;

/** A ledger file exists but cannot be parsed, or holds rows that are not valid positions. */
public class CorruptStateException extends AgentException {

    public CorruptStateException(String path, Throwable cause) {
        super(ErrorCode.LEDGER_CORRUPT, "Unreadable ledger file: " + path, Map.of("path", path), cause);
    }

    public CorruptStateException(String path, String reason) {
        super(ErrorCode.LEDGER_CORRUPT, "Invalid ledger file " + path + ": " + reason,
                Map.of("path", path, "reason", reason), null);
    }
}
