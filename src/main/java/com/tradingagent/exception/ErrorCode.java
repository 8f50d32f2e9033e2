package com.tradingagent.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories surfaced over the API. {@code retryable} tells callers whether the same
 * request may succeed later without any change on their side.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_REQUEST(400, false),
    INVALID_POSITION(400, false),
    NOT_FOUND(404, false),
    DUPLICATE_STRATEGY(409, false),
    LEDGER_WRITE_FAILED(503, true),
    LEDGER_CORRUPT(500, false),
    EXCHANGE_UNAVAILABLE(502, true),
    INTERNAL_ERROR(500, false);

    private final int httpStatus;
    private final boolean retryable;
}
