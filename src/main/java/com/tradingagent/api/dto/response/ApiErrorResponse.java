package com.tradingagent.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradingagent.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Error envelope written by {@code GlobalExceptionHandler}. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiErrorResponse {

    boolean success;

    /** {@link ErrorCode} name. */
    String error;

    String message;

    /** True when repeating the request later may succeed (exchange outage, failed ledger write). */
    boolean retryable;

    Map<String, Object> context;
    String path;
    Instant timestamp;

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> context, String path, Instant timestamp) {
        return ApiErrorResponse.builder()
                .success(false)
                .error(errorCode.name())
                .message(message)
                .retryable(errorCode.isRetryable())
                .context(context)
                .path(path)
                .timestamp(timestamp)
                .build();
    }
}
