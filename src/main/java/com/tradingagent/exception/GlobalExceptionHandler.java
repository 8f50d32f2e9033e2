package com.tradingagent.exception;

import com.tradingagent.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions escaping the REST controllers to {@link ApiErrorResponse}.
 *
 * <p>Exchange outages answer 502 with a {@code Retry-After} hint. Ledger failures are logged with
 * the file involved; a corrupt ledger needs an operator, a failed write can be retried.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String EXCHANGE_RETRY_AFTER_SECONDS = "30";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String message = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
        return respond(ErrorCode.INVALID_REQUEST, message, Map.of(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, ex.getMessage(), Map.of(), request);
    }

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ApiErrorResponse> handleExchange(ExchangeException ex, HttpServletRequest request) {
        log.warn("Exchange unavailable while serving {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(ex.getErrorCode().getHttpStatus())
                .header(HttpHeaders.RETRY_AFTER, EXCHANGE_RETRY_AFTER_SECONDS)
                .body(body(ex.getErrorCode(), ex.getMessage(), ex.getContext(), request));
    }

    @ExceptionHandler({PersistenceException.class, CorruptStateException.class})
    public ResponseEntity<ApiErrorResponse> handleLedger(AgentException ex, HttpServletRequest request) {
        log.error("Ledger failure ({}) at {}: {}", ex.getErrorCode(), ex.getContext().get("path"), ex.getMessage(), ex);
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getContext(), request);
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ApiErrorResponse> handleAgent(AgentException ex, HttpServletRequest request) {
        log.warn("Request {} rejected ({}): {}", request.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getContext(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error serving {}", request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", Map.of(), request);
    }

    private ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> context, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body(errorCode, message, context, request));
    }

    private ApiErrorResponse body(
            ErrorCode errorCode, String message, Map<String, Object> context, HttpServletRequest request) {
        return ApiErrorResponse.of(errorCode, message, context, request.getRequestURI(), clock.instant());
    }
}
