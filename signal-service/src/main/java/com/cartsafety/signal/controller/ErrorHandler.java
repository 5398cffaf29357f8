package com.cartsafety.signal.controller;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.trace.TraceContextUtil;
import com.cartsafety.signal.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps the statistical core's exception taxonomy onto HTTP:
 * rejected input is 400, inconsistent data is 422, everything else 500.
 * Reporting-source failures do not arrive here; they become UNAVAILABLE results.
 */
@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InputValidationException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage(), ex.getComponent(), exchange);
    }

    @ExceptionHandler(DataInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleInconsistency(DataInconsistencyException ex, ServerWebExchange exchange) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "DATA_INCONSISTENCY", ex.getMessage(), ex.getComponent(),
            exchange);
    }

    /** Body decoding failures; validation thrown from a record constructor is unwrapped. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(ServerWebInputException ex, ServerWebExchange exchange) {
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof InputValidationException invalid) {
                return handleInvalidInput(invalid, exchange);
            }
            if (cause instanceof DataInconsistencyException inconsistent) {
                return handleInconsistency(inconsistent, exchange);
            }
        }
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getReason(), "RequestBody", exchange);
    }

    /** Framework rejections (unsupported media type, method not allowed) keep their status. */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        String code = ex.getStatusCode().is4xxClientError() ? "INVALID_REQUEST" : "INTERNAL_ERROR";
        return respond(ex.getStatusCode(), code, ex.getReason(), "SignalService", exchange);
    }

    @ExceptionHandler(SafetyEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineFailure(SafetyEngineException ex, ServerWebExchange exchange) {
        log.error("ENGINE_FAILURE component={} traceId={}", ex.getComponent(), traceId(exchange), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), ex.getComponent(),
            exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("UNEXPECTED_FAILURE traceId={}", traceId(exchange), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal error", "SignalService",
            exchange);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String code, String message,
                                                         String component, ServerWebExchange exchange) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(code, message, component, traceId(exchange)));
    }

    private static String traceId(ServerWebExchange exchange) {
        String traceId = exchange.getAttribute(TraceContextUtil.TRACE_ID_KEY);
        return traceId != null ? traceId : "unknown";
    }
}
