package com.vigil.monitorservice.infrastructure.web;

import com.vigil.batch.BatchJson;
import com.vigil.monitorservice.api.UnknownCheckTypeException;
import com.vigil.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses carrying a timestamp and the request's
 * correlation ID:
 *
 * <pre>
 * {
 *   "type": "https://vigil.dev/errors/bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "maxWorkers must be positive, got 0",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Check failures never reach this handler; they are reported inside the batch result.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, BatchJson.BatchJsonException.class})
    public ProblemDetail handleUnreadable(RuntimeException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed Request", "malformed-request",
                "Request body is not a valid batch document");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(UnknownCheckTypeException.class)
    public ProblemDetail handleUnknownCheckType(UnknownCheckTypeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://vigil.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
