package com.bastion.rbacservice.infrastructure.web;

import com.bastion.database.StoreUnavailableException;
import com.bastion.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException}: 400, the caller sent a malformed tenant or identifier
 *   <li>unparseable bodies and query parameters: 400
 *   <li>Spring MVC's own {@link ErrorResponse} exceptions (unknown route, wrong method): their
 *       status
 *   <li>{@link StoreUnavailableException}: 503 with {@code Retry-After}
 *   <li>anything else: 500 without internals
 * </ul>
 *
 * <p>Every problem carries the correlation ID and a timestamp.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Retry hint when the failure carries none (pool exhaustion, store failure). */
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(5);

    private static final String ERROR_BASE = "https://bastion.dev/errors/";

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
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

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                "bad-request",
                "Malformed request body or parameter");
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("Store unavailable ({}): {}", ex.reason(), ex.getMessage());
        Duration retryAfter = ex.retryAfter().orElse(DEFAULT_RETRY_AFTER);
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);

        ProblemDetail problem =
                problem(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        "Service Unavailable",
                        "store-unavailable",
                        "The backing store is temporarily unavailable");
        problem.setProperty("reason", ex.reason().name());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
                .body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            ProblemDetail body = errorResponse.getBody();
            body.setProperty("timestamp", Instant.now().toString());
            return body;
        }
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
