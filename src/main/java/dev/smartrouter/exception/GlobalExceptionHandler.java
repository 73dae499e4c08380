package dev.smartrouter.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Internal exception messages are only exposed where they describe the caller's own
 * input or configuration. Stack traces are logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NoEligibleModelException.class)
    public ProblemDetail handleNoEligibleModel(NoEligibleModelException ex) {
        log.warn("Routing failed: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "no-eligible-model", "No Eligible Model",
                "No backend model is available to serve this request.");
    }

    @ExceptionHandler({IllegalArgumentException.class, BindException.class})
    public ProblemDetail handleBadConfiguration(RuntimeException ex) {
        log.warn("Rejected: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request",
                "Request body is not a valid chat-completion request.");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service Unavailable",
                "Backend temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred. Please try again later.");
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://smartrouter.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
