package com.toolgate.gateway.infrastructure.web;

import com.toolgate.lockdown.RepoAccessQueryException;
import com.toolgate.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the controllers to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "urn:toolgate:errors:bad-request",
 *   "title": "Bad Request",
 *   "status": 400,
 *   "detail": "lockdown mode requires owner and repo arguments",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authorization denials never get here; the pipeline writes those itself.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("urn:toolgate:errors:bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(RepoAccessQueryException.class)
    public ProblemDetail handleRepoAccessQuery(RepoAccessQueryException ex) {
        log.warn("Access facts unavailable for {}: {}", ex.repository(), ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY,
                "Could not determine access to " + ex.repository());
        problem.setTitle("Bad Gateway");
        problem.setType(URI.create("urn:toolgate:errors:upstream"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("urn:toolgate:errors:internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
