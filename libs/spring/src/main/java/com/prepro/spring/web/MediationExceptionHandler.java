package com.prepro.spring.web;

import com.prepro.mediation.AttributeAssignmentException;
import com.prepro.mediation.AuthorizationException;
import com.prepro.mediation.RecordNotFoundException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps mediation errors to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://prepro.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Not authorized to update Article",
 *   "operation": "update",
 *   "recordType": "Article",
 *   "timestamp": "2024-06-15T12:00:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class MediationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MediationExceptionHandler.class);
    private static final String ERROR_BASE = "https://prepro.dev/errors/";

    @ExceptionHandler(AuthorizationException.class)
    public ProblemDetail handleAuthorization(AuthorizationException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
        problem.setProperty("operation", ex.operation().label());
        problem.setProperty("recordType", ex.recordType().getSimpleName());
        return problem;
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ProblemDetail handleNotFound(RecordNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
        problem.setProperty("recordType", ex.recordType().getSimpleName());
        return problem;
    }

    @ExceptionHandler(AttributeAssignmentException.class)
    public ProblemDetail handleAssignment(AttributeAssignmentException ex) {
        log.warn("Unprocessable attributes: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Entity", "unprocessable", ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
