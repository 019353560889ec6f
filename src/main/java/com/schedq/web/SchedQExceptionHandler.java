package com.schedq.web;

import com.schedq.exception.DuplicateResourceException;
import com.schedq.exception.InvalidCronExpressionException;
import com.schedq.exception.QueueBackendException;
import com.schedq.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps engine and queue errors of the REST controllers onto RFC 7807 problem responses.
 */
@RestControllerAdvice(assignableTypes = { SchedulerController.class, QueueController.class })
public class SchedQExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SchedQExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler(InvalidCronExpressionException.class)
    public ProblemDetail handleInvalidCron(InvalidCronExpressionException e) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid cron expression", e.getMessage());
        problem.setProperty("expression", e.getExpression());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleInvalidArgument(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid argument", e.getMessage());
    }

    @ExceptionHandler({ MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class })
    public ProblemDetail handleUnreadableRequest(Exception e) {
        return problem(HttpStatus.BAD_REQUEST, "Malformed request", e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleInvalidState(IllegalStateException e) {
        return problem(HttpStatus.CONFLICT, "Invalid state", e.getMessage());
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ProblemDetail handleDuplicate(DuplicateResourceException e) {
        return problem(HttpStatus.CONFLICT, "Conflict", e.getMessage());
    }

    @ExceptionHandler(QueueBackendException.class)
    public ProblemDetail handleQueueFailure(QueueBackendException e) {
        log.error("Queue backend failure", e);
        return problem(HttpStatus.BAD_GATEWAY, "Queue unavailable", e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStoreFailure(DataAccessException e) {
        log.error("Job store failure", e);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Job store unavailable", "The job store is unavailable");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
