package io.tabdeck.board.app;

import io.tabdeck.board.domain.RestartInProgressException;
import io.tabdeck.board.domain.TabNotFoundException;
import io.tabdeck.board.domain.TabNotRestartableException;
import io.tabdeck.status.restart.RestartUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps board failures onto {@code {"error": "..."}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TabNotFoundException.class)
    public ResponseEntity<ErrorResponse> tabNotFound(TabNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(TabNotRestartableException.class)
    public ResponseEntity<ErrorResponse> tabNotRestartable(TabNotRestartableException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(RestartInProgressException.class)
    public ResponseEntity<ErrorResponse> restartInProgress(RestartInProgressException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> badArgument(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid value for " + e.getName() + ": " + e.getValue());
    }

    @ExceptionHandler(RestartUnavailableException.class)
    public ResponseEntity<ErrorResponse> unavailable(RestartUnavailableException e) {
        log.error("[REST] request failed: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        log.debug("[REST] -> status={} error={}", status.value(), message);
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
