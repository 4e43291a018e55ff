package io.esgradar.materiality.api;

import io.esgradar.materiality.api.exception.ErrorCategory;
import io.esgradar.materiality.api.exception.ErrorResponse;
import io.esgradar.materiality.api.exception.InsufficientDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException ex) {
        logger.warn("Analysis rejected: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCategory(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        logger.warn("Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.INVALID_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        logger.warn("Malformed request payload: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.INVALID_REQUEST, "Malformed request payload");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        logger.error("Unhandled exception during analysis", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.UNKNOWN,
                "An unexpected error occurred: " + ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorCategory category, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), category, message));
    }
}
