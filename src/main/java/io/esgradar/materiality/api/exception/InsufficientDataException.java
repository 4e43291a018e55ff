package io.esgradar.materiality.api.exception;

/**
 * Raised when a run has no usable article at all. Never retried locally.
 */
public class InsufficientDataException extends RuntimeException {

    private final ErrorCategory category;

    public InsufficientDataException(String message) {
        super(message);
        this.category = ErrorCategory.INSUFFICIENT_DATA;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
