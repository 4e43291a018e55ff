package io.esgradar.materiality.api.exception;

public enum ErrorCategory {
    INSUFFICIENT_DATA,   // No usable articles for the run
    MISSING_TITLE,       // Article without a title
    MISSING_BODY,        // Article without description or content
    INVALID_REQUEST,     // Malformed assessment or request body
    TIMEOUT,             // Connection/read timeout
    CONNECTION_REFUSED,  // Connection refused
    DNS_ERROR,           // Unknown host
    NETWORK_ERROR,       // Other network issues
    IO_ERROR,            // I/O problems
    INVALID_URL,         // Malformed feed URL
    NOT_FOUND,           // 404
    ACCESS_FORBIDDEN,    // 403
    AUTH_REQUIRED,       // 401
    SERVER_ERROR,        // 500
    SERVER_UNAVAILABLE,  // 502, 503, 504
    HTTP_ERROR,          // Other 4xx/5xx
    PARSE_ERROR,         // Feed XML could not be parsed
    RATE_LIMITED,        // 429
    UNKNOWN;

    /**
     * Categories worth another attempt against the same feed.
     */
    public boolean isTransient() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, IO_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED -> true;
            default -> false;
        };
    }
}
