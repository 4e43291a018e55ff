package io.esgradar.materiality.api.exception;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;

public record ErrorResponse(
        int status,
        ErrorCategory category,
        String message,
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime timestamp
) {
    public static ErrorResponse of(int status, ErrorCategory category, String message) {
        return new ErrorResponse(status, category, message, LocalDateTime.now());
    }
}
