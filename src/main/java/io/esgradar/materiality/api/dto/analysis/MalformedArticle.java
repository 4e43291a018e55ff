package io.esgradar.materiality.api.dto.analysis;

import io.esgradar.materiality.api.exception.ErrorCategory;

public record MalformedArticle(
        String articleId,
        String title,
        ErrorCategory reason,
        String message
) {}
