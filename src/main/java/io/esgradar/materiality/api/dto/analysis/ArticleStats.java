package io.esgradar.materiality.api.dto.analysis;

public record ArticleStats(
        int received,
        int accepted,
        int afterDeduplication
) {}
