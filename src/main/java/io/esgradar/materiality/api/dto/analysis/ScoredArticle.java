package io.esgradar.materiality.api.dto.analysis;

import java.util.Set;

public record ScoredArticle(
        Article article,
        double relevanceScore,
        Set<String> matchedKeywords
) {
    public ScoredArticle {
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
    }
}
