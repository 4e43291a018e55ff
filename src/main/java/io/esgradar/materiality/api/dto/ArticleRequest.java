package io.esgradar.materiality.api.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.util.PublishedAtDeserializer;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * An already-labelled article as submitted by callers. {@code sentiment} accepts any label
 * {@link SentimentLabel#fromRaw} understands.
 */
public record ArticleRequest(
        String id,
        String title,
        String description,
        String content,
        String link,
        String source,
        @JsonDeserialize(using = PublishedAtDeserializer.class)
        LocalDateTime publishedAt,
        String sentiment,
        Double sentimentConfidence,
        List<String> matchedKeywords
) {
    public Article toArticle(int position) {
        return new Article(
                id != null && !id.isBlank() ? id : "article-" + position,
                title,
                description,
                content,
                link,
                source,
                publishedAt,
                SentimentLabel.fromRaw(sentiment),
                sentimentConfidence != null ? sentimentConfidence : 1.0,
                matchedKeywords != null ? Set.copyOf(matchedKeywords) : Set.of(),
                1
        );
    }
}
