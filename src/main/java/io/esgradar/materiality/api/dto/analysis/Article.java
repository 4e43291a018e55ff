package io.esgradar.materiality.api.dto.analysis;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A news article with its externally supplied sentiment.
 *
 * <p>{@code matchedKeywords} records which search keywords retrieved the article and
 * {@code mentionCount} how many near-duplicate reports it stands for after deduplication.
 */
public record Article(
        String id,
        String title,
        String description,
        String content,
        String link,
        String source,
        LocalDateTime publishedAt,
        SentimentLabel sentiment,
        double sentimentConfidence,
        Set<String> matchedKeywords,
        int mentionCount
) {
    public Article {
        title = title == null ? "" : title.trim();
        description = description == null ? "" : description.trim();
        content = content == null ? "" : content.trim();
        sentiment = sentiment == null ? SentimentLabel.NEUTRAL : sentiment;
        sentimentConfidence = Math.max(0.0, Math.min(1.0, sentimentConfidence));
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
        mentionCount = Math.max(1, mentionCount);
    }

    public static Article of(String id, String title, String content,
                             LocalDateTime publishedAt, SentimentLabel sentiment) {
        return new Article(id, title, "", content, null, null, publishedAt,
                sentiment, 1.0, Set.of(), 1);
    }

    /**
     * Body text used for scoring: the full content, or the description when no content was fetched.
     */
    public String body() {
        return content.isBlank() ? description : content;
    }

    public String fullText() {
        return title + " " + body();
    }

    /**
     * Folds a near-duplicate into this article, keeping this article's text.
     */
    public Article mergedWith(Article duplicate) {
        Set<String> keywords = new LinkedHashSet<>(matchedKeywords);
        keywords.addAll(duplicate.matchedKeywords());

        return new Article(id, title, description, content, link, source, publishedAt,
                sentiment, sentimentConfidence, keywords, mentionCount + duplicate.mentionCount());
    }

    public Article withSentiment(SentimentResult result) {
        return new Article(id, title, description, content, link, source, publishedAt,
                result.label(), result.confidence(), matchedKeywords, mentionCount);
    }
}
