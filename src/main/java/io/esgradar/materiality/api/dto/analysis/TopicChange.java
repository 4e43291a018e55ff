package io.esgradar.materiality.api.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Movement of one prior topic between its recorded priority and current news relevance.
 *
 * @param changeMagnitude current score minus normalized prior score, within [-1, 1]
 * @param mentionRank     1-based rank by relevant-article count across the run, 0 until ranked
 */
public record TopicChange(
        Topic topic,
        int previousPriority,
        double currentScore,
        double changeMagnitude,
        ChangeType changeType,
        double confidence,
        List<String> reasons,
        TrendDirection trendDirection,
        NewsMetrics newsMetrics,
        int mentionRank
) {
    public TopicChange {
        changeMagnitude = Math.max(-1.0, Math.min(1.0, changeMagnitude));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        trendDirection = trendDirection == null ? TrendDirection.STABLE : trendDirection;
    }

    public String topicName() {
        return topic.name();
    }

    public TopicChange withMentionRank(int rank) {
        return new TopicChange(topic, previousPriority, currentScore, changeMagnitude, changeType,
                confidence, reasons, trendDirection, newsMetrics, rank);
    }

    /**
     * Positive when the topic is mentioned less than its prior rank suggests.
     */
    @JsonProperty("priorityShift")
    public int priorityShift() {
        return mentionRank > 0 ? mentionRank - previousPriority : 0;
    }
}
