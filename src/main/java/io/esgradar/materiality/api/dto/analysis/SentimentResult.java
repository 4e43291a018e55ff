package io.esgradar.materiality.api.dto.analysis;

public record SentimentResult(
        SentimentLabel label,
        double confidence
) {
    public SentimentResult {
        label = label == null ? SentimentLabel.NEUTRAL : label;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static SentimentResult unknown() {
        return new SentimentResult(SentimentLabel.NEUTRAL, 0.0);
    }
}
