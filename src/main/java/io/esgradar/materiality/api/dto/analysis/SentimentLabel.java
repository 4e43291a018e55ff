package io.esgradar.materiality.api.dto.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    private static final Logger logger = LoggerFactory.getLogger(SentimentLabel.class);

    // classifier output uses LABEL_0 = positive, LABEL_1 = negative, LABEL_2 = neutral
    private static final Map<String, SentimentLabel> RAW_LABELS = Map.ofEntries(
            Map.entry("POSITIVE", POSITIVE),
            Map.entry("POS", POSITIVE),
            Map.entry("LABEL_0", POSITIVE),
            Map.entry("0", POSITIVE),
            Map.entry("긍정", POSITIVE),
            Map.entry("NEGATIVE", NEGATIVE),
            Map.entry("NEG", NEGATIVE),
            Map.entry("LABEL_1", NEGATIVE),
            Map.entry("1", NEGATIVE),
            Map.entry("부정", NEGATIVE),
            Map.entry("NEUTRAL", NEUTRAL),
            Map.entry("NEU", NEUTRAL),
            Map.entry("LABEL_2", NEUTRAL),
            Map.entry("2", NEUTRAL),
            Map.entry("중립", NEUTRAL)
    );

    public static SentimentLabel fromRaw(String raw) {
        if (raw == null || raw.isBlank()) return NEUTRAL;

        SentimentLabel label = RAW_LABELS.get(raw.trim().toUpperCase(Locale.ROOT));
        if (label == null) {
            logger.warn("Unknown sentiment label '{}', treating as neutral", raw);
            return NEUTRAL;
        }
        return label;
    }

    public int score() {
        return switch (this) {
            case POSITIVE -> 1;
            case NEGATIVE -> -1;
            case NEUTRAL -> 0;
        };
    }
}
