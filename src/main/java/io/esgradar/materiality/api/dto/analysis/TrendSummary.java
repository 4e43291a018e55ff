package io.esgradar.materiality.api.dto.analysis;

import java.time.YearMonth;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Month-bucketed view of a topic's relevant coverage.
 *
 * @param peakPeriod month with the most relevant articles, null without coverage
 */
public record TrendSummary(
        TrendDirection direction,
        boolean recentIncrease,
        YearMonth peakPeriod,
        SentimentLabel dominantSentiment,
        SortedMap<YearMonth, Integer> monthlyDistribution
) {
    public TrendSummary {
        direction = direction == null ? TrendDirection.STABLE : direction;
        dominantSentiment = dominantSentiment == null ? SentimentLabel.NEUTRAL : dominantSentiment;
        monthlyDistribution = monthlyDistribution == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(monthlyDistribution));
    }

    public static TrendSummary empty() {
        return new TrendSummary(TrendDirection.STABLE, false, null, SentimentLabel.NEUTRAL, null);
    }
}
