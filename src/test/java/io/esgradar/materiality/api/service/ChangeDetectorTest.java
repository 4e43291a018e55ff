package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.ChangeType;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.TopicNewsAnalysis;
import io.esgradar.materiality.api.dto.analysis.TrendDirection;
import io.esgradar.materiality.api.dto.analysis.TrendSummary;
import io.esgradar.materiality.config.MaterialityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChangeDetectorTest {

    private ChangeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ChangeDetector(MaterialityConfig.defaults());
    }

    @Test
    void shouldNormalizePriorRank() {
        assertThat(ChangeDetector.normalizedPriorScore(1, 5)).isEqualTo(1.0);
        assertThat(ChangeDetector.normalizedPriorScore(5, 5)).isEqualTo(0.2);
        assertThat(ChangeDetector.normalizedPriorScore(3, 5)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void shouldClampMagnitude() {
        assertThat(ChangeDetector.changeMagnitude(2.5, 5, 5)).isEqualTo(1.0);
        assertThat(ChangeDetector.changeMagnitude(0.0, 1, 5)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Should classify by magnitude first, then by absolute score")
    void shouldClassifyChanges() {
        assertThat(detector.classify(0.31, 0.0)).isEqualTo(ChangeType.EMERGING);
        assertThat(detector.classify(-0.31, 2.0)).isEqualTo(ChangeType.DECLINING);
        assertThat(detector.classify(0.3, 0.9)).isEqualTo(ChangeType.ONGOING);
        assertThat(detector.classify(0.1, 0.5)).isEqualTo(ChangeType.MATURING);
    }

    @Test
    @DisplayName("A high-scoring topic may be ongoing while its magnitude is negative")
    void shouldAllowOngoingWithNegativeMagnitude() {
        assertThat(detector.classify(-0.2, 0.8)).isEqualTo(ChangeType.ONGOING);
    }

    @Test
    void shouldMarkTopicWithoutCoverageAsDeclining() {
        Topic topic = new Topic("Biodiversity", 2);

        TopicChange change = detector.detect(topic, analysis(topic, 0, 40, 0.0, TrendSummary.empty()), 5);

        assertThat(change.changeType()).isEqualTo(ChangeType.DECLINING);
        assertThat(change.changeMagnitude()).isEqualTo(-1.0);
        assertThat(change.confidence()).isEqualTo(0.3);
        assertThat(change.reasons()).containsExactly("insufficient news coverage");
        assertThat(change.previousPriority()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should detect an emerging topic with blended confidence")
    void shouldDetectEmergingTopic() {
        Topic topic = new Topic("Water management", 3);
        TrendSummary trend = new TrendSummary(TrendDirection.INCREASING, true, YearMonth.of(2025, 5),
                SentimentLabel.POSITIVE, new TreeMap<>(Map.of(YearMonth.of(2025, 4), 2, YearMonth.of(2025, 5), 6)));

        TopicChange change = detector.detect(topic, analysis(topic, 8, 10, 0.95, trend), 5);

        assertThat(change.changeMagnitude()).isEqualTo(0.35);
        assertThat(change.changeType()).isEqualTo(ChangeType.EMERGING);
        // 0.3 * 0.8 + 0.4 * 0.8 + 0.3 * 0.95
        assertThat(change.confidence()).isEqualTo(0.845);
        assertThat(change.trendDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(change.reasons()).containsExactly(
                "news relevance score up (+0.35)", "recent rise in news volume", "growing positive coverage");
    }

    @Test
    void shouldExplainDecliningTopic() {
        Topic topic = new Topic("Supply chain", 1);
        TrendSummary trend = new TrendSummary(TrendDirection.DECREASING, false, YearMonth.of(2025, 1),
                SentimentLabel.NEGATIVE, null);

        TopicChange change = detector.detect(topic, analysis(topic, 3, 30, 0.5, trend), 5);

        assertThat(change.changeType()).isEqualTo(ChangeType.DECLINING);
        assertThat(change.changeMagnitude()).isEqualTo(-0.5);
        assertThat(change.reasons()).containsExactly(
                "news relevance score down (-0.50)", "limited related news", "growing negative coverage");
    }

    @Test
    @DisplayName("Top-ranked topic with broad coverage is ongoing or emerging with solid confidence")
    void shouldKeepWellCoveredTopTopicHigh() {
        Topic topic = new Topic("기후변화 대응", 1);

        // average relevance 0.6 over 30 of 40 articles, half the keywords matched
        double score = TopicNewsAnalyzer.comprehensiveScore(0.6, 30, 2, 4);
        TopicChange change = detector.detect(topic, analysis(topic, 30, 40, score, TrendSummary.empty()), 5);

        assertThat(change.changeType()).isIn(ChangeType.ONGOING, ChangeType.EMERGING);
        assertThat(change.confidence()).isGreaterThan(0.5);
    }

    @Test
    @DisplayName("Should rank by mentions and explain rank movement")
    void shouldRankByMentions() {
        Topic first = new Topic("Safety", 1);
        Topic second = new Topic("Ethics", 2);
        Topic third = new Topic("Energy", 3);

        List<TopicChange> ranked = detector.rankByMentions(List.of(
                detector.detect(first, analysis(first, 2, 20, 0.6, TrendSummary.empty()), 3),
                detector.detect(second, analysis(second, 9, 20, 0.9, TrendSummary.empty()), 3),
                detector.detect(third, analysis(third, 5, 20, 0.7, TrendSummary.empty()), 3)));

        assertThat(ranked).extracting(TopicChange::topicName).containsExactly("Safety", "Ethics", "Energy");
        assertThat(ranked).extracting(TopicChange::mentionRank).containsExactly(3, 1, 2);
        assertThat(ranked).extracting(TopicChange::priorityShift).containsExactly(2, -1, -1);
        assertThat(ranked.get(0).reasons().get(0)).isEqualTo("mentions down, 2 ranks lower (2 relevant articles)");
        assertThat(ranked.get(1).reasons()).noneMatch(reason -> reason.startsWith("mentions"));
    }

    @Test
    void shouldKeepInputOrderOnMentionTiesAndSkipUncoveredTopics() {
        Topic first = new Topic("Safety", 1);
        Topic second = new Topic("Ethics", 2);
        Topic uncovered = new Topic("Biodiversity", 3);

        List<TopicChange> ranked = detector.rankByMentions(List.of(
                detector.detect(first, analysis(first, 4, 20, 0.8, TrendSummary.empty()), 3),
                detector.detect(second, analysis(second, 4, 20, 0.8, TrendSummary.empty()), 3),
                detector.detect(uncovered, analysis(uncovered, 0, 20, 0.0, TrendSummary.empty()), 3)));

        assertThat(ranked).extracting(TopicChange::mentionRank).containsExactly(1, 2, 3);
        assertThat(ranked.get(0).reasons().get(0)).isEqualTo("rank held (4 relevant articles)");
        assertThat(ranked.get(2).reasons()).containsExactly("insufficient news coverage");
    }

    private static TopicNewsAnalysis analysis(Topic topic, int relevant, int total, double score, TrendSummary trend) {
        return new TopicNewsAnalysis(topic, Set.of("a", "b", "c", "d"), Set.of(), total, relevant,
                score, score, trend, Map.of(), List.of());
    }
}
