package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.config.DiscoveryConfig;
import io.esgradar.materiality.config.MaterialityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.esgradar.materiality.TestArticles.FIXED_CLOCK;
import static io.esgradar.materiality.TestArticles.NOW;
import static io.esgradar.materiality.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;

class NewIssueDiscovererTest {

    private static final SentimentLabel[] SENTIMENTS = {
            SentimentLabel.POSITIVE, SentimentLabel.NEGATIVE, SentimentLabel.NEUTRAL, SentimentLabel.POSITIVE
    };

    private NewIssueDiscoverer discoverer;

    @BeforeEach
    void setUp() {
        discoverer = discovererWith(MaterialityConfig.defaults());
    }

    @Test
    @DisplayName("Should surface a frequent keyword with its score, confidence and related articles")
    void shouldDiscoverFrequentKeyword() {
        List<NewIssueCandidate> candidates = discoverer.discover(hydrogenArticles(), List.of("Climate action"));

        assertThat(candidates).hasSize(1);

        NewIssueCandidate candidate = candidates.get(0);
        assertThat(candidate.keyword()).isEqualTo("hydrogen");
        assertThat(candidate.frequency()).isEqualTo(8);
        assertThat(candidate.relatedArticleIds()).containsExactly("h0", "h1", "h2", "h3");
        // 0.3 * ln(9) / 10 + 0.3 * 0.4 + 0.2 * 1 + 0.2 * 3/3
        assertThat(candidate.issueScore()).isEqualTo(0.586);
        assertThat(candidate.confidence()).isEqualTo(0.293);
        assertThat(candidate.standardCode()).isNull();
        assertThat(candidate.rationale()).contains("'hydrogen' mentioned 8 times");
    }

    @Test
    void shouldSkipKeywordsCoveredByExistingTopics() {
        assertThat(discoverer.discover(hydrogenArticles(), List.of("Hydrogen economy"))).isEmpty();
        assertThat(discoverer.discover(hydrogenArticles(), List.of("hydro"))).isEmpty();
    }

    @Test
    void shouldRespectMinimumFrequency() {
        assertThat(discoverer.discover(hydrogenArticles(), List.of(), 9, 0.4)).isEmpty();
    }

    @Test
    void shouldRespectScoreThreshold() {
        assertThat(discoverer.discover(hydrogenArticles(), List.of(), 3, 0.6)).isEmpty();
    }

    @Test
    void shouldIgnoreStopwordsAndShortTokens() {
        NewIssueDiscoverer withStopwords = discovererWith(new MaterialityConfig(null, null,
                new DiscoveryConfig(3, 0.4, 20, 5, 3, Set.of("hydrogen")), null, null, null, null));

        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            articles.add(article("s" + i, "hydrogen h2 u" + i + "x", "hydrogen h2", NOW.minusDays(1), SENTIMENTS[i]));
        }

        assertThat(withStopwords.discover(articles, List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should return at most the configured number of candidates, ties in first-seen order")
    void shouldCapCandidates() {
        NewIssueDiscoverer capped = discovererWith(new MaterialityConfig(null, null,
                new DiscoveryConfig(3, 0.4, 20, 2, 3, Set.of()), null, null, null, null));

        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            articles.add(article("c" + i, "alpha beta gamma", "delta u" + i + "x", NOW.minusDays(1), SENTIMENTS[i]));
        }

        assertThat(capped.discover(articles, List.of()))
                .extracting(NewIssueCandidate::keyword)
                .containsExactly("alpha", "beta");
    }

    private static NewIssueDiscoverer discovererWith(MaterialityConfig config) {
        return new NewIssueDiscoverer(config, new RelevanceScorer(config, FIXED_CLOCK));
    }

    // "hydrogen" twice per article, every other token once
    private static List<Article> hydrogenArticles() {
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            articles.add(article("h" + i, "hydrogen u" + i + "x", "hydrogen u" + i + "y u" + i + "z",
                    NOW.minusDays(1), SENTIMENTS[i]));
        }
        return articles;
    }
}
