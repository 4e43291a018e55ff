package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.config.MaterialityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.esgradar.materiality.TestArticles.article;
import static io.esgradar.materiality.TestArticles.withKeywords;
import static org.assertj.core.api.Assertions.assertThat;

class ArticleDeduplicationServiceTest {

    private ArticleDeduplicationService service;

    @BeforeEach
    void setUp() {
        service = new ArticleDeduplicationService(MaterialityConfig.defaults());
    }

    @Test
    @DisplayName("Should fold a near-duplicate into the first report and union its keywords")
    void shouldMergeNearDuplicates() {
        String body = "fuel cell maker signs supply deal with regional utility for hydrogen power "
                + "plants across three provinces starting next spring";
        String rewritten = body.replace("three provinces", "four regions");

        Article first = withKeywords("a1", "Fuel cell maker wins utility contract", body, Set.of("fuel cell"));
        Article second = withKeywords("a2", "Fuel cell maker wins utility contract", rewritten, Set.of("hydrogen"));

        List<Article> result = service.dedupe(List.of(first, second), 0.6);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).id()).isEqualTo("a1");
        assertThat(result.get(0).matchedKeywords()).containsExactlyInAnyOrder("fuel cell", "hydrogen");
        assertThat(result.get(0).mentionCount()).isEqualTo(2);
    }

    @Test
    void shouldKeepUnrelatedArticles() {
        List<Article> result = service.dedupe(clusteredStories(), 0.6);

        assertThat(result).hasSize(6);
    }

    @Test
    @DisplayName("Lowering the threshold never yields more representatives")
    void shouldNotGrowWhenThresholdDecreases() {
        List<Article> articles = clusteredStories();

        int previous = Integer.MAX_VALUE;
        for (double threshold : new double[]{1.0, 0.8, 0.6, 0.4, 0.2, 0.0}) {
            int size = service.dedupe(articles, threshold).size();

            assertThat(size).isLessThanOrEqualTo(articles.size());
            assertThat(size).isLessThanOrEqualTo(previous);
            previous = size;
        }

        assertThat(service.dedupe(articles, 0.2)).hasSize(3);
        assertThat(service.dedupe(articles, 0.0)).hasSize(1);
    }

    @Test
    @DisplayName("Duplicates split across batches still collapse in the second pass")
    void shouldMatchSinglePassWhenBatched() {
        List<Article> articles = clusteredStories();

        List<Article> single = service.dedupe(articles, 0.2);
        List<Article> batched = service.dedupeInBatches(articles, 0.2, 2);

        assertThat(batched).extracting(Article::id).isEqualTo(single.stream().map(Article::id).toList());
        assertThat(batched).allSatisfy(article -> assertThat(article.mentionCount()).isEqualTo(2));
    }

    @Test
    void shouldReturnEmptyForEmptyInput() {
        assertThat(service.dedupe(List.of())).isEmpty();
    }

    // three stories with disjoint vocabulary, two rewrites each, interleaved
    private static List<Article> clusteredStories() {
        return List.of(
                article("solar-1", "Solar plant opens in Busan",
                        "the new solar plant will supply power to ten thousand homes"),
                article("wage-1", "Union wage talks stall",
                        "negotiators failed again over bonus terms yesterday"),
                article("fine-1", "Regulator fines chemical firm",
                        "authorities penalized leakage incidents at three factories"),
                article("solar-2", "Solar plant opens in Busan",
                        "officials said the solar facility could power many households"),
                article("wage-2", "Union wage talks stall",
                        "bargaining broke down over overtime pay demands"),
                article("fine-2", "Regulator fines chemical firm",
                        "inspectors cited repeated toxic spills during audits")
        );
    }
}
