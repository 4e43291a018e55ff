package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.DateRange;
import io.esgradar.materiality.api.exception.ErrorCategory;
import io.esgradar.materiality.api.service.RssFeedReader.RssParsingException;
import io.esgradar.materiality.config.RssConfig;
import io.esgradar.materiality.config.RssSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static io.esgradar.materiality.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssNewsSourceTest {

    private static final LocalDateTime IN_YEAR = LocalDateTime.of(2025, 4, 2, 9, 0);

    @Mock
    private RssFeedReader feedReader;

    private RssNewsSource newsSource;

    @BeforeEach
    void setUp() {
        RssConfig config = new RssConfig(List.of(
                new RssSource("https://feeds.example.com/economy", "Economy", true),
                new RssSource("https://feeds.example.com/industry", "Industry", true),
                new RssSource("https://feeds.example.com/archive", "Archive", false)
        ), null);

        newsSource = new RssNewsSource(config, feedReader);
    }

    @Test
    @DisplayName("Should keep entries in range that mention a keyword and record which keywords matched")
    void shouldFilterByKeywordAndDate() throws Exception {
        when(feedReader.read("https://feeds.example.com/economy", "Economy")).thenReturn(List.of(
                article("1", "두산퓨얼셀 수소 발전 확대", "연료전지 공급", IN_YEAR, null),
                article("2", "Unrelated market report", "stocks closed higher", IN_YEAR, null),
                article("3", "두산퓨얼셀 실적 발표", "지난해 실적", LocalDateTime.of(2024, 12, 31, 23, 0), null)));
        when(feedReader.read("https://feeds.example.com/industry", "Industry")).thenReturn(List.of(
                article("4", "Hydrogen push", "두산퓨얼셀 expands", IN_YEAR, null)));

        List<Article> articles = newsSource.fetch(List.of("두산퓨얼셀", "수소"), DateRange.ofYear(2025), 10);

        assertThat(articles).extracting(Article::id).containsExactly("1", "4");
        assertThat(articles.get(0).matchedKeywords()).containsExactlyInAnyOrder("두산퓨얼셀", "수소");
        assertThat(articles.get(1).matchedKeywords()).containsExactly("두산퓨얼셀");
        verify(feedReader, never()).read("https://feeds.example.com/archive", "Archive");
    }

    @Test
    void shouldStopAtLimit() throws Exception {
        when(feedReader.read(anyString(), anyString())).thenReturn(List.of(
                article("1", "수소 1", "x", IN_YEAR, null),
                article("2", "수소 2", "x", IN_YEAR, null)));

        assertThat(newsSource.fetch(List.of("수소"), DateRange.ofYear(2025), 3)).hasSize(3);
    }

    @Test
    @DisplayName("Feeds after the one that fills the limit are not downloaded")
    void shouldNotReadRemainingFeedsOnceLimitIsReached() throws Exception {
        when(feedReader.read("https://feeds.example.com/economy", "Economy")).thenReturn(List.of(
                article("1", "수소 1", "x", IN_YEAR, null)));

        assertThat(newsSource.fetch(List.of("수소"), DateRange.ofYear(2025), 1))
                .extracting(Article::id).containsExactly("1");
        verify(feedReader, never()).read("https://feeds.example.com/industry", "Industry");
    }

    @Test
    @DisplayName("A failing feed is skipped and the other feeds still contribute")
    void shouldSkipFailingFeed() throws Exception {
        when(feedReader.read("https://feeds.example.com/economy", "Economy"))
                .thenThrow(new RssParsingException("Feed not found (404)", ErrorCategory.NOT_FOUND));
        when(feedReader.read("https://feeds.example.com/industry", "Industry")).thenReturn(List.of(
                article("4", "수소 전략", "x", IN_YEAR, null)));

        assertThat(newsSource.fetch(List.of("수소"), DateRange.ofYear(2025), 10))
                .extracting(Article::id).containsExactly("4");
    }

    @Test
    void shouldReturnNothingWithoutKeywords() {
        assertThat(newsSource.fetch(List.of(" "), DateRange.ofYear(2025), 10)).isEmpty();
    }
}
