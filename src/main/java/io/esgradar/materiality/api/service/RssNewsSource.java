package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.DateRange;
import io.esgradar.materiality.api.service.RssFeedReader.RssParsingException;
import io.esgradar.materiality.config.RssConfig;
import io.esgradar.materiality.config.RssSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * News retrieval over the configured RSS feeds. Feeds carry no search API, so entries are
 * filtered locally by keyword and date.
 */
@Service
public class RssNewsSource implements NewsSource {

    private static final Logger logger = LoggerFactory.getLogger(RssNewsSource.class);

    private final RssConfig rssConfig;
    private final RssFeedReader feedReader;

    public RssNewsSource(RssConfig rssConfig, RssFeedReader feedReader) {
        this.rssConfig = rssConfig;
        this.feedReader = feedReader;
    }

    @Override
    public List<Article> fetch(Collection<String> keywords, DateRange dateRange, int limit) {
        List<String> queryKeywords = keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();

        List<Article> collected = new ArrayList<>();
        if (queryKeywords.isEmpty() || limit <= 0) return collected;

        for (RssSource source : rssConfig.getEnabledSources()) {
            if (collected.size() >= limit) {
                logger.debug("Limit {} reached, not reading {}", limit, source.name());
                break;
            }

            for (Article article : readFeed(source)) {
                if (collected.size() >= limit) break;

                if (!dateRange.contains(article.publishedAt())) continue;

                Set<String> matched = matchKeywords(article, queryKeywords);
                if (!matched.isEmpty()) {
                    collected.add(withProvenance(article, matched));
                }
            }
        }

        logger.info("Collected {} articles for {} keywords in {} from {} feeds",
                collected.size(), queryKeywords.size(), dateRange, rssConfig.getEnabledSources().size());
        return collected;
    }

    private List<Article> readFeed(RssSource source) {
        try {
            return feedReader.read(source.url(), source.name());
        } catch (RssParsingException e) {
            return handleParsingError(source, e);
        }
    }

    private List<Article> handleParsingError(RssSource source, RssParsingException e) {
        switch (e.getCategory()) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, IO_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED ->
                    logger.warn("Temporary error for feed {} after retries: {}", source.name(), e.getMessage());
            case NOT_FOUND, ACCESS_FORBIDDEN, AUTH_REQUIRED, INVALID_URL ->
                    logger.error("Permanent error for feed {}: {}", source.name(), e.getMessage());
            case PARSE_ERROR ->
                    logger.warn("Parse error for feed {}: {}", source.name(), e.getMessage());
            default ->
                    logger.error("Error reading feed {}: {} (category: {})", source.name(), e.getMessage(), e.getCategory());
        }
        return Collections.emptyList();
    }

    private static Set<String> matchKeywords(Article article, List<String> keywords) {
        String text = (article.title() + " " + article.description() + " " + article.content()).toLowerCase(Locale.ROOT);

        Set<String> matched = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    private static Article withProvenance(Article article, Set<String> matchedKeywords) {
        return new Article(article.id(), article.title(), article.description(), article.content(),
                article.link(), article.source(), article.publishedAt(), article.sentiment(),
                article.sentimentConfidence(), matchedKeywords, article.mentionCount());
    }
}
