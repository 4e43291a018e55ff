package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.DateRange;
import io.esgradar.materiality.api.dto.analysis.SentimentResult;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.config.KeywordDictionary;
import io.esgradar.materiality.config.MaterialityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Gathers a year of news about a company and labels each article's sentiment before analysis.
 */
@Service
public class NewsCollectionService {

    private static final Logger logger = LoggerFactory.getLogger(NewsCollectionService.class);

    private final NewsSource newsSource;
    private final SentimentClassifier sentimentClassifier;
    private final KeywordDictionary dictionary;
    private final int defaultLimit;

    public NewsCollectionService(NewsSource newsSource, SentimentClassifier sentimentClassifier,
                                 MaterialityConfig config) {
        this.newsSource = newsSource;
        this.sentimentClassifier = sentimentClassifier;
        this.dictionary = config.keywords();
        this.defaultLimit = config.processing().collectLimit();
    }

    public List<Article> collect(String companyName, List<Topic> topics, int year, Integer limit) {
        Set<String> query = new LinkedHashSet<>();
        if (companyName != null && !companyName.isBlank()) {
            query.add(companyName.trim());
        }
        query.addAll(dictionary.aliasesFor(companyName));
        for (Topic topic : topics) {
            query.add(topic.name());
            query.addAll(dictionary.keywordsFor(topic.name()));
        }

        int effectiveLimit = limit != null && limit > 0 ? limit : defaultLimit;
        DateRange period = DateRange.ofYear(year);

        logger.info("Collecting news for {} ({}): {} query terms, limit {}",
                companyName, period, query.size(), effectiveLimit);

        List<Article> articles = newsSource.fetch(query, period, effectiveLimit);

        return articles.stream()
                .map(this::label)
                .toList();
    }

    private Article label(Article article) {
        SentimentResult result = sentimentClassifier.classify(article.fullText());
        logger.debug("Article {} labelled {} ({})", article.id(), result.label(), result.confidence());
        return article.withSentiment(result);
    }
}
