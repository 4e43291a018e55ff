package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.util.TextNormalizer;
import io.esgradar.materiality.config.KeywordDictionary;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.ScoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores how strongly a single article speaks about a topic.
 *
 * <p>Title and body are scored separately: every keyword found on word boundaries counts as an
 * exact match, every keyword found only inside a longer word as a partial match. A flat bonus is
 * added when the company is named, the sum is scaled by sentiment and recency, and keyword
 * density is added last. All weights come from {@link ScoringConfig}.
 */
@Service
public class RelevanceScorer {

    private static final Logger logger = LoggerFactory.getLogger(RelevanceScorer.class);

    private final ScoringConfig scoring;
    private final KeywordDictionary dictionary;
    private final Clock clock;

    public RelevanceScorer(MaterialityConfig config, Clock clock) {
        this.scoring = config.scoring();
        this.dictionary = config.keywords();
        this.clock = clock;
    }

    /**
     * @return a non-negative score, 0 when there are no keywords or no text
     */
    public double score(Article article, Collection<String> topicKeywords, String companyName) {
        if (article == null || topicKeywords == null || topicKeywords.isEmpty()) return 0.0;

        String title = article.title().toLowerCase(Locale.ROOT);
        String body = article.body().toLowerCase(Locale.ROOT);
        if (title.isBlank() && body.isBlank()) return 0.0;

        Set<String> keywords = lowercase(topicKeywords);

        double total = companyScore(title + " " + body, companyName);
        total += keywordScore(title, keywords, scoring.titleWeight());
        total += keywordScore(body, keywords, scoring.contentWeight());

        total *= scoring.sentimentMultiplier(article.sentiment());

        if (isRecent(article.publishedAt())) {
            total *= scoring.recencyBoost();
        }

        total += keywordDensity(title + " " + body, keywords) * scoring.keywordDensity();

        logger.trace("Scored article {} at {}", article.id(), total);
        return Math.max(0.0, total);
    }

    /**
     * Keywords contained anywhere in the article's title or body, case-insensitive.
     */
    public Set<String> matchedKeywords(Article article, Collection<String> topicKeywords) {
        if (article == null || topicKeywords == null) return Set.of();

        String text = article.fullText().toLowerCase(Locale.ROOT);
        Set<String> matched = new LinkedHashSet<>();
        for (String keyword : lowercase(topicKeywords)) {
            if (text.contains(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    public boolean isRecent(LocalDateTime publishedAt) {
        if (publishedAt == null) return false;

        LocalDateTime cutoff = LocalDateTime.now(clock).minus(scoring.recencyWindow());
        return !publishedAt.isBefore(cutoff);
    }

    private double companyScore(String text, String companyName) {
        for (String alias : dictionary.aliasesFor(companyName)) {
            if (text.contains(alias)) {
                return scoring.companyMention();
            }
        }
        return 0.0;
    }

    private double keywordScore(String text, Set<String> keywords, double baseWeight) {
        if (text.isBlank()) return 0.0;

        int exact = 0;
        int partial = 0;
        for (String keyword : keywords) {
            if (!text.contains(keyword)) continue;

            if (boundaryPattern(keyword).matcher(text).find()) {
                exact++;
            } else {
                partial++;
            }
        }

        return exact * baseWeight * scoring.exactMatch()
                + partial * baseWeight * scoring.partialMatch();
    }

    private double keywordDensity(String text, Set<String> keywords) {
        int words = TextNormalizer.wordCount(text);
        if (words == 0) return 0.0;

        int occurrences = 0;
        for (String keyword : keywords) {
            occurrences += countOccurrences(text, keyword);
        }
        return (double) occurrences / words;
    }

    // compiled per call: keywords include caller-supplied topic words
    private static Pattern boundaryPattern(String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
    }

    static int countOccurrences(String text, String keyword) {
        if (keyword.isEmpty()) return 0;

        int count = 0;
        int index = text.indexOf(keyword);
        while (index >= 0) {
            count++;
            index = text.indexOf(keyword, index + keyword.length());
        }
        return count;
    }

    private static Set<String> lowercase(Collection<String> keywords) {
        Set<String> result = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                result.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
