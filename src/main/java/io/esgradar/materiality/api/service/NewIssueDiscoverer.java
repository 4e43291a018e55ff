package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.SentimentLabel;
import io.esgradar.materiality.api.util.TextNormalizer;
import io.esgradar.materiality.api.util.TextSimilarity;
import io.esgradar.materiality.config.DiscoveryConfig;
import io.esgradar.materiality.config.MaterialityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mines frequent words across all articles for issues the assessment does not track yet.
 */
@Service
public class NewIssueDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(NewIssueDiscoverer.class);

    private final DiscoveryConfig discovery;
    private final RelevanceScorer relevanceScorer;

    public NewIssueDiscoverer(MaterialityConfig config, RelevanceScorer relevanceScorer) {
        this.discovery = config.discovery();
        this.relevanceScorer = relevanceScorer;
    }

    public List<NewIssueCandidate> discover(List<Article> articles, Collection<String> excludedNames) {
        return discover(articles, excludedNames, discovery.minFrequency(), discovery.scoreThreshold());
    }

    /**
     * @param excludedNames existing topic names, and any other term that must not resurface
     *                      as a candidate; containment is checked both ways, case-insensitive
     */
    public List<NewIssueCandidate> discover(List<Article> articles, Collection<String> excludedNames,
                                            int minFrequency, double scoreThreshold) {
        List<String> normalizedTexts = articles.stream()
                .map(article -> TextNormalizer.normalize(article.fullText()))
                .toList();

        Map<String, Integer> frequencies = countTokens(normalizedTexts);
        List<String> excluded = excludedNames.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .toList();

        List<NewIssueCandidate> candidates = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : topByFrequency(frequencies)) {
            String keyword = entry.getKey();
            int frequency = entry.getValue();

            if (overlapsExisting(keyword, excluded)) {
                logger.debug("Skipping '{}', already covered by an existing topic", keyword);
                continue;
            }
            if (frequency < minFrequency) continue;

            List<Article> related = new ArrayList<>();
            for (int i = 0; i < articles.size(); i++) {
                if (normalizedTexts.get(i).contains(keyword)) {
                    related.add(articles.get(i));
                }
            }

            double score = issueScore(frequency, related);
            if (score <= scoreThreshold) continue;

            candidates.add(new NewIssueCandidate(
                    keyword,
                    frequency,
                    score,
                    Math.min(score / 2.0, 1.0),
                    related.stream().map(Article::id).toList(),
                    null,
                    rationale(keyword, frequency, score, related)
            ));
        }

        candidates.sort(Comparator.comparingDouble(NewIssueCandidate::issueScore).reversed());
        List<NewIssueCandidate> result = candidates.stream().limit(discovery.maxCandidates()).toList();

        logger.info("Discovered {} new issue candidates from {} articles", result.size(), articles.size());
        return result;
    }

    double issueScore(int frequency, List<Article> related) {
        double frequencyScore = Math.log(frequency + 1) / 10.0;
        double articleScore = Math.min(related.size() / 10.0, 1.0);

        long recent = related.stream()
                .filter(article -> relevanceScorer.isRecent(article.publishedAt()))
                .count();
        double recency = (double) recent / Math.max(related.size(), 1);

        Set<SentimentLabel> sentiments = EnumSet.noneOf(SentimentLabel.class);
        related.forEach(article -> sentiments.add(article.sentiment()));
        double diversity = sentiments.size() / 3.0;

        return TextSimilarity.round3(0.3 * frequencyScore + 0.3 * articleScore + 0.2 * recency + 0.2 * diversity);
    }

    private Map<String, Integer> countTokens(List<String> normalizedTexts) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String text : normalizedTexts) {
            for (String token : TextNormalizer.tokenize(text)) {
                if (token.length() >= discovery.minTokenLength() && !discovery.isStopword(token)) {
                    frequencies.merge(token, 1, Integer::sum);
                }
            }
        }
        return frequencies;
    }

    // stable sort keeps first-seen order among equal counts
    private List<Map.Entry<String, Integer>> topByFrequency(Map<String, Integer> frequencies) {
        return frequencies.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(discovery.topKeywords())
                .toList();
    }

    static boolean overlapsExisting(String keyword, List<String> excluded) {
        for (String name : excluded) {
            if (name.contains(keyword) || keyword.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private String rationale(String keyword, int frequency, double score, List<Article> related) {
        long recent = related.stream()
                .filter(article -> relevanceScorer.isRecent(article.publishedAt()))
                .count();

        return String.format(Locale.ROOT,
                "'%s' mentioned %d times; %d related articles, %d recent; issue score %.3f",
                keyword, frequency, related.size(), recent, score);
    }
}
