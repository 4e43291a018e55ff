package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.util.TextSimilarity;
import io.esgradar.materiality.config.DedupConfig;
import io.esgradar.materiality.config.MaterialityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses near-duplicate reports of the same story into one representative.
 *
 * <p>Articles are visited in input order. Each one is compared with every representative
 * accepted so far and folded into the first whose similarity reaches the threshold; otherwise it
 * becomes a representative itself. Representatives keep the union of matched keywords and the
 * summed mention count of everything folded into them.
 */
@Service
public class ArticleDeduplicationService {

    private static final Logger logger = LoggerFactory.getLogger(ArticleDeduplicationService.class);

    private final DedupConfig dedupConfig;

    public ArticleDeduplicationService(MaterialityConfig config) {
        this.dedupConfig = config.dedup();
    }

    public List<Article> dedupe(List<Article> articles) {
        return dedupeInBatches(articles, dedupConfig.similarityThreshold(), dedupConfig.batchSize());
    }

    public List<Article> dedupe(List<Article> articles, double threshold) {
        List<Article> representatives = new ArrayList<>();
        List<String> comparisonTexts = new ArrayList<>();

        for (Article article : articles) {
            String text = TextSimilarity.comparisonText(article);
            int match = findRepresentative(comparisonTexts, text, threshold);

            if (match >= 0) {
                representatives.set(match, representatives.get(match).mergedWith(article));
                logger.debug("Merged article {} into {}", article.id(), representatives.get(match).id());
            } else {
                representatives.add(article);
                comparisonTexts.add(text);
            }
        }

        return representatives;
    }

    /**
     * Dedupes each batch on its own, then runs a second pass across all batch representatives
     * so that duplicates split over two batches still collapse.
     */
    public List<Article> dedupeInBatches(List<Article> articles, double threshold, int batchSize) {
        if (articles.size() <= batchSize || batchSize <= 0) {
            List<Article> result = dedupe(articles, threshold);
            logDedupResult(articles.size(), result.size());
            return result;
        }

        List<Article> batchRepresentatives = new ArrayList<>();
        for (int start = 0; start < articles.size(); start += batchSize) {
            List<Article> batch = articles.subList(start, Math.min(start + batchSize, articles.size()));
            batchRepresentatives.addAll(dedupe(batch, threshold));
        }

        List<Article> result = dedupe(batchRepresentatives, threshold);
        logDedupResult(articles.size(), result.size());
        return result;
    }

    private int findRepresentative(List<String> comparisonTexts, String text, double threshold) {
        for (int i = 0; i < comparisonTexts.size(); i++) {
            if (TextSimilarity.similarity(comparisonTexts.get(i), text) >= threshold) {
                return i;
            }
        }
        return -1;
    }

    private void logDedupResult(int before, int after) {
        logger.info("Deduplicated {} articles into {} representatives", before, after);
    }
}
