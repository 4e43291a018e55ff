package io.esgradar.materiality.api.util;

import io.esgradar.materiality.api.dto.analysis.Article;

import java.util.HashSet;
import java.util.Set;

/**
 * Token-overlap similarity between two texts, always within [0, 1] and symmetric.
 */
public final class TextSimilarity {

    private static final double JACCARD_WEIGHT = 0.5;
    private static final double OVERLAP_WEIGHT = 0.4;
    private static final double LENGTH_WEIGHT = 0.1;

    private TextSimilarity() {
    }

    public static double similarity(String first, String second) {
        String normalized1 = TextNormalizer.normalize(first);
        String normalized2 = TextNormalizer.normalize(second);

        if (normalized1.isEmpty() || normalized2.isEmpty()) return 0.0;
        if (normalized1.equals(normalized2)) return 1.0;

        Set<String> tokens1 = new HashSet<>(TextNormalizer.tokenize(normalized1));
        Set<String> tokens2 = new HashSet<>(TextNormalizer.tokenize(normalized2));

        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);

        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);

        int smaller = Math.min(tokens1.size(), tokens2.size());
        int larger = Math.max(tokens1.size(), tokens2.size());

        double jaccard = (double) intersection.size() / union.size();
        double overlap = (double) intersection.size() / smaller;
        double lengthRatio = (double) smaller / larger;

        double blended = JACCARD_WEIGHT * jaccard + OVERLAP_WEIGHT * overlap + LENGTH_WEIGHT * lengthRatio;
        return Math.min(1.0, round3(blended));
    }

    /**
     * Text compared when deduplicating; the title is repeated so it counts double.
     */
    public static String comparisonText(Article article) {
        return article.title() + " " + article.title() + " "
                + article.description() + " " + article.content();
    }

    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
