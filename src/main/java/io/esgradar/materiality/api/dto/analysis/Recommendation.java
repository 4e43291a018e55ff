package io.esgradar.materiality.api.dto.analysis;

/**
 * @param standardAlignment standard issue code, or {@code "unmapped"}
 * @param suggestedRankShift ranks to move the topic up (positive) or down (negative), zero outside priority reviews
 */
public record Recommendation(
        String subject,
        RecommendationType type,
        String suggestedAction,
        String rationale,
        double confidence,
        RecommendationEvidence evidence,
        String standardAlignment,
        int suggestedRankShift
) {
    public static final String UNMAPPED = "unmapped";

    public Recommendation {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? RecommendationEvidence.none() : evidence;
        standardAlignment = standardAlignment == null || standardAlignment.isBlank() ? UNMAPPED : standardAlignment;
    }
}
