package io.esgradar.materiality.api.dto.analysis;

import java.util.List;

public record NewIssueCandidate(
        String keyword,
        int frequency,
        double issueScore,
        double confidence,
        List<String> relatedArticleIds,
        String standardCode,
        String rationale
) {
    public NewIssueCandidate {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        relatedArticleIds = relatedArticleIds == null ? List.of() : List.copyOf(relatedArticleIds);
    }

    public NewIssueCandidate withStandardCode(String code) {
        return new NewIssueCandidate(keyword, frequency, issueScore, confidence,
                relatedArticleIds, code, rationale);
    }
}
