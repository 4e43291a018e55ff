package io.esgradar.materiality.api.dto;

import io.esgradar.materiality.api.dto.analysis.MaterialityAssessment;

import java.util.List;

/**
 * @param limit maximum number of articles to collect, the configured default when null
 */
public record CollectRequest(
        String companyName,
        int year,
        List<TopicRequest> topics,
        Integer limit
) {
    public MaterialityAssessment toAssessment() {
        return new AnalysisRequest(companyName, year, topics, null).toAssessment();
    }
}
