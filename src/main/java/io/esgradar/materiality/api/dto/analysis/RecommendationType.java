package io.esgradar.materiality.api.dto.analysis;

public enum RecommendationType {
    PRIORITY_REVIEW,
    OVERALL_REVIEW,
    NEW_ISSUE
}
