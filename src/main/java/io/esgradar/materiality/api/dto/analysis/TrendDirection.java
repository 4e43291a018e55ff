package io.esgradar.materiality.api.dto.analysis;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
