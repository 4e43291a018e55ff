package io.esgradar.materiality.api.dto.analysis;

public enum OverallDirection {
    EXPANDING,
    CONTRACTING,
    STABLE
}
