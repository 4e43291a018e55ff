package io.esgradar.materiality.api.dto.analysis;

public enum UpdateNecessity {
    LOW,
    MEDIUM,
    HIGH
}
