package io.esgradar.materiality.api.dto.analysis;

public enum ChangeType {
    EMERGING,   // score well above prior rank
    ONGOING,    // high score, no significant movement
    MATURING,   // low score, no significant movement
    DECLINING   // score well below prior rank
}
