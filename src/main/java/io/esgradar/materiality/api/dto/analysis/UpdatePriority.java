package io.esgradar.materiality.api.dto.analysis;

/**
 * One entry of the ordered work list for the next assessment update.
 *
 * @param changeType    change of an existing topic, or {@code null} for a new issue
 * @param priorityScore |magnitude| x confidence for topic changes, issueScore x confidence for new issues
 */
public record UpdatePriority(
        Kind kind,
        String subject,
        ChangeType changeType,
        double priorityScore,
        String rationale
) {
    public enum Kind {
        TOPIC_CHANGE,
        NEW_ISSUE
    }
}
