package io.esgradar.materiality.api.dto.analysis;

/**
 * A ranked topic of a prior materiality assessment.
 *
 * @param name         unique topic name
 * @param priority     prior rank, 1 is the most important
 * @param standardCode external standard issue code, may be null
 */
public record Topic(
        String name,
        int priority,
        String standardCode
) {
    public Topic {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Topic name must not be blank");
        }
        if (priority < 1) {
            throw new IllegalArgumentException("Topic priority must be positive: " + name + " -> " + priority);
        }
        name = name.trim();
    }

    public Topic(String name, int priority) {
        this(name, priority, null);
    }

    public boolean isMapped() {
        return standardCode != null && !standardCode.isBlank();
    }

    public Topic withStandardCode(String code) {
        return new Topic(name, priority, code);
    }
}
