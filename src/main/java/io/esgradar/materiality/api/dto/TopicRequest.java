package io.esgradar.materiality.api.dto;

import io.esgradar.materiality.api.dto.analysis.Topic;

public record TopicRequest(
        String name,
        int priority,
        String standardCode
) {
    public Topic toTopic() {
        return new Topic(name, priority, standardCode);
    }
}
