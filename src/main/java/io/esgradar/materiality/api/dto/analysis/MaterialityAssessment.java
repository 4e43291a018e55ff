package io.esgradar.materiality.api.dto.analysis;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record MaterialityAssessment(
        String companyName,
        int year,
        List<Topic> topics
) {
    public MaterialityAssessment {
        topics = topics == null ? List.of() : List.copyOf(topics);

        Set<String> names = new HashSet<>();
        for (Topic topic : topics) {
            if (!names.add(topic.name())) {
                throw new IllegalArgumentException("Duplicate topic in assessment: " + topic.name());
            }
        }
    }

    public int maxPriorityRank() {
        int highest = topics.stream().mapToInt(Topic::priority).max().orElse(1);
        return Math.max(topics.size(), highest);
    }

    public List<String> topicNames() {
        return topics.stream().map(Topic::name).toList();
    }

    public MaterialityAssessment withTopics(List<Topic> replacement) {
        return new MaterialityAssessment(companyName, year, replacement);
    }
}
