package io.esgradar.materiality.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.esgradar.materiality.api.dto.analysis.ChangeType;
import io.esgradar.materiality.api.dto.analysis.MaterialityReport;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.TopicChange;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record UpdateRequiredEvent(
        @JsonProperty("alertId") String alertId,
        @JsonProperty("companyName") String companyName,
        @JsonProperty("year") int year,
        @JsonProperty("meanMagnitude") double meanMagnitude,
        @JsonProperty("emergingTopics") List<String> emergingTopics,
        @JsonProperty("decliningTopics") List<String> decliningTopics,
        @JsonProperty("newIssues") List<String> newIssues,
        @JsonProperty("summary") String summary,
        @JsonProperty("detectedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime detectedAt
) {
    public static UpdateRequiredEvent create(MaterialityReport report) {
        return new UpdateRequiredEvent(
                "UPDATE-" + UUID.randomUUID().toString().substring(0, 8),
                report.companyName(),
                report.year(),
                report.overallTrend().meanMagnitude(),
                topicsOfType(report.topicChanges(), ChangeType.EMERGING),
                topicsOfType(report.topicChanges(), ChangeType.DECLINING),
                report.newIssues().stream().map(NewIssueCandidate::keyword).toList(),
                report.overallTrend().summary(),
                LocalDateTime.now()
        );
    }

    private static List<String> topicsOfType(List<TopicChange> changes, ChangeType type) {
        return changes.stream()
                .filter(change -> change.changeType() == type)
                .map(TopicChange::topicName)
                .toList();
    }
}
