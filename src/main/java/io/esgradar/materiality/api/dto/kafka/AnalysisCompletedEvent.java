package io.esgradar.materiality.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.esgradar.materiality.api.dto.analysis.MaterialityReport;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

public record AnalysisCompletedEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("companyName") String companyName,
        @JsonProperty("year") int year,
        @JsonProperty("analysedArticles") int analysedArticles,
        @JsonProperty("changeDistribution") Map<String, Integer> changeDistribution,
        @JsonProperty("newIssueCount") int newIssueCount,
        @JsonProperty("recommendationCount") int recommendationCount,
        @JsonProperty("overallDirection") String overallDirection,
        @JsonProperty("updateNecessity") String updateNecessity,
        @JsonProperty("completedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime completedAt
) {
    public static AnalysisCompletedEvent create(MaterialityReport report) {
        Map<String, Integer> distribution = report.overallTrend().changeDistribution().entrySet().stream()
                .collect(Collectors.toMap(entry -> entry.getKey().name(), Map.Entry::getValue));

        return new AnalysisCompletedEvent(
                UUID.randomUUID().toString(),
                report.companyName(),
                report.year(),
                report.articleStats().afterDeduplication(),
                distribution,
                report.newIssues().size(),
                report.recommendations().size(),
                report.overallTrend().direction().name(),
                report.updateNecessity().name(),
                report.analysedAt()
        );
    }
}
