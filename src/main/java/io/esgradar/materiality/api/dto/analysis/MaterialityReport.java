package io.esgradar.materiality.api.dto.analysis;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.List;

public record MaterialityReport(
        String companyName,
        int year,
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime analysedAt,
        ArticleStats articleStats,
        List<MalformedArticle> malformedArticles,
        List<TopicNewsAnalysis> topicAnalyses,
        List<TopicChange> topicChanges,
        List<NewIssueCandidate> newIssues,
        OverallTrend overallTrend,
        List<UpdatePriority> updatePriorities,
        List<Recommendation> recommendations,
        List<String> guidance
) {
    public MaterialityReport {
        malformedArticles = malformedArticles == null ? List.of() : List.copyOf(malformedArticles);
        topicAnalyses = topicAnalyses == null ? List.of() : List.copyOf(topicAnalyses);
        topicChanges = topicChanges == null ? List.of() : List.copyOf(topicChanges);
        newIssues = newIssues == null ? List.of() : List.copyOf(newIssues);
        updatePriorities = updatePriorities == null ? List.of() : List.copyOf(updatePriorities);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        guidance = guidance == null ? List.of() : List.copyOf(guidance);
    }

    public UpdateNecessity updateNecessity() {
        return overallTrend.updateNecessity();
    }
}
