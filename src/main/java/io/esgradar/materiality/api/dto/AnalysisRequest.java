package io.esgradar.materiality.api.dto;

import io.esgradar.materiality.api.dto.analysis.Article;
import io.esgradar.materiality.api.dto.analysis.MaterialityAssessment;

import java.util.ArrayList;
import java.util.List;

public record AnalysisRequest(
        String companyName,
        int year,
        List<TopicRequest> topics,
        List<ArticleRequest> articles
) {
    public MaterialityAssessment toAssessment() {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("companyName is required");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }

        return new MaterialityAssessment(companyName.trim(), year,
                topics.stream().map(TopicRequest::toTopic).toList());
    }

    public List<Article> toArticles() {
        List<Article> result = new ArrayList<>();
        if (articles == null) return result;

        for (int i = 0; i < articles.size(); i++) {
            if (articles.get(i) != null) {
                result.add(articles.get(i).toArticle(i + 1));
            }
        }
        return result;
    }
}
