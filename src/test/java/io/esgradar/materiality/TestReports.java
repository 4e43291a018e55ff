package io.esgradar.materiality;

import io.esgradar.materiality.api.dto.analysis.ArticleStats;
import io.esgradar.materiality.api.dto.analysis.ChangeType;
import io.esgradar.materiality.api.dto.analysis.MaterialityReport;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.NewsMetrics;
import io.esgradar.materiality.api.dto.analysis.OverallDirection;
import io.esgradar.materiality.api.dto.analysis.OverallTrend;
import io.esgradar.materiality.api.dto.analysis.Topic;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.TrendDirection;
import io.esgradar.materiality.api.dto.analysis.UpdateNecessity;

import java.util.List;
import java.util.Map;

public final class TestReports {

    private TestReports() {
    }

    public static MaterialityReport report(UpdateNecessity necessity) {
        List<TopicChange> changes = List.of(
                new TopicChange(new Topic("기후변화 대응", 1, "E-GHG"), 1, 1.4, 0.4, ChangeType.EMERGING, 0.9,
                        List.of("news relevance score up (+0.40)"), TrendDirection.INCREASING,
                        new NewsMetrics(40, 30, null, Map.of()), 1),
                new TopicChange(new Topic("지역사회 공헌", 2), 2, 0.0, -1.0, ChangeType.DECLINING, 0.3,
                        List.of("insufficient news coverage"), TrendDirection.STABLE,
                        new NewsMetrics(40, 0, null, Map.of()), 2));

        OverallTrend trend = new OverallTrend(OverallDirection.STABLE,
                Map.of(ChangeType.EMERGING, 1, ChangeType.DECLINING, 1), 0.7, 0.6, 1, necessity,
                "Overall trend: stable.");

        return new MaterialityReport("두산퓨얼셀", 2025, TestArticles.NOW, new ArticleStats(41, 40, 40),
                List.of(), List.of(), changes,
                List.of(new NewIssueCandidate("수소", 12, 0.7, 0.35, List.of("a1"), null, "")),
                trend, List.of(), List.of(), List.of("Update the materiality assessment immediately."));
    }
}
