package io.esgradar.materiality.api.service;

import io.esgradar.materiality.api.dto.analysis.ChangeType;
import io.esgradar.materiality.api.dto.analysis.NewIssueCandidate;
import io.esgradar.materiality.api.dto.analysis.OverallDirection;
import io.esgradar.materiality.api.dto.analysis.OverallTrend;
import io.esgradar.materiality.api.dto.analysis.TopicChange;
import io.esgradar.materiality.api.dto.analysis.UpdateNecessity;
import io.esgradar.materiality.api.dto.analysis.UpdatePriority;
import io.esgradar.materiality.api.util.TextSimilarity;
import io.esgradar.materiality.config.MaterialityConfig;
import io.esgradar.materiality.config.RecommendationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class TrendAggregator {

    private static final Logger logger = LoggerFactory.getLogger(TrendAggregator.class);

    private final RecommendationConfig recommendation;

    public TrendAggregator(MaterialityConfig config) {
        this.recommendation = config.recommendation();
    }

    public OverallTrend aggregate(List<TopicChange> changes, List<NewIssueCandidate> newIssues) {
        Map<ChangeType, Integer> distribution = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            distribution.put(type, 0);
        }
        changes.forEach(change -> distribution.merge(change.changeType(), 1, Integer::sum));

        double meanMagnitude = changes.stream()
                .mapToDouble(change -> Math.abs(change.changeMagnitude()))
                .average()
                .orElse(0.0);
        double meanConfidence = changes.stream()
                .mapToDouble(TopicChange::confidence)
                .average()
                .orElse(0.0);

        int emerging = distribution.get(ChangeType.EMERGING);
        int declining = distribution.get(ChangeType.DECLINING);

        OverallDirection direction;
        if (emerging > declining) {
            direction = OverallDirection.EXPANDING;
        } else if (declining > emerging) {
            direction = OverallDirection.CONTRACTING;
        } else {
            direction = OverallDirection.STABLE;
        }

        UpdateNecessity necessity = necessity(emerging, declining, newIssues.size(), meanMagnitude);

        logger.info("Overall trend {} with {} necessity ({} changes, {} new issues)",
                direction, necessity, changes.size(), newIssues.size());

        return new OverallTrend(
                direction,
                distribution,
                TextSimilarity.round3(meanMagnitude),
                TextSimilarity.round3(meanConfidence),
                newIssues.size(),
                necessity,
                summary(direction, distribution, newIssues.size())
        );
    }

    static UpdateNecessity necessity(int emerging, int declining, int newIssues, double meanMagnitude) {
        if (emerging >= 3 || newIssues >= 2 || meanMagnitude > 0.5) return UpdateNecessity.HIGH;
        if (emerging >= 1 || declining >= 2 || meanMagnitude > 0.3) return UpdateNecessity.MEDIUM;
        return UpdateNecessity.LOW;
    }

    /**
     * Orders emerging and declining topics by |magnitude| x confidence and new issues by
     * issueScore x confidence into one list, highest first. Ties keep input order.
     */
    public List<UpdatePriority> priorities(List<TopicChange> changes, List<NewIssueCandidate> newIssues) {
        List<UpdatePriority> priorities = new ArrayList<>();

        for (TopicChange change : changes) {
            if (change.changeType() != ChangeType.EMERGING && change.changeType() != ChangeType.DECLINING) continue;

            priorities.add(new UpdatePriority(
                    UpdatePriority.Kind.TOPIC_CHANGE,
                    change.topicName(),
                    change.changeType(),
                    TextSimilarity.round3(Math.abs(change.changeMagnitude()) * change.confidence()),
                    "Existing topic is " + change.changeType().name().toLowerCase(Locale.ROOT)
            ));
        }

        for (NewIssueCandidate issue : newIssues) {
            priorities.add(new UpdatePriority(
                    UpdatePriority.Kind.NEW_ISSUE,
                    issue.keyword(),
                    null,
                    TextSimilarity.round3(issue.issueScore() * issue.confidence()),
                    "New issue discovered: " + issue.rationale()
            ));
        }

        priorities.sort(Comparator.comparingDouble(UpdatePriority::priorityScore).reversed());
        return priorities;
    }

    /**
     * Plain-language next steps for the people maintaining the assessment.
     */
    public List<String> guidance(OverallTrend trend, List<NewIssueCandidate> newIssues) {
        List<String> lines = new ArrayList<>();

        if (trend.direction() == OverallDirection.EXPANDING) {
            lines.add("Issues are gaining relevance overall; consider widening the assessment scope.");
        } else if (trend.direction() == OverallDirection.CONTRACTING) {
            lines.add("Issues are losing relevance overall; consider narrowing the assessment to its core issues.");
        }

        if (!newIssues.isEmpty()) {
            lines.add(String.format(Locale.ROOT,
                    "Review %d newly discovered issue(s) for inclusion in the assessment.", newIssues.size()));
        }

        if (trend.meanMagnitude() > recommendation.fullReviewMagnitude()) {
            lines.add("Large average change detected; a full re-review of the assessment is advised.");
        }

        switch (trend.updateNecessity()) {
            case HIGH -> lines.add("Update the materiality assessment immediately.");
            case MEDIUM -> lines.add("Plan an assessment update within the next 3 months.");
            case LOW -> lines.add("Keep the current assessment and continue monitoring.");
        }

        return lines;
    }

    private static String summary(OverallDirection direction, Map<ChangeType, Integer> distribution, int newIssues) {
        StringBuilder summary = new StringBuilder()
                .append("Overall trend: ").append(direction.name().toLowerCase(Locale.ROOT)).append(". ")
                .append("Changes - emerging: ").append(distribution.get(ChangeType.EMERGING))
                .append(", ongoing: ").append(distribution.get(ChangeType.ONGOING))
                .append(", maturing: ").append(distribution.get(ChangeType.MATURING))
                .append(", declining: ").append(distribution.get(ChangeType.DECLINING)).append(".");

        if (newIssues > 0) {
            summary.append(" New issues found: ").append(newIssues).append(".");
        }
        return summary.toString();
    }
}
