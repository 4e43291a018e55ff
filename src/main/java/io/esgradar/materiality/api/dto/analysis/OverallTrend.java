package io.esgradar.materiality.api.dto.analysis;

import java.util.Map;

public record OverallTrend(
        OverallDirection direction,
        Map<ChangeType, Integer> changeDistribution,
        double meanMagnitude,
        double meanConfidence,
        int newIssueCount,
        UpdateNecessity updateNecessity,
        String summary
) {
    public OverallTrend {
        changeDistribution = changeDistribution == null ? Map.of() : Map.copyOf(changeDistribution);
    }

    public int count(ChangeType type) {
        return changeDistribution.getOrDefault(type, 0);
    }
}
