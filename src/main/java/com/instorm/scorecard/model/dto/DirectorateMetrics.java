package com.instorm.scorecard.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directorate roll-up from {@code GET /analytics/dashboard}. Kept exactly as the API
 * sent it; any field may be missing. Use the {@code orZero} accessors for display.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectorateMetrics(
    Integer totalRegions,
    Integer totalTeamMembers,
    Double averagePerformance,
    Integer totalEvaluations,
    Integer evaluationsCompleted,
    Double averageScore
) {

    public static DirectorateMetrics zeroed() {
        return new DirectorateMetrics(0, 0, 0.0, 0, 0, 0.0);
    }

    public int totalRegionsOrZero() {
        return totalRegions != null ? totalRegions : 0;
    }

    public int totalTeamMembersOrZero() {
        return totalTeamMembers != null ? totalTeamMembers : 0;
    }

    public double averagePerformanceOrZero() {
        return averagePerformance != null ? averagePerformance : 0.0;
    }

    public int totalEvaluationsOrZero() {
        return totalEvaluations != null ? totalEvaluations : 0;
    }

    public int evaluationsCompletedOrZero() {
        return evaluationsCompleted != null ? evaluationsCompleted : 0;
    }

    public double averageScoreOrZero() {
        return averageScore != null ? averageScore : 0.0;
    }
}
