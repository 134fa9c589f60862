package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "OrganizationAnalyticsDto", description = "Rollup across every assessment of an organization")
public record OrganizationAnalyticsDto(
        UUID organizationId,
        long totalAssessments,
        long publishedAssessments,
        long totalSessions,
        long completedSessions,
        long timedOutSessions,
        long uniqueCandidates,
        int avgScore,
        double medianScore,
        int passRate,
        List<ScoreBucketDto> scoreDistribution,
        List<PerformerDto> topPerformers,
        List<PerformerDto> bottomPerformers,

        @Schema(description = "Oldest week first; always the configured number of weeks")
        List<WeeklyTrendPointDto> weeklyTrend,

        @Schema(description = "Sorted by session count, most active first")
        List<AssessmentBreakdownDto> assessmentStats
) {
}
