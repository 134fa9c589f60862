package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "AssessmentAnalyticsDto", description = "Rollup of finished attempts of one assessment")
public record AssessmentAnalyticsDto(
        UUID assessmentId,
        String title,
        int questionCount,
        int timeLimitMinutes,
        int passScore,

        @Schema(description = "All sessions, in progress included", example = "25")
        long totalSessions,
        long inProgressCount,
        long completedCount,
        long timedOutCount,

        @Schema(description = "Finished attempts (completed or timed out)", example = "22")
        long totalAttempts,

        @Schema(description = "Rounded mean score, 0 without attempts", example = "68")
        int avgScore,

        @Schema(description = "Median score", example = "70.5")
        double medianScore,

        @Schema(description = "Rounded percentage of passed attempts", example = "55")
        int passRate,

        @Schema(description = "Mean tab switches per finished attempt", example = "1.4")
        double avgTabSwitches,

        List<ScoreBucketDto> scoreDistribution,
        List<PerformerDto> topPerformers,
        List<PerformerDto> bottomPerformers,
        List<QuestionStatDto> questionStats
) {
}
