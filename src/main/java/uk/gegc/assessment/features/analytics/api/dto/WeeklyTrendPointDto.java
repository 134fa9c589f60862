package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(name = "WeeklyTrendPointDto", description = "Completions and mean score of one Sunday-based calendar week")
public record WeeklyTrendPointDto(
        @Schema(description = "Sunday that opens the week", example = "2024-03-03")
        LocalDate weekStart,

        @Schema(description = "Short label, month/day", example = "3/3")
        String week,

        @Schema(description = "Attempts finished during the week", example = "6")
        long completions,

        @Schema(description = "Mean score of those attempts, 0 when there were none", example = "72")
        int avgScore
) {
}
