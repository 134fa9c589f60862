package uk.gegc.assessment.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "PerformerDto", description = "A finished attempt listed among the best or worst scores")
public record PerformerDto(
        @Schema(description = "Session id")
        UUID sessionId,

        @Schema(description = "Candidate id")
        UUID userId,

        @Schema(description = "Candidate display name, when known", example = "jdoe")
        String name,

        @Schema(description = "Score 0-100", example = "85")
        int score,

        @Schema(description = "Whether the attempt passed", example = "true")
        boolean passed,

        @Schema(description = "When the attempt finished")
        Instant completedAt
) {
}
