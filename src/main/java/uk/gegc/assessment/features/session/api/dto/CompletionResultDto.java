package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CompletionResultDto", description = "Persisted outcome of a session; identical for every caller")
public record CompletionResultDto(
        UUID sessionId,

        @Schema(example = "COMPLETED")
        SessionStatus status,

        @Schema(example = "75")
        int score,

        @Schema(example = "true")
        boolean passed,

        Instant completedAt
) {
}
