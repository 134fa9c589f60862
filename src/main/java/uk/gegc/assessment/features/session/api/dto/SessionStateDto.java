package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "SessionStateDto", description = "Session as returned by start or resume")
public record SessionStateDto(
        UUID sessionId,
        UUID assessmentId,
        String assessmentTitle,
        SessionStatus status,
        Instant startedAt,

        @Schema(description = "Authoritative deadline, startedAt plus the time limit")
        Instant deadlineAt,

        @Schema(description = "Server clock when the response was built; lets the client correct its own clock")
        Instant serverTime,

        @Schema(description = "Seconds left according to the server", example = "1740")
        long timeRemainingSeconds,

        int timeLimitMinutes,
        int tabSwitchCount,
        List<SessionQuestionDto> questions,
        List<SubmittedAnswerDto> answers,

        @Schema(description = "Set once the session is terminal")
        Integer score,
        Boolean passed,
        Instant completedAt
) {
}
