package uk.gegc.assessment.features.session.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "SessionSummaryDto", description = "Candidate view of one session, with review once allowed")
public record SessionSummaryDto(
        UUID sessionId,
        UUID assessmentId,
        String assessmentTitle,
        SessionStatus status,
        Instant startedAt,
        Instant deadlineAt,
        Instant completedAt,
        long timeRemainingSeconds,
        int totalQuestions,
        int answeredQuestions,
        Integer score,
        Boolean passed,
        int passScore,
        int tabSwitchCount,

        @Schema(description = "Whether a new attempt could be started now")
        boolean canRetake,

        @Schema(description = "When the retake cooldown ends, if it is still running")
        Instant cooldownEndsAt,

        boolean reviewAvailable,
        List<QuestionReviewDto> review
) {
}
