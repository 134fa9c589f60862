package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Candidate-facing summary. {@code review} is empty unless the session is terminal and the
 * assessment allows review.
 */
public record SessionSummary(
        UUID sessionId,
        UUID assessmentId,
        String assessmentTitle,
        SessionStatus status,
        Instant startedAt,
        Instant deadlineAt,
        Instant completedAt,
        long remainingSeconds,
        int totalQuestions,
        int answeredQuestions,
        Integer score,
        Boolean passed,
        int passScore,
        int tabSwitchCount,
        boolean canRetake,
        Instant cooldownEndsAt,
        boolean reviewAvailable,
        List<QuestionReview> review
) {

    public record QuestionReview(
            UUID questionId,
            String stem,
            List<String> options,
            Integer selectedIndex,
            int correctIndex,
            boolean correct
    ) {
    }
}
