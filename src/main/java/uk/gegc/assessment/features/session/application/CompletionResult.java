package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.session.domain.model.AssessmentSession;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

public record CompletionResult(UUID sessionId, SessionStatus status, int score, boolean passed, Instant completedAt) {

    /**
     * Reads the persisted terminal state; used by callers that lost the race or arrive late.
     */
    public static CompletionResult of(AssessmentSession session) {
        return new CompletionResult(
                session.getId(),
                session.getStatus(),
                session.getScore() != null ? session.getScore() : 0,
                Boolean.TRUE.equals(session.getPassed()),
                session.getCompletedAt()
        );
    }
}
