package uk.gegc.assessment.features.session.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.assessment.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per session, by the caller that won the transition to a terminal status.
 */
public class SessionCompletedEvent extends ApplicationEvent {

    private final UUID sessionId;
    private final UUID assessmentId;
    private final UUID userId;
    private final SessionStatus status;
    private final int score;
    private final boolean passed;
    private final Instant completedAt;

    public SessionCompletedEvent(Object source, UUID sessionId, UUID assessmentId, UUID userId,
                                 SessionStatus status, int score, boolean passed, Instant completedAt) {
        super(source);
        this.sessionId = sessionId;
        this.assessmentId = assessmentId;
        this.userId = userId;
        this.status = status;
        this.score = score;
        this.passed = passed;
        this.completedAt = completedAt;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public UUID getAssessmentId() {
        return assessmentId;
    }

    public UUID getUserId() {
        return userId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public int getScore() {
        return score;
    }

    public boolean isPassed() {
        return passed;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
