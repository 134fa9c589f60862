package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.session.domain.model.AssessmentSession;

import java.time.Duration;
import java.time.Instant;

/**
 * Authoritative deadline arithmetic. Only {@code started_at} and the server clock are inputs;
 * nothing the client reports is used here.
 */
public final class SessionDeadline {

    private SessionDeadline() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Instant deadlineAt(AssessmentSession session, Assessment assessment) {
        return session.getStartedAt().plusSeconds(assessment.timeLimitSeconds());
    }

    /**
     * {@code max(0, limit - (now - startedAt))} in whole seconds.
     */
    public static long remainingSeconds(AssessmentSession session, Assessment assessment, Instant now) {
        long elapsed = Duration.between(session.getStartedAt(), now).getSeconds();
        return Math.max(0L, assessment.timeLimitSeconds() - Math.max(0L, elapsed));
    }
}
