package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.session.domain.model.SessionViolation;

import java.util.List;
import java.util.UUID;

/**
 * Focus-loss log as shown to reviewers. {@code candidateEmail} falls back to a short user
 * label when the account has no email on file.
 */
public record ViolationReport(
        UUID sessionId,
        UUID userId,
        String candidateEmail,
        String assessmentTitle,
        int tabSwitchCount,
        List<SessionViolation> violations
) {
}
