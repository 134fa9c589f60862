package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

public interface ProctoringService {

    /**
     * Appends a tab-hidden entry and bumps the counter. Returns the new counter value.
     */
    Result<Integer> recordFocusLoss(UUID sessionId, UUID userId);

    /**
     * Violation log of a session, for content managers of the owning organization.
     */
    Result<ViolationReport> getViolations(UUID sessionId, UUID requesterId);
}
