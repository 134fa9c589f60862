package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.features.session.domain.model.CompletionReason;
import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

public interface CompletionService {

    /**
     * Finalizes and scores a session. Idempotent: once a session is terminal every call returns the
     * persisted score, whatever {@code reason} it passes.
     */
    Result<CompletionResult> complete(UUID sessionId, UUID userId, CompletionReason reason);
}
