package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

public interface SessionQueryService {

    Result<SessionSummary> getSessionSummary(UUID sessionId, UUID userId);
}
