package uk.gegc.assessment.features.session.application;

import uk.gegc.assessment.shared.result.Result;

import java.util.UUID;

public interface SessionLifecycleService {

    /**
     * Starts a new attempt or resumes the caller's in-progress one. A resume that finds the
     * deadline already passed finalizes the session as timed out and returns it terminal.
     *
     * @param accessCode only checked when a new session is created
     * @param ipAddress  stored on a newly created session
     */
    Result<SessionView> startOrResume(UUID userId, UUID assessmentId, String accessCode, String ipAddress);
}
