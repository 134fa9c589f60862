package uk.gegc.assessment.features.notification.application;

import java.util.UUID;

/**
 * Delivers a finished session's result to the candidate. Implementations must not throw:
 * notification is best effort.
 */
public interface ResultNotifier {

    void notifyResult(UUID userId, UUID assessmentId, int score, boolean passed);
}
