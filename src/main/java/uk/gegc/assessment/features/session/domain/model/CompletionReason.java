package uk.gegc.assessment.features.session.domain.model;

/**
 * Why a client asked to finish a session. Only a hint: the persisted status is decided
 * from server time.
 */
public enum CompletionReason {
    MANUAL,
    EXPIRED
}
