package uk.gegc.assessment.shared.result;

/**
 * Expected, recoverable failure conditions of the session engine.
 * None of them is a process error; each is reported back to the caller as a
 * {@link Result.Failure}.
 */
public enum ErrorKind {
    /** Assessment is not published, outside its scheduling window, or has too few questions. */
    NOT_AVAILABLE,
    /** Session does not exist or belongs to another user. */
    NOT_FOUND,
    /** Write attempted against a terminal session. */
    SESSION_CLOSED,
    /** Lost the creation race for the single in-progress slot; recovered internally. */
    ALREADY_STARTED,
    /** Caller lacks the organization role required for a manager-only read. */
    UNAUTHORIZED,
    /** Access code missing or wrong when creating a session. */
    INVALID_ACCESS_CODE,
    /** The candidate used every allowed attempt. */
    ATTEMPT_LIMIT_REACHED,
    /** A retake is requested before the cooldown after the previous attempt ended. */
    COOLDOWN_ACTIVE,
    /** Selected option index is outside the question's options. */
    INVALID_ANSWER
}
