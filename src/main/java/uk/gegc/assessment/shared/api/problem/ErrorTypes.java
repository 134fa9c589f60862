package uk.gegc.assessment.shared.api.problem;

import uk.gegc.assessment.shared.result.ErrorKind;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://assessments.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI INVALID_ANSWER = URI.create(BASE_URL + "/invalid-answer");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI INVALID_ACCESS_CODE = URI.create(BASE_URL + "/invalid-access-code");

    // ==================== Session State Errors ====================
    public static final URI ASSESSMENT_NOT_AVAILABLE = URI.create(BASE_URL + "/assessment-not-available");
    public static final URI SESSION_CLOSED = URI.create(BASE_URL + "/session-closed");
    public static final URI SESSION_ALREADY_STARTED = URI.create(BASE_URL + "/session-already-started");
    public static final URI ATTEMPT_LIMIT_REACHED = URI.create(BASE_URL + "/attempt-limit-reached");
    public static final URI COOLDOWN_ACTIVE = URI.create(BASE_URL + "/cooldown-active");

    // ==================== Server Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static URI forKind(ErrorKind kind) {
        return switch (kind) {
            case NOT_AVAILABLE -> ASSESSMENT_NOT_AVAILABLE;
            case NOT_FOUND -> RESOURCE_NOT_FOUND;
            case SESSION_CLOSED -> SESSION_CLOSED;
            case ALREADY_STARTED -> SESSION_ALREADY_STARTED;
            case UNAUTHORIZED -> ACCESS_DENIED;
            case INVALID_ACCESS_CODE -> INVALID_ACCESS_CODE;
            case ATTEMPT_LIMIT_REACHED -> ATTEMPT_LIMIT_REACHED;
            case COOLDOWN_ACTIVE -> COOLDOWN_ACTIVE;
            case INVALID_ANSWER -> INVALID_ANSWER;
        };
    }
}
