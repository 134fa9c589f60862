package uk.gegc.assessment.shared.exception;

import lombok.Getter;
import uk.gegc.assessment.shared.result.ErrorKind;

/**
 * Raised at the transport boundary when a {@link uk.gegc.assessment.shared.result.Result.Failure}
 * is unwrapped. Carries the failure kind so the exception handler can pick a status code.
 */
@Getter
public class OperationFailedException extends RuntimeException {

    private final ErrorKind kind;

    public OperationFailedException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
