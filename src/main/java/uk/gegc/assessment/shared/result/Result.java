package uk.gegc.assessment.shared.result;

import uk.gegc.assessment.shared.exception.OperationFailedException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a core engine operation: either a {@link Success} carrying the payload
 * or a {@link Failure} carrying an {@link ErrorKind} and a human readable message.
 *
 * @param <T> payload type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message);
    }

    boolean isSuccess();

    /**
     * Returns the payload, or raises {@link OperationFailedException} for a failure.
     * Used by the REST layer, where the exception is rendered as a problem response.
     */
    T orElseThrow();

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T orElseThrow() {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(value);
        }
    }

    record Failure<T>(ErrorKind kind, String message) implements Result<T> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T orElseThrow() {
            throw new OperationFailedException(kind, message);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(kind, message);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(kind, message);
        }
    }
}
