package dk.cloudcreate.eventcore.common.result;

import java.util.*;
import java.util.function.*;

/**
 * The outcome of an operation that may fail in an expected way: either a value or a {@link Failure}.<br>
 * Operations that return a {@link Result} never throw for the failure kinds they can report, so the
 * failure path is visible in their signature.
 *
 * @param <T> the success value type ({@link Void} for operations that only report success/failure)
 */
public final class Result<T> {

    private final T       value;
    private final Failure failure;

    private Result(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static Result<Void> ok() {
        return success(null);
    }

    public static <T> Result<T> failure(Failure failure) {
        return new Result<>(null, Objects.requireNonNull(failure, "No failure provided"));
    }

    public static <T> Result<T> failure(FailureKind kind, RuntimeException cause) {
        return failure(Failure.of(kind, cause));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this is a failure
     */
    public T value() {
        if (failure != null) {
            throw new IllegalStateException("Result is a failure: " + failure, failure.cause());
        }
        return value;
    }

    /**
     * @return the failure
     * @throws IllegalStateException if this is a success
     */
    public Failure failure() {
        if (failure == null) {
            throw new IllegalStateException("Result is a success");
        }
        return failure;
    }

    public Optional<Failure> failureIfAny() {
        return Optional.ofNullable(failure);
    }

    public boolean isFailureOfKind(FailureKind kind) {
        return failure != null && failure.is(kind);
    }

    /**
     * @return the success value
     * @throws RuntimeException the {@link Failure#cause()} if this is a failure
     */
    public T orElseThrow() {
        if (failure != null) {
            throw failure.cause();
        }
        return value;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return new Result<>(mapper.apply(value), null);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return mapper.apply(value);
    }

    public Result<T> onFailure(Consumer<Failure> failureConsumer) {
        if (failure != null) {
            failureConsumer.accept(failure);
        }
        return this;
    }

    @Override
    public String toString() {
        return failure == null ? "Success{" + value + '}' : failure.toString();
    }
}
