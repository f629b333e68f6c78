package dk.cloudcreate.eventcore.common.result;

import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Describes why an operation failed: a {@link FailureKind}, a human readable message and the underlying cause
 */
public final class Failure {
    private final FailureKind       kind;
    private final String            message;
    private final RuntimeException  cause;

    private Failure(FailureKind kind, String message, RuntimeException cause) {
        this.kind = Objects.requireNonNull(kind, "No kind provided");
        this.message = Objects.requireNonNull(message, "No message provided");
        this.cause = Objects.requireNonNull(cause, "No cause provided");
    }

    public static Failure of(FailureKind kind, RuntimeException cause) {
        Objects.requireNonNull(cause, "No cause provided");
        return new Failure(kind, String.valueOf(cause.getMessage()), cause);
    }

    /**
     * Classify a throwable by walking its cause chain for the first {@link FailureKindAware} exception.
     * Anything unclassified is treated as {@link FailureKind#STORAGE_ERROR}
     *
     * @param throwable the throwable
     * @return the failure
     */
    public static Failure from(Throwable throwable) {
        Objects.requireNonNull(throwable, "No throwable provided");
        var kind    = FailureKind.STORAGE_ERROR;
        var current = throwable;
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        while (current != null && visited.add(current)) {
            if (current instanceof FailureKindAware) {
                kind = ((FailureKindAware) current).failureKind();
                if (current instanceof RuntimeException) {
                    return of(kind, (RuntimeException) current);
                }
                break;
            }
            current = current.getCause();
        }
        var cause = throwable instanceof RuntimeException ? (RuntimeException) throwable :
                    new IllegalStateException(msg("{}: {}", throwable.getClass().getSimpleName(), throwable.getMessage()), throwable);
        return new Failure(kind, String.valueOf(throwable.getMessage()), cause);
    }

    public FailureKind kind() {
        return kind;
    }

    public String message() {
        return message;
    }

    public RuntimeException cause() {
        return cause;
    }

    public boolean is(FailureKind kind) {
        return this.kind == kind;
    }

    @Override
    public String toString() {
        return "Failure{" +
                "kind=" + kind +
                ", message='" + message + '\'' +
                '}';
    }
}
