package dk.cloudcreate.eventcore.common.result;

/**
 * The tagged kind of a {@link Failure}. Lets a caller decide between "retry automatically" and "fail the request"
 * without inspecting exception types
 */
public enum FailureKind {
    /**
     * Another writer changed the aggregate first. Expected and retryable: reload the aggregate and re-run the command
     */
    CONCURRENCY_CONFLICT(true),
    /**
     * I/O or transaction failure in the underlying storage. Never retried inside the store
     */
    STORAGE_ERROR(false),
    /**
     * The requested aggregate or event doesn't exist
     */
    NOT_FOUND(false),
    /**
     * The Outbox Relay couldn't hand an event over to the Event Bus
     */
    PUBLISH_ERROR(true),
    /**
     * A subscriber's handler failed to process an event
     */
    HANDLER_ERROR(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
