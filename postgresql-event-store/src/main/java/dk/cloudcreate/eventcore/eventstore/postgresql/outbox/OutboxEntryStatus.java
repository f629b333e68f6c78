package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

public enum OutboxEntryStatus {
    /**
     * Appended, not yet acknowledged by the event bus
     */
    PENDING,
    /**
     * Acknowledged by the event bus
     */
    DISPATCHED,
    /**
     * The relay exhausted its retries for the entry. The relay keeps retrying, so the entry may still become {@link #DISPATCHED}
     */
    FAILED
}
