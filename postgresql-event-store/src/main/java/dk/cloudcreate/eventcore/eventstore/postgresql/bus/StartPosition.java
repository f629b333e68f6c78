package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

/**
 * Where a new subscriber (one without a stored checkpoint) starts receiving events
 */
public enum StartPosition {
    /**
     * Replay all matching events already in the event store, then continue with new events
     */
    BEGINNING,
    /**
     * Only receive events appended after the subscription was created
     */
    LATEST
}
