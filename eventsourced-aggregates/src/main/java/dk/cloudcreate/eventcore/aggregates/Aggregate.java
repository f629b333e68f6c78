package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.List;
import java.util.stream.Stream;

/**
 * Common interface that all concrete {@link Aggregate}'s must implement. Most concrete implementations choose to extend the {@link AggregateRoot} class.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate self type
 * @see AggregateRoot
 */
public interface Aggregate<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    ID aggregateId();

    /**
     * The version of the last event persisted in relation to this aggregate, or 0 if no events have been persisted yet.<br>
     * This is the <code>expectedVersion</code> used when the {@link #uncommittedChanges()} are appended to the {@link EventStore}
     */
    long version();

    /**
     * The events that have been applied to this aggregate instance but not yet persisted to the {@link EventStore}
     */
    List<?> uncommittedChanges();

    /**
     * Resets the {@link #uncommittedChanges()} and advances the {@link #version()} past them,
     * effectively marking them as having been persisted and committed to the {@link EventStore}
     */
    void markChangesAsCommitted();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param aggregateId     the id of the aggregate
     * @param persistedEvents the previous persisted events related to this aggregate instance in version order, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    AGGREGATE_TYPE rehydrate(ID aggregateId, Stream<PersistedEvent> persistedEvents);

    /**
     * Has the aggregate been initialized using previously persisted events using the {@link #rehydrate(Object, Stream)} method
     */
    boolean hasBeenRehydrated();

    /**
     * Called when the {@link dk.cloudcreate.eventcore.common.transaction.UnitOfWork} the aggregate was associated with is rolled back.
     * A discarded aggregate rejects further changes and must be loaded again
     */
    void discard();

    boolean isDiscarded();
}
