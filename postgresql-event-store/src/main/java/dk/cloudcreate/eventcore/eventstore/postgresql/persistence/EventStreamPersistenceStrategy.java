package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.EventStoreUnitOfWork;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.EventType;

import java.util.*;

/**
 * Storage of event streams. All operations run on the handle of the provided {@link EventStoreUnitOfWork}.<br>
 * Queries return at most <code>limit</code> events, so callers page through large result sets
 */
public interface EventStreamPersistenceStrategy {
    /**
     * Create the tables, indexes and counter rows used by the strategy if they don't already exist
     */
    void initializeStorage();

    /**
     * Append events to an aggregate's stream, provided the stream's current version equals <code>expectedVersion</code>
     *
     * @param unitOfWork      the unit of work the append is part of
     * @param aggregateType   the aggregate type
     * @param aggregateId     the aggregate id in its persisted form
     * @param expectedVersion the version the caller expects the stream to have (0 for a new stream)
     * @param events          the events to append
     * @return the appended events in version order
     * @throws ConcurrencyConflictException if the stream's version isn't <code>expectedVersion</code> or another writer appended concurrently
     * @throws StorageException             in case of any other failure
     */
    List<PersistedEvent> append(EventStoreUnitOfWork unitOfWork,
                                AggregateType aggregateType,
                                String aggregateId,
                                long expectedVersion,
                                List<PersistableEvent> events);

    /**
     * @return the events related to the aggregate with <code>aggregateVersion &gt;= fromVersion</code> in version order
     */
    List<PersistedEvent> loadAggregateEvents(EventStoreUnitOfWork unitOfWork, String aggregateId, long fromVersion, int limit);

    /**
     * @return the events with <code>globalSequence &gt;= fromSequence</code> in global order
     */
    List<PersistedEvent> loadEventsByGlobalSequence(EventStoreUnitOfWork unitOfWork, long fromSequence, int limit);

    List<PersistedEvent> loadEventsByEventType(EventStoreUnitOfWork unitOfWork, EventType eventType, long fromSequence, int limit);

    List<PersistedEvent> loadEventsByCorrelationId(EventStoreUnitOfWork unitOfWork, CorrelationId correlationId, long fromSequence, int limit);

    Optional<PersistedEvent> loadEvent(EventStoreUnitOfWork unitOfWork, EventId eventId);

    /**
     * @return the aggregate's current version, or {@link Optional#empty()} if no events have been appended for it
     */
    Optional<Long> currentVersion(EventStoreUnitOfWork unitOfWork, String aggregateId);

    /**
     * @return the highest global sequence committed so far (0 if no events have been appended)
     */
    long lastGlobalSequence(EventStoreUnitOfWork unitOfWork);
}
