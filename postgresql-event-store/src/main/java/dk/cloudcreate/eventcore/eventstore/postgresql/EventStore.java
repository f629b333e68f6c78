package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.transaction.UnitOfWork;
import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.EventStoreLocalEventBus;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.PersistableEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.EventStoreUnitOfWorkFactory;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.EventType;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;
import java.util.stream.Stream;

/**
 * Append-only store of events grouped into one stream per aggregate.<br>
 * Aggregate ids are converted to their persisted form using {@link Object#toString()} and must be unique across aggregate types.<br>
 * <br>
 * Appends use optimistic concurrency: an append only succeeds if the aggregate's current version equals the expected version.<br>
 * Reads return lazy {@link Stream}'s that fetch the events page by page. Close them (or consume them fully) when done.
 */
public interface EventStore {
    /**
     * Append events to the stream of an aggregate.<br>
     * If a {@link UnitOfWork} is active, the append joins it and a failure marks it as rollback only.
     * Otherwise the append runs in, and commits, its own {@link UnitOfWork}.
     *
     * @param aggregateType   the aggregate type
     * @param aggregateId     the aggregate id
     * @param expectedVersion the version the caller expects the aggregate to have (0 for a new aggregate)
     * @param events          business events and/or {@link PersistableEvent}'s
     * @return the appended events, or a failure of kind {@link FailureKind#CONCURRENCY_CONFLICT} or {@link FailureKind#STORAGE_ERROR}
     */
    Result<List<PersistedEvent>> append(AggregateType aggregateType, Object aggregateId, long expectedVersion, List<?> events);

    /**
     * Read all events related to an aggregate in version order
     *
     * @throws StorageException if the events couldn't be read
     */
    default Stream<PersistedEvent> read(Object aggregateId) {
        return read(aggregateId, 0);
    }

    /**
     * Read the events related to an aggregate, starting at (and including) <code>fromVersion</code>, in version order.
     * Versions start at 1, so a <code>fromVersion</code> of 0 reads the full history
     *
     * @throws StorageException if the events couldn't be read
     */
    Stream<PersistedEvent> read(Object aggregateId, long fromVersion);

    /**
     * Read up to <code>limit</code> events in global order, starting at (and including) <code>fromSequence</code>.
     * A <code>fromSequence</code> of 0 reads from the first event
     *
     * @throws StorageException if the events couldn't be read
     */
    Stream<PersistedEvent> readAll(long fromSequence, int limit);

    /**
     * Read up to <code>limit</code> events of the given type in global order, starting at (and including) <code>fromSequence</code>
     */
    Stream<PersistedEvent> readByEventType(EventType eventType, long fromSequence, int limit);

    /**
     * Read all events with the given correlation id in global order
     */
    Stream<PersistedEvent> readByCorrelationId(CorrelationId correlationId);

    Optional<PersistedEvent> loadEvent(EventId eventId);

    /**
     * @return the aggregate's current version (0 if no events have been appended for it)
     */
    long currentVersion(Object aggregateId);

    /**
     * @return the global sequence of the latest committed event (0 if the store is empty)
     */
    long lastGlobalSequence();

    /**
     * Poll the store for events in global order. The returned {@link Flux} never completes on its own
     *
     * @param fromSequence    the first global sequence to return
     * @param batchSize       max number of events fetched per poll
     * @param pollingInterval delay between polls
     */
    Flux<PersistedEvent> pollEvents(long fromSequence, int batchSize, Duration pollingInterval);

    EventStoreUnitOfWorkFactory getUnitOfWorkFactory();

    /**
     * In-process notifications of the events persisted by each {@link UnitOfWork}
     */
    EventStoreLocalEventBus localEventBus();

    EventStoreConfiguration configuration();
}
