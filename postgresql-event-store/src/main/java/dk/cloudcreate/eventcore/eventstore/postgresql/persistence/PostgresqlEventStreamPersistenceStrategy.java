package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import dk.cloudcreate.eventcore.common.persistence.SqlStates;
import dk.cloudcreate.eventcore.common.transaction.UnitOfWorkException;
import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.outbox.OutboxEntryStatus;
import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.EventJSON;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.EventType;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.*;

/**
 * {@link EventStreamPersistenceStrategy} that stores the events of all aggregate types in one events table.<br>
 * <br>
 * The optimistic concurrency check is a compare-and-swap on the aggregate's row in the streams table, so writers
 * appending to different aggregates never contend on the same stream row.<br>
 * Global sequence numbers are allocated by incrementing a single counter row at the end of the append. The row lock
 * is held until the transaction commits, which makes the global sequence gap free and equal to commit order.<br>
 * Every appended event also gets a PENDING entry in the outbox table.
 */
public class PostgresqlEventStreamPersistenceStrategy implements EventStreamPersistenceStrategy {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStreamPersistenceStrategy.class);

    /**
     * Name of the counter row in the sequences table
     */
    public static final String GLOBAL_SEQUENCE_NAME = "global_sequence";

    private final EventStoreUnitOfWorkFactory unitOfWorkFactory;
    private final EventStoreConfiguration     configuration;
    private final PersistedEventRowMapper     rowMapper;

    private final String insertEventSql;
    private final String insertOutboxEntrySql;
    private final String insertStreamSql;
    private final String updateStreamSql;
    private final String selectStreamVersionSql;
    private final String incrementSequenceSql;
    private final String selectSequenceSql;
    private final String selectEventsSqlPrefix;

    public PostgresqlEventStreamPersistenceStrategy(EventStoreUnitOfWorkFactory unitOfWorkFactory,
                                                    EventStoreConfiguration configuration) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = Objects.requireNonNull(configuration, "No configuration provided");
        this.rowMapper = new PersistedEventRowMapper(configuration.jsonSerializer);

        insertEventSql = bind("INSERT INTO {:eventsTable} (global_sequence, event_id, aggregate_type, aggregate_id, aggregate_version, " +
                                      "event_type, event_revision, event_payload, event_metadata, correlation_id, causation_id, occurred_at) " +
                                      "VALUES (:globalSequence, :eventId, :aggregateType, :aggregateId, :aggregateVersion, " +
                                      ":eventType, :eventRevision, :eventPayload, :eventMetaData, :correlationId, :causationId, :occurredAt)",
                              arg("eventsTable", configuration.eventsTableName));
        insertOutboxEntrySql = bind("INSERT INTO {:outboxTable} (global_sequence, event_id, status, dispatch_attempts, created_at) " +
                                            "VALUES (:globalSequence, :eventId, :status, 0, :createdAt)",
                                    arg("outboxTable", configuration.outboxTableName));
        insertStreamSql = bind("INSERT INTO {:streamsTable} (aggregate_id, aggregate_type, aggregate_version) VALUES (:aggregateId, :aggregateType, :newVersion)",
                               arg("streamsTable", configuration.streamsTableName));
        updateStreamSql = bind("UPDATE {:streamsTable} SET aggregate_version = :newVersion WHERE aggregate_id = :aggregateId AND aggregate_version = :expectedVersion",
                               arg("streamsTable", configuration.streamsTableName));
        selectStreamVersionSql = bind("SELECT aggregate_version FROM {:streamsTable} WHERE aggregate_id = :aggregateId",
                                      arg("streamsTable", configuration.streamsTableName));
        incrementSequenceSql = bind("UPDATE {:sequencesTable} SET allocated_sequence = allocated_sequence + :count WHERE sequence_name = :sequenceName",
                                    arg("sequencesTable", configuration.sequencesTableName));
        selectSequenceSql = bind("SELECT allocated_sequence FROM {:sequencesTable} WHERE sequence_name = :sequenceName",
                                 arg("sequencesTable", configuration.sequencesTableName));
        selectEventsSqlPrefix = bind("SELECT * FROM {:eventsTable} WHERE ",
                                     arg("eventsTable", configuration.eventsTableName));
    }

    @Override
    public void initializeStorage() {
        log.info("Initializing event store storage using {}", configuration);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            createEventsTable(handle);
            createStreamsTable(handle);
            createSequencesTable(handle);
            createOutboxTable(handle);
        });
        initializeGlobalSequenceCounter();
    }

    private void createEventsTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:eventsTable} (\n" +
                                    "    global_sequence BIGINT PRIMARY KEY,\n" +
                                    "    event_id VARCHAR(255) NOT NULL,\n" +
                                    "    aggregate_type VARCHAR(255) NOT NULL,\n" +
                                    "    aggregate_id VARCHAR(255) NOT NULL,\n" +
                                    "    aggregate_version BIGINT NOT NULL,\n" +
                                    "    event_type VARCHAR(1024) NOT NULL,\n" +
                                    "    event_revision INTEGER NOT NULL,\n" +
                                    "    event_payload TEXT NOT NULL,\n" +
                                    "    event_metadata TEXT NOT NULL,\n" +
                                    "    correlation_id VARCHAR(255),\n" +
                                    "    causation_id VARCHAR(255),\n" +
                                    "    occurred_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "    UNIQUE (aggregate_id, aggregate_version),\n" +
                                    "    UNIQUE (event_id)\n" +
                                    ")",
                            arg("eventsTable", configuration.eventsTableName)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:eventsTable}_event_type_idx ON {:eventsTable} (event_type, global_sequence)",
                            arg("eventsTable", configuration.eventsTableName)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:eventsTable}_correlation_id_idx ON {:eventsTable} (correlation_id)",
                            arg("eventsTable", configuration.eventsTableName)));
        log.debug("Ensured events table '{}' exists", configuration.eventsTableName);
    }

    private void createStreamsTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:streamsTable} (\n" +
                                    "    aggregate_id VARCHAR(255) PRIMARY KEY,\n" +
                                    "    aggregate_type VARCHAR(255) NOT NULL,\n" +
                                    "    aggregate_version BIGINT NOT NULL\n" +
                                    ")",
                            arg("streamsTable", configuration.streamsTableName)));
        log.debug("Ensured streams table '{}' exists", configuration.streamsTableName);
    }

    private void createSequencesTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:sequencesTable} (\n" +
                                    "    sequence_name VARCHAR(64) PRIMARY KEY,\n" +
                                    "    allocated_sequence BIGINT NOT NULL\n" +
                                    ")",
                            arg("sequencesTable", configuration.sequencesTableName)));
        log.debug("Ensured sequences table '{}' exists", configuration.sequencesTableName);
    }

    private void createOutboxTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:outboxTable} (\n" +
                                    "    global_sequence BIGINT PRIMARY KEY,\n" +
                                    "    event_id VARCHAR(255) NOT NULL,\n" +
                                    "    status VARCHAR(16) NOT NULL,\n" +
                                    "    dispatch_attempts INTEGER NOT NULL,\n" +
                                    "    created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "    last_attempt_at TIMESTAMP WITH TIME ZONE,\n" +
                                    "    last_error TEXT\n" +
                                    ")",
                            arg("outboxTable", configuration.outboxTableName)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:outboxTable}_status_idx ON {:outboxTable} (status)",
                            arg("outboxTable", configuration.outboxTableName)));
        log.debug("Ensured outbox table '{}' exists", configuration.outboxTableName);
    }

    private void initializeGlobalSequenceCounter() {
        try {
            unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
                var existing = unitOfWork.handle()
                                         .createQuery(selectSequenceSql)
                                         .bind("sequenceName", GLOBAL_SEQUENCE_NAME)
                                         .mapTo(Long.class)
                                         .findOne();
                if (existing.isEmpty()) {
                    unitOfWork.handle()
                              .createUpdate(bind("INSERT INTO {:sequencesTable} (sequence_name, allocated_sequence) VALUES (:sequenceName, 0)",
                                                 arg("sequencesTable", configuration.sequencesTableName)))
                              .bind("sequenceName", GLOBAL_SEQUENCE_NAME)
                              .execute();
                    log.info("Initialized the '{}' counter in '{}'", GLOBAL_SEQUENCE_NAME, configuration.sequencesTableName);
                } else {
                    log.debug("The '{}' counter in '{}' is at {}", GLOBAL_SEQUENCE_NAME, configuration.sequencesTableName, existing.get());
                }
            });
        } catch (UnitOfWorkException e) {
            if (!SqlStates.isUniqueViolation(e)) {
                throw e;
            }
            log.debug("The '{}' counter was initialized concurrently by another process", GLOBAL_SEQUENCE_NAME);
        }
    }

    @Override
    public List<PersistedEvent> append(EventStoreUnitOfWork unitOfWork,
                                       AggregateType aggregateType,
                                       String aggregateId,
                                       long expectedVersion,
                                       List<PersistableEvent> events) {
        Objects.requireNonNull(unitOfWork, "No unitOfWork provided");
        Objects.requireNonNull(aggregateType, "No aggregateType provided");
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        Objects.requireNonNull(events, "No events provided");
        if (expectedVersion < 0) {
            throw new IllegalArgumentException(msg("expectedVersion must be 0 or larger, was {}", expectedVersion));
        }

        try {
            var handle = unitOfWork.handle();
            if (events.isEmpty()) {
                var currentVersion = currentVersion(unitOfWork, aggregateId).orElse(0L);
                if (currentVersion != expectedVersion) {
                    throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, currentVersion);
                }
                return List.of();
            }

            var serializedEvents = new ArrayList<EventJSON>(events.size());
            for (var event : events) {
                serializedEvents.add(configuration.jsonSerializer.serializeEvent(event.event()));
            }
            var newVersion = expectedVersion + events.size();
            advanceStreamHead(handle, aggregateType, aggregateId, expectedVersion, newVersion);
            var lastSequence  = allocateGlobalSequences(handle, events.size());
            var firstSequence = lastSequence - events.size() + 1;
            var occurredAt    = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);

            var eventBatch  = handle.prepareBatch(insertEventSql);
            var outboxBatch = handle.prepareBatch(insertOutboxEntrySql);
            var persisted   = new ArrayList<PersistedEvent>(events.size());
            for (var index = 0; index < events.size(); index++) {
                var event           = events.get(index);
                var eventJSON       = serializedEvents.get(index);
                var globalSequence  = firstSequence + index;
                var aggregateVersion = expectedVersion + index + 1;
                eventBatch.bind("globalSequence", globalSequence)
                          .bind("eventId", event.eventId().value())
                          .bind("aggregateType", aggregateType.value())
                          .bind("aggregateId", aggregateId)
                          .bind("aggregateVersion", aggregateVersion)
                          .bind("eventType", eventJSON.getEventType().value())
                          .bind("eventRevision", eventJSON.getRevision().intValue())
                          .bind("eventPayload", eventJSON.getJson())
                          .bind("eventMetaData", configuration.jsonSerializer.serializeMetaData(event.metaData()))
                          .bind("correlationId", event.correlationId().map(CorrelationId::value).orElse(null))
                          .bind("causationId", event.causationId().map(EventId::value).orElse(null))
                          .bind("occurredAt", occurredAt)
                          .add();
                outboxBatch.bind("globalSequence", globalSequence)
                           .bind("eventId", event.eventId().value())
                           .bind("status", OutboxEntryStatus.PENDING.name())
                           .bind("createdAt", occurredAt)
                           .add();
                persisted.add(PersistedEvent.from(event.eventId(),
                                                  aggregateType,
                                                  aggregateId,
                                                  aggregateVersion,
                                                  eventJSON,
                                                  event.metaData(),
                                                  event.correlationId(),
                                                  event.causationId(),
                                                  occurredAt,
                                                  globalSequence));
            }
            eventBatch.execute();
            outboxBatch.execute();
            log.debug("[{}:{}] Appended {} event(s) with versions {}-{} and global sequences {}-{}",
                      aggregateType, aggregateId, events.size(), expectedVersion + 1, newVersion, firstSequence, lastSequence);
            return persisted;
        } catch (ConcurrencyConflictException | StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            if (SqlStates.isConcurrentModification(e)) {
                throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, e);
            }
            throw new StorageException(msg("[{}:{}] Failed to append {} event(s) with expected version {}",
                                           aggregateType, aggregateId, events.size(), expectedVersion), e);
        }
    }

    private void advanceStreamHead(Handle handle, AggregateType aggregateType, String aggregateId, long expectedVersion, long newVersion) {
        if (expectedVersion == 0) {
            var currentVersion = handle.createQuery(selectStreamVersionSql)
                                       .bind("aggregateId", aggregateId)
                                       .mapTo(Long.class)
                                       .findOne();
            if (currentVersion.isPresent()) {
                throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, currentVersion.get());
            }
            handle.createUpdate(insertStreamSql)
                  .bind("aggregateId", aggregateId)
                  .bind("aggregateType", aggregateType.value())
                  .bind("newVersion", newVersion)
                  .execute();
            return;
        }

        var rowsUpdated = handle.createUpdate(updateStreamSql)
                                .bind("aggregateId", aggregateId)
                                .bind("expectedVersion", expectedVersion)
                                .bind("newVersion", newVersion)
                                .execute();
        if (rowsUpdated == 0) {
            var currentVersion = handle.createQuery(selectStreamVersionSql)
                                       .bind("aggregateId", aggregateId)
                                       .mapTo(Long.class)
                                       .findOne()
                                       .orElse(0L);
            throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, currentVersion);
        }
    }

    private long allocateGlobalSequences(Handle handle, int count) {
        var rowsUpdated = handle.createUpdate(incrementSequenceSql)
                                .bind("count", count)
                                .bind("sequenceName", GLOBAL_SEQUENCE_NAME)
                                .execute();
        if (rowsUpdated != 1) {
            throw new StorageException(msg("The '{}' counter row is missing from '{}'. Was the storage initialized?",
                                           GLOBAL_SEQUENCE_NAME, configuration.sequencesTableName), null);
        }
        return handle.createQuery(selectSequenceSql)
                     .bind("sequenceName", GLOBAL_SEQUENCE_NAME)
                     .mapTo(Long.class)
                     .one();
    }

    @Override
    public List<PersistedEvent> loadAggregateEvents(EventStoreUnitOfWork unitOfWork, String aggregateId, long fromVersion, int limit) {
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        return unitOfWork.handle()
                         .createQuery(selectEventsSqlPrefix + "aggregate_id = :aggregateId AND aggregate_version >= :fromVersion ORDER BY aggregate_version ASC LIMIT :limit")
                         .bind("aggregateId", aggregateId)
                         .bind("fromVersion", fromVersion)
                         .bind("limit", limit)
                         .map(rowMapper)
                         .list();
    }

    @Override
    public List<PersistedEvent> loadEventsByGlobalSequence(EventStoreUnitOfWork unitOfWork, long fromSequence, int limit) {
        return unitOfWork.handle()
                         .createQuery(selectEventsSqlPrefix + "global_sequence >= :fromSequence ORDER BY global_sequence ASC LIMIT :limit")
                         .bind("fromSequence", fromSequence)
                         .bind("limit", limit)
                         .map(rowMapper)
                         .list();
    }

    @Override
    public List<PersistedEvent> loadEventsByEventType(EventStoreUnitOfWork unitOfWork, EventType eventType, long fromSequence, int limit) {
        Objects.requireNonNull(eventType, "No eventType provided");
        return unitOfWork.handle()
                         .createQuery(selectEventsSqlPrefix + "event_type = :eventType AND global_sequence >= :fromSequence ORDER BY global_sequence ASC LIMIT :limit")
                         .bind("eventType", eventType.value())
                         .bind("fromSequence", fromSequence)
                         .bind("limit", limit)
                         .map(rowMapper)
                         .list();
    }

    @Override
    public List<PersistedEvent> loadEventsByCorrelationId(EventStoreUnitOfWork unitOfWork, CorrelationId correlationId, long fromSequence, int limit) {
        Objects.requireNonNull(correlationId, "No correlationId provided");
        return unitOfWork.handle()
                         .createQuery(selectEventsSqlPrefix + "correlation_id = :correlationId AND global_sequence >= :fromSequence ORDER BY global_sequence ASC LIMIT :limit")
                         .bind("correlationId", correlationId.value())
                         .bind("fromSequence", fromSequence)
                         .bind("limit", limit)
                         .map(rowMapper)
                         .list();
    }

    @Override
    public Optional<PersistedEvent> loadEvent(EventStoreUnitOfWork unitOfWork, EventId eventId) {
        Objects.requireNonNull(eventId, "No eventId provided");
        return unitOfWork.handle()
                         .createQuery(selectEventsSqlPrefix + "event_id = :eventId")
                         .bind("eventId", eventId.value())
                         .map(rowMapper)
                         .findOne();
    }

    @Override
    public Optional<Long> currentVersion(EventStoreUnitOfWork unitOfWork, String aggregateId) {
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        return unitOfWork.handle()
                         .createQuery(selectStreamVersionSql)
                         .bind("aggregateId", aggregateId)
                         .mapTo(Long.class)
                         .findOne();
    }

    @Override
    public long lastGlobalSequence(EventStoreUnitOfWork unitOfWork) {
        return unitOfWork.handle()
                         .createQuery(selectSequenceSql)
                         .bind("sequenceName", GLOBAL_SEQUENCE_NAME)
                         .mapTo(Long.class)
                         .findOne()
                         .orElse(0L);
    }
}
