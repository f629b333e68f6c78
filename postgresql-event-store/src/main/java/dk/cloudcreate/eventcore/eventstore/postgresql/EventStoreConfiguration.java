package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.*;

import java.time.Duration;
import java.util.*;

import static dk.cloudcreate.eventcore.common.persistence.SqlIdentifiers.requireValidSqlIdentifier;

/**
 * Immutable configuration of the {@link PostgresqlEventStore}.<br>
 * Table names are validated as plain SQL identifiers, since they are string concatenated into the SQL statements
 */
public final class EventStoreConfiguration {
    public static final String DEFAULT_EVENTS_TABLE_NAME    = "events";
    public static final String DEFAULT_STREAMS_TABLE_NAME   = "event_streams";
    public static final String DEFAULT_SEQUENCES_TABLE_NAME = "event_store_sequences";
    public static final String DEFAULT_OUTBOX_TABLE_NAME    = "event_outbox";
    public static final int    DEFAULT_QUERY_PAGE_SIZE      = 100;

    /**
     * Holds every appended event
     */
    public final String             eventsTableName;
    /**
     * One stream head row per aggregate. Used for the optimistic concurrency check
     */
    public final String             streamsTableName;
    /**
     * Holds the global sequence counter row
     */
    public final String             sequencesTableName;
    /**
     * One outbox entry per appended event
     */
    public final String             outboxTableName;
    /**
     * Number of events fetched per query when streaming events
     */
    public final int                queryPageSize;
    /**
     * Optional statement timeout
     */
    public final Optional<Duration> queryTimeout;
    public final JSONSerializer     jsonSerializer;

    public EventStoreConfiguration(String eventsTableName,
                                   String streamsTableName,
                                   String sequencesTableName,
                                   String outboxTableName,
                                   int queryPageSize,
                                   Optional<Duration> queryTimeout,
                                   JSONSerializer jsonSerializer) {
        this.eventsTableName = requireValidSqlIdentifier(eventsTableName);
        this.streamsTableName = requireValidSqlIdentifier(streamsTableName);
        this.sequencesTableName = requireValidSqlIdentifier(sequencesTableName);
        this.outboxTableName = requireValidSqlIdentifier(outboxTableName);
        if (queryPageSize < 1) {
            throw new IllegalArgumentException("queryPageSize must be 1 or larger");
        }
        this.queryPageSize = queryPageSize;
        this.queryTimeout = Objects.requireNonNull(queryTimeout, "No queryTimeout provided");
        this.jsonSerializer = Objects.requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    /**
     * Default table names, a page size of {@value #DEFAULT_QUERY_PAGE_SIZE}, no query timeout and a {@link JacksonJSONSerializer}
     * using {@link JacksonJSONSerializer#createDefaultObjectMapper()}
     */
    public static EventStoreConfiguration defaultConfiguration() {
        return new EventStoreConfiguration(DEFAULT_EVENTS_TABLE_NAME,
                                           DEFAULT_STREAMS_TABLE_NAME,
                                           DEFAULT_SEQUENCES_TABLE_NAME,
                                           DEFAULT_OUTBOX_TABLE_NAME,
                                           DEFAULT_QUERY_PAGE_SIZE,
                                           Optional.empty(),
                                           new JacksonJSONSerializer());
    }

    public EventStoreConfiguration withQueryPageSize(int queryPageSize) {
        return new EventStoreConfiguration(eventsTableName, streamsTableName, sequencesTableName, outboxTableName, queryPageSize, queryTimeout, jsonSerializer);
    }

    public EventStoreConfiguration withQueryTimeout(Duration queryTimeout) {
        return new EventStoreConfiguration(eventsTableName, streamsTableName, sequencesTableName, outboxTableName, queryPageSize, Optional.of(queryTimeout), jsonSerializer);
    }

    public EventStoreConfiguration withJsonSerializer(JSONSerializer jsonSerializer) {
        return new EventStoreConfiguration(eventsTableName, streamsTableName, sequencesTableName, outboxTableName, queryPageSize, queryTimeout, jsonSerializer);
    }

    @Override
    public String toString() {
        return "EventStoreConfiguration{" +
                "eventsTableName='" + eventsTableName + '\'' +
                ", streamsTableName='" + streamsTableName + '\'' +
                ", sequencesTableName='" + sequencesTableName + '\'' +
                ", outboxTableName='" + outboxTableName + '\'' +
                ", queryPageSize=" + queryPageSize +
                ", queryTimeout=" + queryTimeout +
                '}';
    }
}
