package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Maps a row of the events table into a {@link PersistedEvent}. The event payload stays serialized until
 * {@link EventJSON#deserialize()} is called
 */
class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final JSONSerializer jsonSerializer;

    PersistedEventRowMapper(JSONSerializer jsonSerializer) {
        this.jsonSerializer = Objects.requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = rs.getString("event_type");
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalStateException(msg("Event with global sequence {} has an empty event_type column", rs.getLong("global_sequence")));
        }
        var eventJSON = new EventJSON(jsonSerializer,
                                      EventType.of(eventType),
                                      EventRevision.of(rs.getInt("event_revision")),
                                      rs.getString("event_payload"));
        return PersistedEvent.from(EventId.of(rs.getString("event_id")),
                                   AggregateType.of(rs.getString("aggregate_type")),
                                   rs.getString("aggregate_id"),
                                   rs.getLong("aggregate_version"),
                                   eventJSON,
                                   jsonSerializer.deserializeMetaData(rs.getString("event_metadata")),
                                   CorrelationId.optionalFrom(rs.getString("correlation_id")),
                                   EventId.optionalFrom(rs.getString("causation_id")),
                                   rs.getObject("occurred_at", OffsetDateTime.class),
                                   rs.getLong("global_sequence"));
    }
}
