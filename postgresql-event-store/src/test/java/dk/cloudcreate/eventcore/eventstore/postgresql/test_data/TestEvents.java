package dk.cloudcreate.eventcore.eventstore.postgresql.test_data;

import dk.cloudcreate.eventcore.common.types.EventId;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.EventMetaData;
import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.*;

import java.time.*;
import java.util.Optional;

/**
 * Builds {@link PersistedEvent}'s without going through an event store
 */
public final class TestEvents {
    private static final JSONSerializer JSON_SERIALIZER = new JacksonJSONSerializer();

    private TestEvents() {
    }

    public static PersistedEvent persistedEvent(AggregateType aggregateType, Object aggregateId, long aggregateVersion, long globalSequence, Object event) {
        return PersistedEvent.from(EventId.random(),
                                   aggregateType,
                                   aggregateId.toString(),
                                   aggregateVersion,
                                   JSON_SERIALIZER.serializeEvent(event),
                                   EventMetaData.empty(),
                                   Optional.empty(),
                                   Optional.empty(),
                                   OffsetDateTime.now(ZoneOffset.UTC),
                                   globalSequence);
    }
}
