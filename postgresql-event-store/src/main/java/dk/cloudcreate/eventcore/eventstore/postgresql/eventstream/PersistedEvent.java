package dk.cloudcreate.eventcore.eventstore.postgresql.eventstream;

import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.EventMetaData;
import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.EventJSON;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * An event that has been appended to the event store. Immutable.<br>
 * The {@link #aggregateVersion()}, {@link #globalSequence()} and {@link #occurredAt()} are assigned by the store.<br>
 * Two {@link PersistedEvent}'s are equal if they have the same {@link #eventId()}
 */
public final class PersistedEvent {
    private final EventId        eventId;
    private final AggregateType  aggregateType;
    private final String         aggregateId;
    private final long           aggregateVersion;
    private final EventJSON      event;
    private final EventMetaData  metaData;
    private final CorrelationId  correlationId;
    private final EventId        causationId;
    private final OffsetDateTime occurredAt;
    private final long           globalSequence;

    private PersistedEvent(EventId eventId,
                           AggregateType aggregateType,
                           String aggregateId,
                           long aggregateVersion,
                           EventJSON event,
                           EventMetaData metaData,
                           CorrelationId correlationId,
                           EventId causationId,
                           OffsetDateTime occurredAt,
                           long globalSequence) {
        this.eventId = Objects.requireNonNull(eventId, "No eventId provided");
        this.aggregateType = Objects.requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = Objects.requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateVersion = aggregateVersion;
        this.event = Objects.requireNonNull(event, "No event provided");
        this.metaData = Objects.requireNonNull(metaData, "No metaData provided");
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.occurredAt = Objects.requireNonNull(occurredAt, "No occurredAt provided");
        this.globalSequence = globalSequence;
    }

    public static PersistedEvent from(EventId eventId,
                                      AggregateType aggregateType,
                                      String aggregateId,
                                      long aggregateVersion,
                                      EventJSON event,
                                      EventMetaData metaData,
                                      Optional<CorrelationId> correlationId,
                                      Optional<EventId> causationId,
                                      OffsetDateTime occurredAt,
                                      long globalSequence) {
        return new PersistedEvent(eventId,
                                  aggregateType,
                                  aggregateId,
                                  aggregateVersion,
                                  event,
                                  metaData,
                                  correlationId.orElse(null),
                                  causationId.orElse(null),
                                  occurredAt,
                                  globalSequence);
    }

    public EventId eventId() {
        return eventId;
    }

    /**
     * Discriminator used for topic routing
     */
    public AggregateType aggregateType() {
        return aggregateType;
    }

    /**
     * The aggregate id in its persisted (String) form
     */
    public String aggregateId() {
        return aggregateId;
    }

    /**
     * The aggregate's version after this event. The first event of an aggregate has version 1
     */
    public long aggregateVersion() {
        return aggregateVersion;
    }

    public EventType eventType() {
        return event.getEventType();
    }

    /**
     * The schema revision the event payload was persisted with
     */
    public EventRevision eventRevision() {
        return event.getRevision();
    }

    /**
     * The event payload. Deserialization into the Java event type happens lazily using {@link EventJSON#deserialize()}
     */
    public EventJSON event() {
        return event;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    public Optional<CorrelationId> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    public Optional<EventId> causationId() {
        return Optional.ofNullable(causationId);
    }

    public OffsetDateTime occurredAt() {
        return occurredAt;
    }

    /**
     * Position in the store wide order of all events. Strictly increasing and gap free in commit order
     */
    public long globalSequence() {
        return globalSequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        return eventId.equals(((PersistedEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "eventId=" + eventId +
                ", aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", aggregateVersion=" + aggregateVersion +
                ", eventType=" + event.getEventType() +
                ", eventRevision=" + event.getRevision() +
                ", globalSequence=" + globalSequence +
                ", occurredAt=" + occurredAt +
                ", correlationId=" + correlationId +
                ", causationId=" + causationId +
                '}';
    }
}
