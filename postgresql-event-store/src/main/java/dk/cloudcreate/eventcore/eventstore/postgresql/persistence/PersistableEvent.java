package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.*;

/**
 * An event that hasn't yet been appended to the event store (as opposed to a {@link PersistedEvent}).<br>
 * Wraps the business event and carries the correlation id, causation id and metadata that should be stored together with it.<br>
 * The {@link #eventId()} is assigned when the {@link PersistableEvent} is created.<br>
 * Two {@link PersistableEvent}'s are equal if they have the same {@link #eventId()}
 */
public final class PersistableEvent {
    private final EventId       eventId;
    private final Object        event;
    private final CorrelationId correlationId;
    private final EventId       causationId;
    private final EventMetaData metaData;

    private PersistableEvent(EventId eventId, Object event, CorrelationId correlationId, EventId causationId, EventMetaData metaData) {
        this.eventId = Objects.requireNonNull(eventId, "No eventId provided");
        this.event = Objects.requireNonNull(event, "No event provided");
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.metaData = Objects.requireNonNull(metaData, "No metaData provided");
        if (event instanceof PersistableEvent || event instanceof PersistedEvent) {
            throw new IllegalArgumentException("The event must be the business event and not a " + event.getClass().getSimpleName());
        }
    }

    public static PersistableEvent of(Object event) {
        return new PersistableEvent(EventId.random(), event, null, null, EventMetaData.empty());
    }

    /**
     * @param eventOrPersistableEvent either a business event or a {@link PersistableEvent}
     * @return the {@link PersistableEvent} or a new {@link PersistableEvent} wrapping the business event
     */
    public static PersistableEvent from(Object eventOrPersistableEvent) {
        Objects.requireNonNull(eventOrPersistableEvent, "No event provided");
        if (eventOrPersistableEvent instanceof PersistableEvent) {
            return (PersistableEvent) eventOrPersistableEvent;
        }
        return of(eventOrPersistableEvent);
    }

    public PersistableEvent withEventId(EventId eventId) {
        return new PersistableEvent(eventId, event, correlationId, causationId, metaData);
    }

    public PersistableEvent withCorrelationId(CorrelationId correlationId) {
        return new PersistableEvent(eventId, event, correlationId, causationId, metaData);
    }

    /**
     * @param causationId id of the event (or command) that caused this event
     */
    public PersistableEvent withCausationId(EventId causationId) {
        return new PersistableEvent(eventId, event, correlationId, causationId, metaData);
    }

    public PersistableEvent withMetaData(EventMetaData metaData) {
        return new PersistableEvent(eventId, event, correlationId, causationId, metaData);
    }

    public EventId eventId() {
        return eventId;
    }

    public Object event() {
        return event;
    }

    public Optional<CorrelationId> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    public Optional<EventId> causationId() {
        return Optional.ofNullable(causationId);
    }

    public EventMetaData metaData() {
        return metaData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistableEvent)) return false;
        return eventId.equals(((PersistableEvent) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "PersistableEvent{" +
                "eventId=" + eventId +
                ", eventType=" + event.getClass().getName() +
                ", correlationId=" + correlationId +
                ", causationId=" + causationId +
                '}';
    }
}
