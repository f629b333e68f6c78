package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;

import java.util.Objects;

/**
 * The serialized form of an event together with its {@link EventType} and {@link EventRevision}.<br>
 * Deserialization happens lazily, the first time {@link #deserialize()} is called, and the result is cached
 */
public final class EventJSON {
    private final    JSONSerializer jsonSerializer;
    private final    EventType      eventType;
    private final    EventRevision  revision;
    private final    String         json;
    private volatile Object         jsonDeserialized;

    public EventJSON(JSONSerializer jsonSerializer, EventType eventType, EventRevision revision, String json) {
        this.jsonSerializer = Objects.requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = Objects.requireNonNull(eventType, "No eventType provided");
        this.revision = Objects.requireNonNull(revision, "No revision provided");
        this.json = Objects.requireNonNull(json, "No json provided");
    }

    /**
     * Used when serializing, where the Java event instance is already known
     */
    public EventJSON(JSONSerializer jsonSerializer, Object event, EventRevision revision, String json) {
        this(jsonSerializer, EventType.of(Objects.requireNonNull(event, "No event provided").getClass()), revision, json);
        this.jsonDeserialized = event;
    }

    public EventType getEventType() {
        return eventType;
    }

    public EventRevision getRevision() {
        return revision;
    }

    public String getJson() {
        return json;
    }

    /**
     * Deserialize (and upcast if needed) the JSON payload into the {@link #getEventType()}
     *
     * @param <T> the event type
     * @return the deserialized event
     * @throws JSONDeserializationException in case the payload couldn't be deserialized
     */
    @SuppressWarnings("unchecked")
    public <T> T deserialize() {
        var result = jsonDeserialized;
        if (result == null) {
            result = jsonSerializer.deserializeEvent(json, eventType, revision);
            jsonDeserialized = result;
        }
        return (T) result;
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType=" + eventType +
                ", revision=" + revision +
                ", json='" + json + '\'' +
                '}';
    }
}
