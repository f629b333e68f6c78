package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.EventMetaData;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;

/**
 * JSON serializer and deserializer
 */
public interface JSONSerializer {
    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);

    /**
     * Serialize an event to {@link EventJSON}. The {@link EventRevision} is resolved from the event type's {@link Revision} annotation
     *
     * @param event the event that will be serialized to JSON
     * @return the corresponding {@link EventJSON} object
     * @throws JSONSerializationException in case the <code>event</code> couldn't be serialized to JSON
     */
    EventJSON serializeEvent(Object event);

    /**
     * Deserialize a persisted event payload. If the payload was persisted with an older revision than the
     * event type's current revision, then it's upcasted before being deserialized
     *
     * @param json              the json payload
     * @param eventType         the event type
     * @param persistedRevision the revision the payload was persisted with
     * @return the deserialized event
     * @throws JSONDeserializationException in case the json couldn't be upcasted or deserialized
     */
    Object deserializeEvent(String json, EventType eventType, EventRevision persistedRevision);

    /**
     * @throws JSONSerializationException in case the <code>metaData</code> couldn't be serialized to JSON
     */
    String serializeMetaData(EventMetaData metaData);

    /**
     * @throws JSONDeserializationException in case the json couldn't be deserialized
     */
    EventMetaData deserializeMetaData(String json);
}
