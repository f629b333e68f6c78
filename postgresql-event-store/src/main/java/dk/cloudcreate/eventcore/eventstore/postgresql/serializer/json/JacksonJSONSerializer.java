package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.EventMetaData;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}, which also applies the registered {@link EventUpcaster}'s when reading events
 * persisted with an older {@link EventRevision}
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private static final Logger log = LoggerFactory.getLogger(JacksonJSONSerializer.class);

    private final ObjectMapper                                                 objectMapper;
    /**
     * Key: event type<br>
     * Value: the upcasters for the event type, keyed by their {@link EventUpcaster#fromRevision()}
     */
    private final ConcurrentMap<EventType, ConcurrentMap<EventRevision, EventUpcaster>> upcasters = new ConcurrentHashMap<>();

    public JacksonJSONSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Field based {@link ObjectMapper}: getters and setters aren't used, unknown properties are ignored and
     * <code>Optional</code>, <code>java.time</code> and {@link dk.cloudcreate.eventcore.common.types.StringValueType} values are supported.<br>
     * Event classes need a no-arguments constructor (it may be private)
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_SETTERS)
                         .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .enable(MapperFeature.AUTO_DETECT_CREATORS)
                         .enable(MapperFeature.AUTO_DETECT_FIELDS)
                         .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .addModule(new EventCoreTypesJacksonModule())
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Register an {@link EventUpcaster}. Only one upcaster per event type and from-revision is allowed
     *
     * @param upcaster the upcaster
     * @return this serializer instance
     * @throws IllegalArgumentException if an upcaster for the same event type and from-revision was already registered
     */
    public JacksonJSONSerializer addEventUpcaster(EventUpcaster upcaster) {
        Objects.requireNonNull(upcaster, "No upcaster provided");
        Objects.requireNonNull(upcaster.eventType(), "The upcaster didn't specify an eventType");
        Objects.requireNonNull(upcaster.fromRevision(), "The upcaster didn't specify a fromRevision");
        var upcastersForEventType = upcasters.computeIfAbsent(upcaster.eventType(), eventType -> new ConcurrentHashMap<>());
        var existing              = upcastersForEventType.putIfAbsent(upcaster.fromRevision(), upcaster);
        if (existing != null) {
            throw new IllegalArgumentException(msg("An upcaster for event type '{}' from revision {} was already registered: {}",
                                                   upcaster.eventType(),
                                                   upcaster.fromRevision(),
                                                   existing.getClass().getName()));
        }
        log.debug("Registered upcaster {} for event type '{}' from revision {}", upcaster.getClass().getName(), upcaster.eventType(), upcaster.fromRevision());
        return this;
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        Objects.requireNonNull(json, "No json provided");
        Objects.requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    @Override
    public EventJSON serializeEvent(Object event) {
        Objects.requireNonNull(event, "No event provided");
        try {
            return new EventJSON(this,
                                 event,
                                 EventRevision.of(event.getClass()),
                                 objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", event.getClass().getName()), e);
        }
    }

    @Override
    public Object deserializeEvent(String json, EventType eventType, EventRevision persistedRevision) {
        Objects.requireNonNull(json, "No json provided");
        Objects.requireNonNull(eventType, "No eventType provided");
        Objects.requireNonNull(persistedRevision, "No persistedRevision provided");
        var javaType        = eventType.toJavaClass();
        var currentRevision = EventRevision.of(javaType);
        var comparison      = persistedRevision.compareTo(currentRevision);
        if (comparison == 0) {
            return deserialize(json, javaType);
        }
        if (comparison > 0) {
            throw new JSONDeserializationException(msg("Event type '{}' was persisted with revision {}, which is newer than the current revision {}",
                                                       eventType,
                                                       persistedRevision,
                                                       currentRevision));
        }
        return upcastAndDeserialize(json, eventType, javaType, persistedRevision, currentRevision);
    }

    private Object upcastAndDeserialize(String json, EventType eventType, Class<?> javaType, EventRevision persistedRevision, EventRevision currentRevision) {
        var upcastersForEventType = upcasters.getOrDefault(eventType, new ConcurrentHashMap<>());
        try {
            var tree = objectMapper.readTree(json);
            if (!(tree instanceof ObjectNode)) {
                throw new JSONDeserializationException(msg("Can't upcast event type '{}': the JSON isn't an object", eventType));
            }
            var eventJson = (ObjectNode) tree;
            var revision  = persistedRevision;
            while (revision.compareTo(currentRevision) < 0) {
                var upcaster = upcastersForEventType.get(revision);
                if (upcaster == null) {
                    throw new JSONDeserializationException(msg("Missing upcaster for event type '{}' from revision {} (current revision is {})",
                                                               eventType,
                                                               revision,
                                                               currentRevision));
                }
                log.trace("Upcasting event type '{}' from revision {}", eventType, revision);
                eventJson = Objects.requireNonNull(upcaster.upcast(eventJson), "Upcaster returned null");
                revision = revision.next();
            }
            return objectMapper.treeToValue(eventJson, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to upcast and deserialize event type '{}' from revision {}", eventType, persistedRevision), e);
        }
    }

    @Override
    public String serializeMetaData(EventMetaData metaData) {
        Objects.requireNonNull(metaData, "No metaData provided");
        try {
            return objectMapper.writeValueAsString(metaData);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException("Failed to serialize EventMetaData to JSON", e);
        }
    }

    @Override
    public EventMetaData deserializeMetaData(String json) {
        if (json == null || json.isBlank()) {
            return EventMetaData.empty();
        }
        return deserialize(json, EventMetaData.class);
    }
}
