package dk.cloudcreate.eventcore.eventstore.postgresql.types;

import dk.cloudcreate.eventcore.common.types.StringValueType;
import dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.JSONDeserializationException;

import java.util.Objects;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * The Fully Qualified Class Name of an event's Java type
 */
public final class EventType extends StringValueType<EventType> {
    public EventType(CharSequence value) {
        super(value);
    }

    public static EventType of(CharSequence value) {
        return new EventType(value);
    }

    public static EventType of(Class<?> eventType) {
        return new EventType(Objects.requireNonNull(eventType, "No eventType provided").getName());
    }

    /**
     * @return the simple class name (the part after the last '.' or '$')
     */
    public String simpleName() {
        var name = value();
        var startIndex = Math.max(name.lastIndexOf('.'), name.lastIndexOf('$')) + 1;
        return name.substring(startIndex);
    }

    /**
     * Load the Java class
     *
     * @throws JSONDeserializationException if the class can't be loaded
     */
    public Class<?> toJavaClass() {
        try {
            var classLoader = Thread.currentThread().getContextClassLoader();
            return Class.forName(value(), true, classLoader != null ? classLoader : EventType.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Couldn't load event type '{}'", value()), e);
        }
    }
}
