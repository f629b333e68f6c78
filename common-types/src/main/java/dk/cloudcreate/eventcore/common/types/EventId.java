package dk.cloudcreate.eventcore.common.types;

import java.util.*;

/**
 * Unique id of an event
 */
public final class EventId extends StringValueType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static Optional<EventId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(EventId::new);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }
}
