package dk.cloudcreate.eventcore.eventstore.postgresql.types;

import java.util.Objects;

/**
 * The revision (schema version) of an event type - first revision has value 1
 *
 * @see Revision
 */
public final class EventRevision implements Comparable<EventRevision> {
    public static final EventRevision FIRST = new EventRevision(1);

    private final int value;

    private EventRevision(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("An EventRevision must be 1 or larger");
        }
        this.value = value;
    }

    public static EventRevision of(int value) {
        return new EventRevision(value);
    }

    /**
     * Resolve the revision of an event type from its {@link Revision} annotation
     *
     * @param eventType the event type
     * @return the annotated revision or {@link #FIRST} if the type isn't annotated
     */
    public static EventRevision of(Class<?> eventType) {
        Objects.requireNonNull(eventType, "No eventType provided");
        var revision = eventType.getAnnotation(Revision.class);
        return revision != null ? of(revision.value()) : FIRST;
    }

    public int intValue() {
        return value;
    }

    public EventRevision next() {
        return new EventRevision(value + 1);
    }

    @Override
    public int compareTo(EventRevision other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRevision)) return false;
        return value == ((EventRevision) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
