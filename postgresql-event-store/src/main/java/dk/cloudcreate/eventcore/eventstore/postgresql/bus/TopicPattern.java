package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.EventType;

import java.util.Objects;
import java.util.regex.Pattern;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Selects the events a subscriber receives, by {@link AggregateType} and/or {@link EventType}.<br>
 * Both parts are glob patterns where <code>*</code> matches any sequence of characters.
 * The event type part is matched against both the Fully Qualified Class Name and the simple class name of the event.<br>
 * The String form is <code>aggregateTypePattern:eventTypePattern</code>, e.g. <code>Orders:*</code> or <code>*:OrderPlaced</code>
 */
public final class TopicPattern {
    public static final String ANY = "*";

    private static final Pattern VALID_PART = Pattern.compile("[A-Za-z0-9_.$*\\-]+");

    private final String  aggregateTypePattern;
    private final String  eventTypePattern;
    private final Pattern aggregateTypeRegex;
    private final Pattern eventTypeRegex;

    private TopicPattern(String aggregateTypePattern, String eventTypePattern) {
        this.aggregateTypePattern = requireValidPart(aggregateTypePattern, "aggregateTypePattern");
        this.eventTypePattern = requireValidPart(eventTypePattern, "eventTypePattern");
        this.aggregateTypeRegex = toRegex(aggregateTypePattern);
        this.eventTypeRegex = toRegex(eventTypePattern);
    }

    /**
     * @throws IllegalArgumentException if a pattern is blank or contains characters other than letters, digits, '_', '.', '$', '-' and '*'
     */
    public static TopicPattern of(String aggregateTypePattern, String eventTypePattern) {
        return new TopicPattern(aggregateTypePattern, eventTypePattern);
    }

    /**
     * Parse the <code>aggregateTypePattern:eventTypePattern</code> form. A pattern without ':' only matches on aggregate type
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static TopicPattern parse(String topicPattern) {
        Objects.requireNonNull(topicPattern, "No topicPattern provided");
        var separatorIndex = topicPattern.indexOf(':');
        if (separatorIndex < 0) {
            return new TopicPattern(topicPattern, ANY);
        }
        if (topicPattern.indexOf(':', separatorIndex + 1) >= 0) {
            throw new IllegalArgumentException(msg("Invalid topic pattern '{}': only one ':' is allowed", topicPattern));
        }
        return new TopicPattern(topicPattern.substring(0, separatorIndex), topicPattern.substring(separatorIndex + 1));
    }

    public static TopicPattern all() {
        return new TopicPattern(ANY, ANY);
    }

    public static TopicPattern forAggregateType(AggregateType aggregateType) {
        return new TopicPattern(Objects.requireNonNull(aggregateType, "No aggregateType provided").value(), ANY);
    }

    public static TopicPattern forEventType(Class<?> eventType) {
        return new TopicPattern(ANY, EventType.of(eventType).value());
    }

    private static String requireValidPart(String part, String partName) {
        if (part == null || !VALID_PART.matcher(part).matches()) {
            throw new IllegalArgumentException(msg("Invalid {} '{}'", partName, part));
        }
        return part;
    }

    private static Pattern toRegex(String glob) {
        var regex    = new StringBuilder();
        var segments = glob.split("\\*", -1);
        for (var i = 0; i < segments.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!segments[i].isEmpty()) {
                regex.append(Pattern.quote(segments[i]));
            }
        }
        return Pattern.compile(regex.toString());
    }

    public boolean matches(AggregateType aggregateType, EventType eventType) {
        Objects.requireNonNull(aggregateType, "No aggregateType provided");
        Objects.requireNonNull(eventType, "No eventType provided");
        return aggregateTypeRegex.matcher(aggregateType.value()).matches() &&
                (eventTypeRegex.matcher(eventType.value()).matches() || eventTypeRegex.matcher(eventType.simpleName()).matches());
    }

    public boolean matches(PersistedEvent event) {
        Objects.requireNonNull(event, "No event provided");
        return matches(event.aggregateType(), event.eventType());
    }

    public String aggregateTypePattern() {
        return aggregateTypePattern;
    }

    public String eventTypePattern() {
        return eventTypePattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopicPattern)) return false;
        var that = (TopicPattern) o;
        return aggregateTypePattern.equals(that.aggregateTypePattern) && eventTypePattern.equals(that.eventTypePattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateTypePattern, eventTypePattern);
    }

    /**
     * @return the <code>aggregateTypePattern:eventTypePattern</code> form, which {@link #parse(String)} accepts
     */
    @Override
    public String toString() {
        return aggregateTypePattern + ":" + eventTypePattern;
    }
}
