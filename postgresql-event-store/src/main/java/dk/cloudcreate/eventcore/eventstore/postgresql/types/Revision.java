package dk.cloudcreate.eventcore.eventstore.postgresql.types;

import java.lang.annotation.*;

/**
 * The current revision of an event class. Events persisted with an older revision
 * are upgraded on read by the registered {@link dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json.EventUpcaster}'s
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Revision {
    int value();
}
