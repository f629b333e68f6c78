package dk.cloudcreate.eventcore.eventstore.postgresql.subscription;

import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when a {@link PatternMatchingPersistedEventHandler}
 * receives a {@link PersistedEvent} whose deserialized event type matches the type of the first parameter of the method.<br>
 * The method may declare a second parameter of type {@link PersistedEvent}
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface SubscriptionEventHandler {
}
