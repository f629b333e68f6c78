package dk.cloudcreate.eventcore.aggregates;

import java.lang.annotation.*;

/**
 * Methods annotated with this Annotation will automatically be called when an event is being applied or rehydrated on to an {@link AggregateRoot} instance.<br>
 * The method must take exactly one parameter: the event type it handles
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface EventHandler {
}
