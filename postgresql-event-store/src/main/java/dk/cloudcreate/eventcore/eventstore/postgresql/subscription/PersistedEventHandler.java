package dk.cloudcreate.eventcore.eventstore.postgresql.subscription;

import dk.cloudcreate.eventcore.eventstore.postgresql.bus.EventBus;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

/**
 * {@link PersistedEvent} handler registered with an {@link EventBus}
 *
 * @see PatternMatchingPersistedEventHandler
 */
public interface PersistedEventHandler {
    /**
     * Called before events are redelivered because the subscription is replayed from <code>globalSequence</code>,
     * e.g. so a read model can be cleared before it's rebuilt
     *
     * @param globalSequence the first global sequence that will be redelivered
     */
    default void onResetFrom(long globalSequence) {
    }

    /**
     * Called for each event delivered to the subscriber. Throwing an exception means the delivery failed
     * and the event will be redelivered according to the subscriber's redelivery policy
     *
     * @param event the event
     */
    void handle(PersistedEvent event);
}
