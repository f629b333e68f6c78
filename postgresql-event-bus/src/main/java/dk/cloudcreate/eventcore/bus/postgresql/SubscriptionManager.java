package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.PersistedEventHandler;

import java.util.*;

/**
 * Operational control over the subscribers of a {@link PostgresqlEventBus}.<br>
 * Operations return a {@link FailureKind#NOT_FOUND} failure for subscribers that have never subscribed.
 * Changes to a subscriber that's subscribed in this process are performed by that subscriber's worker thread, so
 * a subscriber's checkpoint only ever has one writer.
 */
public interface SubscriptionManager {
    /**
     * @return the persisted checkpoint of the subscriber or {@link Optional#empty()} if it has never subscribed
     */
    Optional<SubscriptionCheckpoint> checkpoint(SubscriberId subscriberId);

    /**
     * Stop delivering events to the subscriber. Events are still queued and the checkpoint is kept
     */
    Result<Void> pause(SubscriberId subscriberId);

    /**
     * Continue delivering events to a {@link SubscriptionStatus#PAUSED} or {@link SubscriptionStatus#FAILED} subscriber
     */
    Result<Void> resume(SubscriberId subscriberId);

    /**
     * Re-process events starting at (and including) <code>fromSequence</code>:<br>
     * deliveries at or after <code>fromSequence</code> are deleted, a checkpoint beyond <code>fromSequence - 1</code> is moved back to it,
     * {@link PersistedEventHandler#onResetFrom(long)} is called (if the subscriber is subscribed in this process) and the matching events
     * are queued again from the event store.<br>
     * Events below <code>fromSequence</code> that were queued but not yet handled are still delivered, ahead of the replayed events.
     *
     * @return success or a {@link FailureKind#HANDLER_ERROR} failure if {@link PersistedEventHandler#onResetFrom(long)} failed.
     * The events are queued again in both cases
     */
    Result<Void> replay(SubscriberId subscriberId, long fromSequence);

    /**
     * @return the subscriber's dead lettered events in global sequence order
     */
    List<DeadLetteredEvent> deadLetters(SubscriberId subscriberId);

    /**
     * Queue a dead lettered event for a new round of delivery attempts
     *
     * @return success or a {@link FailureKind#NOT_FOUND} failure if the subscriber has no such dead letter
     */
    Result<Void> redeliverDeadLetter(SubscriberId subscriberId, long globalSequence);

    /**
     * @return delivery statistics for a subscriber subscribed in this process
     */
    Optional<SubscriptionMetrics> metrics(SubscriberId subscriberId);
}
