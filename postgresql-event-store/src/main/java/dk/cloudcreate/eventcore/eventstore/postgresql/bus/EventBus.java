package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.PersistedEventHandler;

/**
 * Publish/subscribe of {@link PersistedEvent}'s with at-least-once delivery.<br>
 * Each subscriber receives its own copy of every event matching its {@link TopicPattern}, and events related to the same aggregate
 * are delivered to a subscriber in ascending {@link PersistedEvent#aggregateVersion()} order.
 * A slow or failing subscriber never blocks publishers or other subscribers.<br>
 * Handlers must be idempotent, since an event may be delivered more than once.
 */
public interface EventBus {
    /**
     * Publish an event. The returned {@link Result} is a success once the event is durably queued for every matching subscriber,
     * which doesn't mean that any handler has processed it.<br>
     * Publishing the same event more than once is harmless.
     *
     * @param event the event
     * @return success or a {@link FailureKind#PUBLISH_ERROR} failure
     */
    Result<Void> publish(PersistedEvent event);

    /**
     * Subscribe with {@link SubscriptionOptions#defaultOptions()}
     *
     * @see #subscribe(TopicPattern, PersistedEventHandler, SubscriberId, SubscriptionOptions)
     */
    default void subscribe(TopicPattern topicPattern, PersistedEventHandler handler, SubscriberId subscriberId) {
        subscribe(topicPattern, handler, subscriberId, SubscriptionOptions.defaultOptions());
    }

    /**
     * Register a subscriber. The registration is validated immediately.<br>
     * A subscriber that has subscribed before (e.g. in a previous run of the process) resumes after its last processed event.
     *
     * @param topicPattern the events the subscriber receives
     * @param handler      the handler called for each event
     * @param subscriberId unique id of the subscriber
     * @param options      delivery options
     * @throws EventBusException        if a subscriber with the same id is already subscribed in this process
     * @throws IllegalArgumentException if an argument is invalid
     */
    void subscribe(TopicPattern topicPattern, PersistedEventHandler handler, SubscriberId subscriberId, SubscriptionOptions options);

    /**
     * Stop delivering events to the subscriber in this process. The subscriber's checkpoint is kept
     *
     * @param subscriberId the subscriber
     * @return true if the subscriber was subscribed
     */
    boolean unsubscribe(SubscriberId subscriberId);

    boolean isSubscribed(SubscriberId subscriberId);
}
