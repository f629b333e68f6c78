package dk.cloudcreate.eventcore.bus.postgresql;

public enum SubscriptionStatus {
    /**
     * Events are delivered to the subscriber
     */
    ACTIVE,
    /**
     * Delivery is paused by an operator. Events are still queued for the subscriber
     */
    PAUSED,
    /**
     * Delivery stopped because a queued delivery couldn't be processed for reasons outside the handler,
     * e.g. the event it refers to no longer exists, or because a timed out handler invocation ignored the interrupt.
     * Delivery continues after {@link SubscriptionManager#resume(dk.cloudcreate.eventcore.common.types.SubscriberId)}
     */
    FAILED
}
