package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.TopicPattern;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * The persisted delivery position and status of a subscriber
 */
public final class SubscriptionCheckpoint {
    public final SubscriberId       subscriberId;
    public final TopicPattern       topicPattern;
    /**
     * Global sequence of the last event the subscriber processed (or dead lettered). 0 if it hasn't processed any event
     */
    public final long               lastDispatchedSequence;
    public final SubscriptionStatus status;
    public final OffsetDateTime     updatedAt;

    public SubscriptionCheckpoint(SubscriberId subscriberId,
                                  TopicPattern topicPattern,
                                  long lastDispatchedSequence,
                                  SubscriptionStatus status,
                                  OffsetDateTime updatedAt) {
        this.subscriberId = Objects.requireNonNull(subscriberId, "No subscriberId provided");
        this.topicPattern = Objects.requireNonNull(topicPattern, "No topicPattern provided");
        this.lastDispatchedSequence = lastDispatchedSequence;
        this.status = Objects.requireNonNull(status, "No status provided");
        this.updatedAt = Objects.requireNonNull(updatedAt, "No updatedAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionCheckpoint)) return false;
        var that = (SubscriptionCheckpoint) o;
        return lastDispatchedSequence == that.lastDispatchedSequence &&
                subscriberId.equals(that.subscriberId) &&
                topicPattern.equals(that.topicPattern) &&
                status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriberId, topicPattern, lastDispatchedSequence, status);
    }

    @Override
    public String toString() {
        return "SubscriptionCheckpoint{" +
                "subscriberId=" + subscriberId +
                ", topicPattern=" + topicPattern +
                ", lastDispatchedSequence=" + lastDispatchedSequence +
                ", status=" + status +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
