package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * An event a subscriber couldn't process within its redelivery policy. It's set aside for manual inspection
 * and can be redelivered using {@link SubscriptionManager#redeliverDeadLetter(SubscriberId, long)}
 */
public final class DeadLetteredEvent {
    public final SubscriberId     subscriberId;
    public final long             globalSequence;
    public final String           aggregateId;
    public final int              deliveryAttempts;
    public final Optional<String> lastError;
    public final OffsetDateTime   deadLetteredAt;

    public DeadLetteredEvent(SubscriberId subscriberId,
                             long globalSequence,
                             String aggregateId,
                             int deliveryAttempts,
                             Optional<String> lastError,
                             OffsetDateTime deadLetteredAt) {
        this.subscriberId = Objects.requireNonNull(subscriberId, "No subscriberId provided");
        this.globalSequence = globalSequence;
        this.aggregateId = Objects.requireNonNull(aggregateId, "No aggregateId provided");
        this.deliveryAttempts = deliveryAttempts;
        this.lastError = Objects.requireNonNull(lastError, "No lastError option provided");
        this.deadLetteredAt = Objects.requireNonNull(deadLetteredAt, "No deadLetteredAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeadLetteredEvent)) return false;
        var that = (DeadLetteredEvent) o;
        return globalSequence == that.globalSequence && subscriberId.equals(that.subscriberId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriberId, globalSequence);
    }

    @Override
    public String toString() {
        return "DeadLetteredEvent{" +
                "subscriberId=" + subscriberId +
                ", globalSequence=" + globalSequence +
                ", aggregateId='" + aggregateId + '\'' +
                ", deliveryAttempts=" + deliveryAttempts +
                ", deadLetteredAt=" + deadLetteredAt +
                ", lastError=" + lastError +
                '}';
    }
}
