package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;

import java.time.OffsetDateTime;

/**
 * A queued, not yet processed, delivery of an event to a subscriber
 */
final class PendingDelivery {
    final SubscriberId   subscriberId;
    final long           globalSequence;
    final String         aggregateId;
    final int            deliveryAttempts;
    final OffsetDateTime nextDeliveryAt;

    PendingDelivery(SubscriberId subscriberId, long globalSequence, String aggregateId, int deliveryAttempts, OffsetDateTime nextDeliveryAt) {
        this.subscriberId = subscriberId;
        this.globalSequence = globalSequence;
        this.aggregateId = aggregateId;
        this.deliveryAttempts = deliveryAttempts;
        this.nextDeliveryAt = nextDeliveryAt;
    }

    @Override
    public String toString() {
        return "PendingDelivery{" +
                "subscriberId=" + subscriberId +
                ", globalSequence=" + globalSequence +
                ", aggregateId='" + aggregateId + '\'' +
                ", deliveryAttempts=" + deliveryAttempts +
                ", nextDeliveryAt=" + nextDeliveryAt +
                '}';
    }
}
