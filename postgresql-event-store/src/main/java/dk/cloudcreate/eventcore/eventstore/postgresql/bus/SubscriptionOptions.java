package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.common.delivery.RedeliveryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per subscriber delivery options
 */
public final class SubscriptionOptions {
    /**
     * How a failing handler invocation is retried before the event is dead lettered
     */
    public final RedeliveryPolicy redeliveryPolicy;
    /**
     * Maximum duration of a single handler invocation. An invocation that times out counts as a failure
     */
    public final Duration         handlerTimeout;
    /**
     * Only used the first time the subscriber subscribes
     */
    public final StartPosition    startPosition;

    public SubscriptionOptions(RedeliveryPolicy redeliveryPolicy, Duration handlerTimeout, StartPosition startPosition) {
        this.redeliveryPolicy = Objects.requireNonNull(redeliveryPolicy, "No redeliveryPolicy provided");
        this.handlerTimeout = Objects.requireNonNull(handlerTimeout, "No handlerTimeout provided");
        this.startPosition = Objects.requireNonNull(startPosition, "No startPosition provided");
        if (handlerTimeout.isNegative() || handlerTimeout.isZero()) {
            throw new IllegalArgumentException("handlerTimeout must be positive");
        }
    }

    /**
     * 5 redeliveries with exponential backoff (100 ms, 200 ms, 400 ms, ... capped at 10 seconds),
     * a 30 seconds handler timeout and {@link StartPosition#BEGINNING}
     */
    public static SubscriptionOptions defaultOptions() {
        return new SubscriptionOptions(RedeliveryPolicy.exponentialBackoff(Duration.ofMillis(100),
                                                                           Duration.ofMillis(200),
                                                                           2.0d,
                                                                           Duration.ofSeconds(10),
                                                                           5),
                                       Duration.ofSeconds(30),
                                       StartPosition.BEGINNING);
    }

    public SubscriptionOptions withRedeliveryPolicy(RedeliveryPolicy redeliveryPolicy) {
        return new SubscriptionOptions(redeliveryPolicy, handlerTimeout, startPosition);
    }

    public SubscriptionOptions withHandlerTimeout(Duration handlerTimeout) {
        return new SubscriptionOptions(redeliveryPolicy, handlerTimeout, startPosition);
    }

    public SubscriptionOptions withStartPosition(StartPosition startPosition) {
        return new SubscriptionOptions(redeliveryPolicy, handlerTimeout, startPosition);
    }

    @Override
    public String toString() {
        return "SubscriptionOptions{" +
                "redeliveryPolicy=" + redeliveryPolicy +
                ", handlerTimeout=" + handlerTimeout +
                ", startPosition=" + startPosition +
                '}';
    }
}
