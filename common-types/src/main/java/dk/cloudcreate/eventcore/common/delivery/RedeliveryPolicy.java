package dk.cloudcreate.eventcore.common.delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes how often, and with which delays, a failed delivery is retried before giving up.<br>
 * The first retry waits {@link #initialRedeliveryDelay}; retry <code>n</code> (n &gt;= 1) waits
 * <code>followupRedeliveryDelay * followupRedeliveryDelayMultiplier^(n-1)</code>, capped at {@link #maximumFollowupRedeliveryThreshold}.
 * A delivery is given up once it has been attempted <code>maximumNumberOfRedeliveries + 1</code> times.
 */
public class RedeliveryPolicy {
    public final Duration initialRedeliveryDelay;
    public final Duration followupRedeliveryDelay;
    public final double   followupRedeliveryDelayMultiplier;
    public final Duration maximumFollowupRedeliveryThreshold;
    public final int      maximumNumberOfRedeliveries;

    public RedeliveryPolicy(Duration initialRedeliveryDelay,
                            Duration followupRedeliveryDelay,
                            double followupRedeliveryDelayMultiplier,
                            Duration maximumFollowupRedeliveryDelayThreshold,
                            int maximumNumberOfRedeliveries) {
        this.initialRedeliveryDelay = Objects.requireNonNull(initialRedeliveryDelay, "You must specify an initialRedeliveryDelay");
        this.followupRedeliveryDelay = Objects.requireNonNull(followupRedeliveryDelay, "You must specify an followupRedeliveryDelay");
        this.maximumFollowupRedeliveryThreshold = Objects.requireNonNull(maximumFollowupRedeliveryDelayThreshold, "You must specify an maximumFollowupRedeliveryDelayThreshold");
        if (followupRedeliveryDelayMultiplier < 1.0d) {
            throw new IllegalArgumentException("followupRedeliveryDelayMultiplier must be 1.0 or larger");
        }
        if (maximumNumberOfRedeliveries < 0) {
            throw new IllegalArgumentException("maximumNumberOfRedeliveries must be 0 or larger");
        }
        this.followupRedeliveryDelayMultiplier = followupRedeliveryDelayMultiplier;
        this.maximumNumberOfRedeliveries = maximumNumberOfRedeliveries;
    }

    /**
     * @param currentNumberOfRedeliveryAttempts the number of redeliveries already performed (0 before the first retry)
     * @return the delay before the next redelivery
     */
    public Duration calculateNextRedeliveryDelay(int currentNumberOfRedeliveryAttempts) {
        if (currentNumberOfRedeliveryAttempts < 0) {
            throw new IllegalArgumentException("currentNumberOfRedeliveryAttempts must be 0 or larger");
        }
        if (currentNumberOfRedeliveryAttempts == 0) {
            return min(initialRedeliveryDelay, maximumFollowupRedeliveryThreshold);
        }
        var factor = Math.pow(followupRedeliveryDelayMultiplier, currentNumberOfRedeliveryAttempts - 1);
        var millis = followupRedeliveryDelay.toMillis() * factor;
        if (millis >= maximumFollowupRedeliveryThreshold.toMillis()) {
            return maximumFollowupRedeliveryThreshold;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * @param totalDeliveryAttempts the number of times delivery has been attempted, including the first attempt
     * @return true if no further redeliveries are allowed
     */
    public boolean isExhausted(int totalDeliveryAttempts) {
        return totalDeliveryAttempts >= maximumNumberOfRedeliveries + 1;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static RedeliveryPolicy fixedBackoff(Duration redeliveryDelay,
                                                int maximumNumberOfRedeliveries) {
        return new RedeliveryPolicy(redeliveryDelay,
                                    redeliveryDelay,
                                    1.0d,
                                    redeliveryDelay,
                                    maximumNumberOfRedeliveries);
    }

    public static RedeliveryPolicy exponentialBackoff(Duration initialRedeliveryDelay,
                                                      Duration followupRedeliveryDelay,
                                                      double followupRedeliveryDelayMultiplier,
                                                      Duration maximumFollowupRedeliveryDelayThreshold,
                                                      int maximumNumberOfRedeliveries) {
        return new RedeliveryPolicy(initialRedeliveryDelay,
                                    followupRedeliveryDelay,
                                    followupRedeliveryDelayMultiplier,
                                    maximumFollowupRedeliveryDelayThreshold,
                                    maximumNumberOfRedeliveries);
    }

    @Override
    public String toString() {
        return "RedeliveryPolicy{" +
                "initialRedeliveryDelay=" + initialRedeliveryDelay +
                ", followupRedeliveryDelay=" + followupRedeliveryDelay +
                ", followupRedeliveryDelayMultiplier=" + followupRedeliveryDelayMultiplier +
                ", maximumFollowupRedeliveryThreshold=" + maximumFollowupRedeliveryThreshold +
                ", maximumNumberOfRedeliveries=" + maximumNumberOfRedeliveries +
                '}';
    }
}
