package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * In-process delivery statistics for a subscriber. The counters start at zero each time the subscriber is subscribed
 */
public final class SubscriptionMetrics {
    private final SubscriberId subscriberId;
    private final LongAdder    invocations             = new LongAdder();
    private final LongAdder    successes               = new LongAdder();
    private final LongAdder    failures                = new LongAdder();
    private final LongAdder    deadLetters             = new LongAdder();
    private final AtomicLong   totalProcessingNanos    = new AtomicLong();
    private final AtomicLong   minProcessingNanos      = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong   maxProcessingNanos      = new AtomicLong();
    private volatile Instant   lastInvokedAt;

    public SubscriptionMetrics(SubscriberId subscriberId) {
        this.subscriberId = Objects.requireNonNull(subscriberId, "No subscriberId provided");
    }

    void recordInvocation(Instant invokedAt, long processingNanos, boolean succeeded) {
        invocations.increment();
        if (succeeded) {
            successes.increment();
        } else {
            failures.increment();
        }
        lastInvokedAt = invokedAt;
        totalProcessingNanos.addAndGet(processingNanos);
        minProcessingNanos.updateAndGet(current -> Math.min(current, processingNanos));
        maxProcessingNanos.updateAndGet(current -> Math.max(current, processingNanos));
    }

    void recordDeadLetter() {
        deadLetters.increment();
    }

    public SubscriberId subscriberId() {
        return subscriberId;
    }

    /**
     * @return number of handler invocations, including failed invocations and timeouts
     */
    public long invocations() {
        return invocations.sum();
    }

    public long successes() {
        return successes.sum();
    }

    public long failures() {
        return failures.sum();
    }

    public long deadLetters() {
        return deadLetters.sum();
    }

    public Optional<Instant> lastInvokedAt() {
        return Optional.ofNullable(lastInvokedAt);
    }

    public Duration minProcessingTime() {
        var min = minProcessingNanos.get();
        return min == Long.MAX_VALUE ? Duration.ZERO : Duration.ofNanos(min);
    }

    public Duration maxProcessingTime() {
        return Duration.ofNanos(maxProcessingNanos.get());
    }

    public Duration averageProcessingTime() {
        var count = invocations.sum();
        if (count == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalProcessingNanos.get() / count);
    }

    @Override
    public String toString() {
        return "SubscriptionMetrics{" +
                "subscriberId=" + subscriberId +
                ", invocations=" + invocations() +
                ", successes=" + successes() +
                ", failures=" + failures() +
                ", deadLetters=" + deadLetters() +
                ", lastInvokedAt=" + lastInvokedAt +
                ", minProcessingTime=" + minProcessingTime() +
                ", averageProcessingTime=" + averageProcessingTime() +
                ", maxProcessingTime=" + maxProcessingTime() +
                '}';
    }
}
