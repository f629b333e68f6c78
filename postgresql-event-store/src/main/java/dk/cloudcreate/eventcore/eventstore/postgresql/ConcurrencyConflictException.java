package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.AggregateType;

import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Another writer appended to the aggregate's event stream first.<br>
 * The caller is expected to reload the aggregate and retry the command
 */
public class ConcurrencyConflictException extends EventStoreException implements FailureKindAware {
    public final AggregateType aggregateType;
    public final Object        aggregateId;
    public final long          expectedVersion;
    private final Long         currentVersion;

    public ConcurrencyConflictException(AggregateType aggregateType, Object aggregateId, long expectedVersion, long currentVersion) {
        super(msg("[{}] Failed to append to aggregate '{}': expected version {}, but current version is {}",
                  aggregateType,
                  aggregateId,
                  expectedVersion,
                  currentVersion));
        this.aggregateType = Objects.requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = Objects.requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    /**
     * Used when the current version couldn't be read, because the competing writer was detected by the database
     * (e.g. a unique key violation) and the transaction can no longer be used
     */
    public ConcurrencyConflictException(AggregateType aggregateType, Object aggregateId, long expectedVersion, Throwable cause) {
        super(msg("[{}] Failed to append to aggregate '{}': expected version {}, but the stream was modified by a concurrent writer",
                  aggregateType,
                  aggregateId,
                  expectedVersion),
              cause);
        this.aggregateType = Objects.requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = Objects.requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = expectedVersion;
        this.currentVersion = null;
    }

    public Optional<Long> currentVersion() {
        return Optional.ofNullable(currentVersion);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.CONCURRENCY_CONFLICT;
    }
}
