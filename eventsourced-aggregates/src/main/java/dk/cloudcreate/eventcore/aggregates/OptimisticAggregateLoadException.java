package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStoreException;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * The aggregate was loaded with an expected version that differs from the version found in the event store
 */
public class OptimisticAggregateLoadException extends EventStoreException implements FailureKindAware {
    public final Object                           aggregateId;
    public final Class<? extends Aggregate<?, ?>> aggregateImplementationType;
    public final long                             expectedVersion;
    public final long                             actualVersion;

    public OptimisticAggregateLoadException(Object aggregateId, Class<? extends Aggregate<?, ?>> aggregateImplementationType, long expectedVersion, long actualVersion) {
        super(msg("Expected version {} for '{}' with id '{}' but found version {} in the EventStore",
                  expectedVersion,
                  aggregateImplementationType.getName(),
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateImplementationType = aggregateImplementationType;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.CONCURRENCY_CONFLICT;
    }
}
