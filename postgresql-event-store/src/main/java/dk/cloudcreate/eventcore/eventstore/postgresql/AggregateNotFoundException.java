package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.common.result.*;

import java.util.Objects;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException implements FailureKindAware {
    public final Object   aggregateId;
    public final Class<?> aggregateRootImplementationType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateRootImplementationType) {
        super(msg("Couldn't find a '{}' aggregate root with Id '{}'",
                  Objects.requireNonNull(aggregateRootImplementationType, "You must supply an aggregateRootImplementationType").getName(),
                  aggregateId));
        this.aggregateId = Objects.requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateRootImplementationType = aggregateRootImplementationType;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.NOT_FOUND;
    }
}
