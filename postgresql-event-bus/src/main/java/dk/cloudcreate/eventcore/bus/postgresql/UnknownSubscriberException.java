package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.EventBusException;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

public class UnknownSubscriberException extends EventBusException implements FailureKindAware {
    public UnknownSubscriberException(SubscriberId subscriberId) {
        super(msg("No subscription found for subscriber '{}'", subscriberId));
    }

    public UnknownSubscriberException(String message) {
        super(message);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.NOT_FOUND;
    }
}
