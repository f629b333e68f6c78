package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.common.result.*;

/**
 * An event couldn't be durably queued on the {@link EventBus}
 */
public class PublishException extends EventBusException implements FailureKindAware {
    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PUBLISH_ERROR;
    }
}
