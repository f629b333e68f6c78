package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.eventstore.postgresql.EventStoreException;

public class EventBusException extends EventStoreException {
    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
