package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import dk.cloudcreate.eventcore.eventstore.postgresql.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
