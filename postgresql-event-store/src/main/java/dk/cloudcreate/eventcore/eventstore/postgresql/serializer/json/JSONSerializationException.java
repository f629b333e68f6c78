package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import dk.cloudcreate.eventcore.eventstore.postgresql.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
