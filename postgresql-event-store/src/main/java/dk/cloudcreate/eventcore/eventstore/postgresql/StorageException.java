package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.common.result.*;

/**
 * I/O or transaction failure in the underlying database
 */
public class StorageException extends EventStoreException implements FailureKindAware {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.STORAGE_ERROR;
    }
}
