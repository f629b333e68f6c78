package dk.cloudcreate.eventcore.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * {@link UnitOfWork} backed by a single Jdbi {@link Handle}. Every statement that should be part of the
 * unit of work's transaction (event appends, outbox rows, checkpoint updates) must be executed through {@link #handle()}
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * @return the handle whose transaction this unit of work controls
     * @throws UnitOfWorkException if the unit of work has already been committed or rolled back
     */
    Handle handle();
}
