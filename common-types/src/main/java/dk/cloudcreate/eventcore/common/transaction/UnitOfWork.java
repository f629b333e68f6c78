package dk.cloudcreate.eventcore.common.transaction;

import dk.cloudcreate.eventcore.common.result.*;

/**
 * Transactional boundary. All resources registered with the {@link UnitOfWork} have their state delta written,
 * and their staged events appended, inside one underlying transaction - or not at all.
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and the underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#Committed}.<br>
     * Any failure during commit rolls back the entire transaction, in which case the returned {@link Result}
     * describes the failure ({@link FailureKind#CONCURRENCY_CONFLICT} or {@link FailureKind#STORAGE_ERROR})
     *
     * @return the result of the commit
     * @throws UnitOfWorkException if the {@link UnitOfWork} isn't active
     */
    Result<Void> commit();

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}.<br>
     * Rolling back an already completed {@link UnitOfWork} is ignored
     *
     * @param cause the cause of the rollback
     */
    void rollback(Exception cause);

    /**
     * Get the status of the {@link UnitOfWork}
     */
    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    void markAsRollbackOnly(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     */
    default void rollback() {
        // Use any exception saved using #markAsRollbackOnly(Exception)
        rollback(getCauseOfRollback());
    }

    /**
     * Register a resource (e.g. an Aggregate) that should have its {@link UnitOfWorkLifecycleCallback} called during the {@link UnitOfWork}'s commit or rollback.<br>
     * Registering the same resource instance twice with the same callback is ignored.
     *
     * @param resource                     the resource that should be tracked
     * @param associatedUnitOfWorkCallback the callback instance for the given resource
     * @param <T>                          the type of resource
     * @return the <code>resource</code>
     */
    <T> T registerLifecycleCallbackForResource(T resource, UnitOfWorkLifecycleCallback<T> associatedUnitOfWorkCallback);
}
