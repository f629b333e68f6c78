package dk.cloudcreate.eventcore.common.transaction;

import java.util.List;

/**
 * Callback that can be registered with a {@link UnitOfWork} in relation to
 * one of more Resources (can e.g. be an Aggregate). When the {@link UnitOfWork} is committed
 * or rolled back the {@link UnitOfWorkLifecycleCallback} will be called with all the Resources that have been associated with it through
 * the {@link UnitOfWork}
 */
public interface UnitOfWorkLifecycleCallback<RESOURCE_TYPE> {
    /**
     * Called inside the transaction, before it's committed. This is where a resource's state delta is written.<br>
     * Throwing an exception rolls back the entire {@link UnitOfWork}
     */
    void beforeCommit(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources);

    /**
     * Called after the transaction was committed. Exceptions are logged and otherwise ignored
     */
    void afterCommit(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources);

    void beforeRollback(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources, Exception causeOfTheRollback);

    void afterRollback(UnitOfWork unitOfWork, List<RESOURCE_TYPE> associatedResources, Exception causeOfTheRollback);
}
