package dk.cloudcreate.eventcore.eventstore.postgresql.transaction;

import dk.cloudcreate.eventcore.common.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.List;

/**
 * Callback that can be registered with the {@link EventStoreUnitOfWorkFactory}.<br>
 * This life cycle will be called whenever any {@link UnitOfWork} is committed or rolled back with any persisted {@link PersistedEvent}'s
 *
 * @see UnitOfWorkLifecycleCallback
 */
public interface PersistedEventsCommitLifecycleCallback {
    /**
     * Before the {@link UnitOfWork} is committed.<br>
     * This method is called AFTER {@link UnitOfWorkLifecycleCallback#beforeCommit(UnitOfWork, List)}. Throwing an exception rolls back the {@link UnitOfWork}
     *
     * @param unitOfWork      the unit of work
     * @param persistedEvents ALL the {@link PersistedEvent}'s that were associated with the {@link UnitOfWork}
     */
    void beforeCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents);

    /**
     * After the {@link UnitOfWork} was committed.<br>
     * This method is called AFTER {@link UnitOfWorkLifecycleCallback#afterCommit(UnitOfWork, List)}
     *
     * @param unitOfWork      the unit of work
     * @param persistedEvents ALL the {@link PersistedEvent}'s that were associated with the {@link UnitOfWork}
     */
    void afterCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents);

    /**
     * After the {@link UnitOfWork} was rolled back. The <code>persistedEvents</code> were never made durable
     */
    void afterRollback(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents);
}
