package dk.cloudcreate.eventcore.eventstore.postgresql.transaction;

import dk.cloudcreate.eventcore.common.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} variant where the {@link EventStore} is manually
 * managing the {@link UnitOfWork} and the underlying database Transaction
 */
public class EventStoreManagedUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<EventStoreUnitOfWork> implements EventStoreUnitOfWorkFactory {
    private final List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks;

    public EventStoreManagedUnitOfWorkFactory(Jdbi jdbi) {
        this(jdbi, null);
    }

    /**
     * @param jdbi         the jdbi instance
     * @param queryTimeout optional statement timeout. A statement that times out fails the {@link UnitOfWork}, which is then rolled back
     */
    public EventStoreManagedUnitOfWorkFactory(Jdbi jdbi, Duration queryTimeout) {
        super(jdbi, queryTimeout);
        lifecycleCallbacks = new CopyOnWriteArrayList<>();
    }

    @Override
    protected EventStoreUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<EventStoreUnitOfWork> unitOfWorkFactory) {
        return new EventStoreManagedUnitOfWork(unitOfWorkFactory, lifecycleCallbacks);
    }

    @Override
    public EventStoreUnitOfWorkFactory registerPersistedEventsCommitLifeCycleCallback(PersistedEventsCommitLifecycleCallback callback) {
        lifecycleCallbacks.add(Objects.requireNonNull(callback, "No callback provided"));
        return this;
    }

    private static class EventStoreManagedUnitOfWork extends GenericHandleAwareUnitOfWork implements EventStoreUnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(EventStoreManagedUnitOfWork.class);

        /**
         * The list is maintained by the {@link EventStoreManagedUnitOfWorkFactory} and provided in the constructor
         */
        private final List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks;
        private final List<PersistedEvent>                         eventsPersisted;

        public EventStoreManagedUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory, List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks) {
            super(unitOfWorkFactory);
            this.lifecycleCallbacks = Objects.requireNonNull(lifecycleCallbacks, "No lifecycleCallbacks provided");
            this.eventsPersisted = new ArrayList<>();
        }

        @Override
        public void registerEventsPersisted(List<PersistedEvent> eventsPersistedInThisUnitOfWork) {
            Objects.requireNonNull(eventsPersistedInThisUnitOfWork, "No eventsPersistedInThisUnitOfWork provided");
            this.eventsPersisted.addAll(eventsPersistedInThisUnitOfWork);
        }

        @Override
        public List<PersistedEvent> eventsPersisted() {
            return Collections.unmodifiableList(eventsPersisted);
        }

        @Override
        protected void beforeCommitting() {
            if (eventsPersisted.isEmpty()) {
                return;
            }
            for (var callback : lifecycleCallbacks) {
                try {
                    log.trace("BeforeCommit PersistedEvents for {} with {} persisted events", callback.getClass().getName(), eventsPersisted.size());
                    callback.beforeCommit(this, eventsPersisted());
                } catch (RuntimeException e) {
                    throw new UnitOfWorkException(msg("{} failed during beforeCommit PersistedEvents", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        protected void afterCommitting() {
            if (eventsPersisted.isEmpty()) {
                return;
            }
            for (var callback : lifecycleCallbacks) {
                try {
                    log.trace("AfterCommit PersistedEvents for {} with {} persisted events", callback.getClass().getName(), eventsPersisted.size());
                    callback.afterCommit(this, eventsPersisted());
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit PersistedEvents", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        protected void afterRollback(Exception cause) {
            if (eventsPersisted.isEmpty()) {
                return;
            }
            for (var callback : lifecycleCallbacks) {
                try {
                    log.trace("AfterRollback PersistedEvents for {} with {} persisted events", callback.getClass().getName(), eventsPersisted.size());
                    callback.afterRollback(this, eventsPersisted());
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterRollback PersistedEvents", callback.getClass().getName()), e);
                }
            }
        }
    }
}
