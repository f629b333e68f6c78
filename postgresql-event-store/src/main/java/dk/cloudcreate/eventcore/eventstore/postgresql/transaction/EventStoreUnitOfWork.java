package dk.cloudcreate.eventcore.eventstore.postgresql.transaction;

import dk.cloudcreate.eventcore.common.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.EventStoreLocalEventBus;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.List;

/**
 * Variant of the {@link UnitOfWork} that allows the {@link EventStore}
 * to register any {@link PersistedEvent}'s persisted during a {@link UnitOfWork},
 * such that these events can be published on the {@link EventStoreLocalEventBus}
 */
public interface EventStoreUnitOfWork extends HandleAwareUnitOfWork {
    void registerEventsPersisted(List<PersistedEvent> eventsPersistedInThisUnitOfWork);

    /**
     * @return all events appended within this {@link UnitOfWork} so far
     */
    List<PersistedEvent> eventsPersisted();
}
