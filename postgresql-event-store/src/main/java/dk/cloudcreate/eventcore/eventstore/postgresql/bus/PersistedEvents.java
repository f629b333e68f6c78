package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.common.transaction.UnitOfWork;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.*;

/**
 * Encapsulates all events Persisted within a {@link UnitOfWork}
 */
public final class PersistedEvents {
    public final CommitStage          commitStage;
    public final UnitOfWork           unitOfWork;
    public final List<PersistedEvent> events;

    public PersistedEvents(CommitStage commitStage, UnitOfWork unitOfWork, List<PersistedEvent> events) {
        this.commitStage = Objects.requireNonNull(commitStage, "No commitStage provided");
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "No unitOfWork provided");
        this.events = List.copyOf(Objects.requireNonNull(events, "No events provided"));
    }

    @Override
    public String toString() {
        return "PersistedEvents{" +
                "commitStage=" + commitStage + ", " +
                "events=" + events.size() +
                '}';
    }
}
