package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

import dk.cloudcreate.eventcore.common.types.EventId;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * The outbox record written together with each appended event
 */
public final class OutboxEntry {
    public final long                     globalSequence;
    public final EventId                  eventId;
    public final OutboxEntryStatus        status;
    public final int                      dispatchAttempts;
    public final OffsetDateTime           createdAt;
    public final Optional<OffsetDateTime> lastAttemptAt;
    public final Optional<String>         lastError;

    public OutboxEntry(long globalSequence,
                       EventId eventId,
                       OutboxEntryStatus status,
                       int dispatchAttempts,
                       OffsetDateTime createdAt,
                       Optional<OffsetDateTime> lastAttemptAt,
                       Optional<String> lastError) {
        this.globalSequence = globalSequence;
        this.eventId = Objects.requireNonNull(eventId, "No eventId provided");
        this.status = Objects.requireNonNull(status, "No status provided");
        this.dispatchAttempts = dispatchAttempts;
        this.createdAt = Objects.requireNonNull(createdAt, "No createdAt provided");
        this.lastAttemptAt = Objects.requireNonNull(lastAttemptAt, "No lastAttemptAt provided");
        this.lastError = Objects.requireNonNull(lastError, "No lastError provided");
    }

    @Override
    public String toString() {
        return "OutboxEntry{" +
                "globalSequence=" + globalSequence +
                ", eventId=" + eventId +
                ", status=" + status +
                ", dispatchAttempts=" + dispatchAttempts +
                ", lastAttemptAt=" + lastAttemptAt +
                '}';
    }
}
