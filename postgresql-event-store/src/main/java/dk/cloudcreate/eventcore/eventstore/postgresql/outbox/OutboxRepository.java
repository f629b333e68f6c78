package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

import dk.cloudcreate.eventcore.common.types.EventId;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.EventStoreUnitOfWorkFactory;
import org.jdbi.v3.core.mapper.RowMapper;
import org.slf4j.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.*;
import static dk.cloudcreate.eventcore.common.persistence.SqlIdentifiers.requireValidSqlIdentifier;

/**
 * Access to the outbox table and the relay cursor table.<br>
 * Every method joins the current {@link dk.cloudcreate.eventcore.common.transaction.UnitOfWork} or runs in its own
 */
public class OutboxRepository {
    private static final Logger log = LoggerFactory.getLogger(OutboxRepository.class);

    private final EventStoreUnitOfWorkFactory unitOfWorkFactory;
    private final String                      outboxTableName;
    private final String                      cursorTableName;
    private final RowMapper<OutboxEntry>      outboxEntryMapper;

    public OutboxRepository(EventStoreUnitOfWorkFactory unitOfWorkFactory, String outboxTableName, String cursorTableName) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.outboxTableName = requireValidSqlIdentifier(outboxTableName);
        this.cursorTableName = requireValidSqlIdentifier(cursorTableName);
        this.outboxEntryMapper = (rs, ctx) -> new OutboxEntry(rs.getLong("global_sequence"),
                                                              EventId.of(rs.getString("event_id")),
                                                              OutboxEntryStatus.valueOf(rs.getString("status")),
                                                              rs.getInt("dispatch_attempts"),
                                                              rs.getObject("created_at", OffsetDateTime.class),
                                                              Optional.ofNullable(rs.getObject("last_attempt_at", OffsetDateTime.class)),
                                                              Optional.ofNullable(rs.getString("last_error")));
    }

    /**
     * Create the relay cursor table if it's missing. The outbox table itself is created by the event store
     */
    public void initializeStorage() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute(bind("CREATE TABLE IF NOT EXISTS {:cursorTable} (\n" +
                                                                                                 "    relay_name VARCHAR(255) PRIMARY KEY,\n" +
                                                                                                 "    last_relayed_sequence BIGINT NOT NULL,\n" +
                                                                                                 "    updated_at TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                                                                                 ")",
                                                                                         arg("cursorTable", cursorTableName))));
        log.debug("Ensured relay cursor table '{}' exists", cursorTableName);
    }

    /**
     * @return the global sequence of the last event the relay has relayed (0 if it hasn't relayed anything)
     */
    public long lastRelayedSequence(String relayName) {
        Objects.requireNonNull(relayName, "No relayName provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT last_relayed_sequence FROM {:cursorTable} WHERE relay_name = :relayName",
                                                                                          arg("cursorTable", cursorTableName)))
                                                                        .bind("relayName", relayName)
                                                                        .mapTo(Long.class)
                                                                        .findOne()
                                                                        .orElse(0L));
    }

    /**
     * Mark the entries in the range as {@link OutboxEntryStatus#DISPATCHED} and move the relay's cursor to <code>toSequence</code>,
     * both in the same transaction
     */
    public void markDispatchedAndAdvanceCursor(String relayName, long fromSequence, long toSequence, int dispatchAttempts) {
        Objects.requireNonNull(relayName, "No relayName provided");
        var now = now();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            var marked = handle.createUpdate(bind("UPDATE {:outboxTable} SET status = :status, dispatch_attempts = :attempts, last_attempt_at = :now " +
                                                          "WHERE global_sequence >= :fromSequence AND global_sequence <= :toSequence",
                                                  arg("outboxTable", outboxTableName)))
                               .bind("status", OutboxEntryStatus.DISPATCHED.name())
                               .bind("attempts", dispatchAttempts)
                               .bind("now", now)
                               .bind("fromSequence", fromSequence)
                               .bind("toSequence", toSequence)
                               .execute();
            var cursorUpdated = handle.createUpdate(bind("UPDATE {:cursorTable} SET last_relayed_sequence = :toSequence, updated_at = :now WHERE relay_name = :relayName",
                                                         arg("cursorTable", cursorTableName)))
                                      .bind("toSequence", toSequence)
                                      .bind("now", now)
                                      .bind("relayName", relayName)
                                      .execute();
            if (cursorUpdated == 0) {
                handle.createUpdate(bind("INSERT INTO {:cursorTable} (relay_name, last_relayed_sequence, updated_at) VALUES (:relayName, :toSequence, :now)",
                                         arg("cursorTable", cursorTableName)))
                      .bind("relayName", relayName)
                      .bind("toSequence", toSequence)
                      .bind("now", now)
                      .execute();
            }
            log.trace("[{}] Marked {} outbox entries {}-{} as DISPATCHED", relayName, marked, fromSequence, toSequence);
        });
    }

    /**
     * Mark the entries in the range as {@link OutboxEntryStatus#FAILED}
     */
    public void markFailed(long fromSequence, long toSequence, int dispatchAttempts, String error) {
        var now = now();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                  .createUpdate(bind("UPDATE {:outboxTable} SET status = :status, dispatch_attempts = :attempts, last_attempt_at = :now, last_error = :lastError " +
                                                                                             "WHERE global_sequence >= :fromSequence AND global_sequence <= :toSequence",
                                                                                     arg("outboxTable", outboxTableName)))
                                                                  .bind("status", OutboxEntryStatus.FAILED.name())
                                                                  .bind("attempts", dispatchAttempts)
                                                                  .bind("now", now)
                                                                  .bind("lastError", error)
                                                                  .bind("fromSequence", fromSequence)
                                                                  .bind("toSequence", toSequence)
                                                                  .execute());
    }

    public Optional<OutboxEntry> entry(long globalSequence) {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:outboxTable} WHERE global_sequence = :globalSequence",
                                                                                          arg("outboxTable", outboxTableName)))
                                                                        .bind("globalSequence", globalSequence)
                                                                        .map(outboxEntryMapper)
                                                                        .findOne());
    }

    /**
     * @return up to <code>limit</code> entries with the given status in global sequence order
     */
    public List<OutboxEntry> entriesWithStatus(OutboxEntryStatus status, int limit) {
        Objects.requireNonNull(status, "No status provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:outboxTable} WHERE status = :status ORDER BY global_sequence ASC LIMIT :limit",
                                                                                          arg("outboxTable", outboxTableName)))
                                                                        .bind("status", status.name())
                                                                        .bind("limit", limit)
                                                                        .map(outboxEntryMapper)
                                                                        .list());
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
