package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.TopicPattern;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.EventStoreUnitOfWorkFactory;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.slf4j.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.*;

/**
 * Access to the subscriptions table and the deliveries table of the {@link PostgresqlEventBus}.<br>
 * Every method joins the current {@link dk.cloudcreate.eventcore.common.transaction.UnitOfWork} or runs in its own
 */
public class EventBusStorage {
    private static final Logger log = LoggerFactory.getLogger(EventBusStorage.class);

    private final EventStoreUnitOfWorkFactory        unitOfWorkFactory;
    private final String                             subscriptionsTableName;
    private final String                             deliveriesTableName;
    private final RowMapper<SubscriptionCheckpoint>  checkpointMapper;
    private final RowMapper<PendingDelivery>         pendingDeliveryMapper;
    private final RowMapper<DeadLetteredEvent>       deadLetterMapper;

    public EventBusStorage(EventStoreUnitOfWorkFactory unitOfWorkFactory, PostgresqlEventBusConfiguration configuration) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        Objects.requireNonNull(configuration, "No configuration provided");
        this.subscriptionsTableName = configuration.subscriptionsTableName;
        this.deliveriesTableName = configuration.deliveriesTableName;
        this.checkpointMapper = (rs, ctx) -> new SubscriptionCheckpoint(SubscriberId.of(rs.getString("subscriber_id")),
                                                                        TopicPattern.of(rs.getString("aggregate_type_pattern"), rs.getString("event_type_pattern")),
                                                                        rs.getLong("last_dispatched_sequence"),
                                                                        SubscriptionStatus.valueOf(rs.getString("status")),
                                                                        rs.getObject("updated_at", OffsetDateTime.class));
        this.pendingDeliveryMapper = (rs, ctx) -> new PendingDelivery(SubscriberId.of(rs.getString("subscriber_id")),
                                                                      rs.getLong("global_sequence"),
                                                                      rs.getString("aggregate_id"),
                                                                      rs.getInt("delivery_attempts"),
                                                                      rs.getObject("next_delivery_at", OffsetDateTime.class));
        this.deadLetterMapper = (rs, ctx) -> new DeadLetteredEvent(SubscriberId.of(rs.getString("subscriber_id")),
                                                                   rs.getLong("global_sequence"),
                                                                   rs.getString("aggregate_id"),
                                                                   rs.getInt("delivery_attempts"),
                                                                   Optional.ofNullable(rs.getString("last_error")),
                                                                   rs.getObject("dead_lettered_at", OffsetDateTime.class));
    }

    public void initializeStorage() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.execute(bind("CREATE TABLE IF NOT EXISTS {:subscriptionsTable} (\n" +
                                        "    subscriber_id VARCHAR(255) PRIMARY KEY,\n" +
                                        "    aggregate_type_pattern VARCHAR(255) NOT NULL,\n" +
                                        "    event_type_pattern VARCHAR(1024) NOT NULL,\n" +
                                        "    last_dispatched_sequence BIGINT NOT NULL,\n" +
                                        "    status VARCHAR(20) NOT NULL,\n" +
                                        "    updated_at TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                        ")",
                                arg("subscriptionsTable", subscriptionsTableName)));
            handle.execute(bind("CREATE TABLE IF NOT EXISTS {:deliveriesTable} (\n" +
                                        "    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                        "    subscriber_id VARCHAR(255) NOT NULL,\n" +
                                        "    global_sequence BIGINT NOT NULL,\n" +
                                        "    aggregate_id VARCHAR(255) NOT NULL,\n" +
                                        "    delivery_attempts INTEGER NOT NULL,\n" +
                                        "    next_delivery_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "    last_error TEXT,\n" +
                                        "    is_dead_letter BOOLEAN NOT NULL,\n" +
                                        "    dead_lettered_at TIMESTAMP WITH TIME ZONE,\n" +
                                        "    created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                        "    CONSTRAINT {:deliveriesTable}_subscriber_sequence_key UNIQUE (subscriber_id, global_sequence)\n" +
                                        ")",
                                arg("deliveriesTable", deliveriesTableName)));
            handle.execute(bind("CREATE INDEX IF NOT EXISTS {:deliveriesTable}_next_delivery_idx ON {:deliveriesTable} (subscriber_id, is_dead_letter, global_sequence)",
                                arg("deliveriesTable", deliveriesTableName)));
        });
        log.debug("Ensured event bus tables '{}' and '{}' exist", subscriptionsTableName, deliveriesTableName);
    }

    // ----------------------------------------------- Subscriptions -----------------------------------------------

    /**
     * Create the subscription row if it's missing, otherwise update its topic pattern and keep its checkpoint and status
     *
     * @return true if the subscription was created
     */
    public boolean registerSubscription(SubscriberId subscriberId, TopicPattern topicPattern, long initialCheckpoint) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        Objects.requireNonNull(topicPattern, "No topicPattern provided");
        var now = now();
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            var updated = handle.createUpdate(bind("UPDATE {:subscriptionsTable} SET aggregate_type_pattern = :aggregateTypePattern, event_type_pattern = :eventTypePattern " +
                                                           "WHERE subscriber_id = :subscriberId",
                                                   arg("subscriptionsTable", subscriptionsTableName)))
                                .bind("aggregateTypePattern", topicPattern.aggregateTypePattern())
                                .bind("eventTypePattern", topicPattern.eventTypePattern())
                                .bind("subscriberId", subscriberId.value())
                                .execute();
            if (updated > 0) {
                return false;
            }
            handle.createUpdate(bind("INSERT INTO {:subscriptionsTable} (subscriber_id, aggregate_type_pattern, event_type_pattern, last_dispatched_sequence, status, updated_at) " +
                                             "VALUES (:subscriberId, :aggregateTypePattern, :eventTypePattern, :checkpoint, :status, :now)",
                                     arg("subscriptionsTable", subscriptionsTableName)))
                  .bind("subscriberId", subscriberId.value())
                  .bind("aggregateTypePattern", topicPattern.aggregateTypePattern())
                  .bind("eventTypePattern", topicPattern.eventTypePattern())
                  .bind("checkpoint", initialCheckpoint)
                  .bind("status", SubscriptionStatus.ACTIVE.name())
                  .bind("now", now)
                  .execute();
            return true;
        });
    }

    public Optional<SubscriptionCheckpoint> subscription(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:subscriptionsTable} WHERE subscriber_id = :subscriberId",
                                                                                          arg("subscriptionsTable", subscriptionsTableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .map(checkpointMapper)
                                                                        .findOne());
    }

    /**
     * @return all subscriptions, including those of subscribers that aren't subscribed in any process right now
     */
    public List<SubscriptionCheckpoint> subscriptions() {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:subscriptionsTable} ORDER BY subscriber_id",
                                                                                          arg("subscriptionsTable", subscriptionsTableName)))
                                                                        .map(checkpointMapper)
                                                                        .list());
    }

    /**
     * @return true if the subscription exists
     */
    public boolean updateStatus(SubscriberId subscriberId, SubscriptionStatus status) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        Objects.requireNonNull(status, "No status provided");
        var now = now();
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createUpdate(bind("UPDATE {:subscriptionsTable} SET status = :status, updated_at = :now WHERE subscriber_id = :subscriberId",
                                                                                           arg("subscriptionsTable", subscriptionsTableName)))
                                                                        .bind("status", status.name())
                                                                        .bind("now", now)
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .execute() > 0);
    }

    // ----------------------------------------------- Deliveries -----------------------------------------------

    /**
     * Queue the event for the subscriber, unless it's already queued (or dead lettered) for the subscriber
     * or is at or below the subscriber's checkpoint
     *
     * @return true if a delivery was queued
     */
    public boolean enqueue(SubscriberId subscriberId, PersistedEvent event) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        Objects.requireNonNull(event, "No event provided");
        var now = now();
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createUpdate(bind("INSERT INTO {:deliveriesTable} (subscriber_id, global_sequence, aggregate_id, delivery_attempts, next_delivery_at, is_dead_letter, created_at) " +
                                                                                                   "SELECT s.subscriber_id, CAST(:globalSequence AS BIGINT), CAST(:aggregateId AS VARCHAR(255)), 0, CAST(:now AS TIMESTAMP WITH TIME ZONE), FALSE, CAST(:now AS TIMESTAMP WITH TIME ZONE) " +
                                                                                                   "FROM {:subscriptionsTable} s " +
                                                                                                   "WHERE s.subscriber_id = :subscriberId AND s.last_dispatched_sequence < :globalSequence " +
                                                                                                   "AND NOT EXISTS (SELECT 1 FROM {:deliveriesTable} d WHERE d.subscriber_id = :subscriberId AND d.global_sequence = :globalSequence)",
                                                                                           arg("deliveriesTable", deliveriesTableName),
                                                                                           arg("subscriptionsTable", subscriptionsTableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .bind("globalSequence", event.globalSequence())
                                                                        .bind("aggregateId", event.aggregateId())
                                                                        .bind("now", now)
                                                                        .execute() > 0);
    }

    /**
     * @return the pending (not dead lettered) delivery with the lowest global sequence, whether or not it's due
     */
    Optional<PendingDelivery> nextDelivery(SubscriberId subscriberId) {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:deliveriesTable} WHERE subscriber_id = :subscriberId AND is_dead_letter = FALSE " +
                                                                                                  "ORDER BY global_sequence ASC LIMIT 1",
                                                                                          arg("deliveriesTable", deliveriesTableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .map(pendingDeliveryMapper)
                                                                        .findOne());
    }

    /**
     * Remove a successfully processed delivery and move the subscriber's checkpoint forward to its global sequence
     */
    void completeDelivery(SubscriberId subscriberId, long globalSequence) {
        var now = now();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.createUpdate(bind("DELETE FROM {:deliveriesTable} WHERE subscriber_id = :subscriberId AND global_sequence = :globalSequence",
                                     arg("deliveriesTable", deliveriesTableName)))
                  .bind("subscriberId", subscriberId.value())
                  .bind("globalSequence", globalSequence)
                  .execute();
            advanceCheckpoint(handle, subscriberId, globalSequence, now);
        });
    }

    void scheduleRedelivery(SubscriberId subscriberId, long globalSequence, int deliveryAttempts, OffsetDateTime nextDeliveryAt, String error) {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                  .createUpdate(bind("UPDATE {:deliveriesTable} SET delivery_attempts = :attempts, next_delivery_at = :nextDeliveryAt, last_error = :lastError " +
                                                                                             "WHERE subscriber_id = :subscriberId AND global_sequence = :globalSequence",
                                                                                     arg("deliveriesTable", deliveriesTableName)))
                                                                  .bind("attempts", deliveryAttempts)
                                                                  .bind("nextDeliveryAt", nextDeliveryAt)
                                                                  .bind("lastError", error)
                                                                  .bind("subscriberId", subscriberId.value())
                                                                  .bind("globalSequence", globalSequence)
                                                                  .execute());
    }

    /**
     * Flag the delivery as a dead letter and move the subscriber's checkpoint past it, so delivery continues with the next event
     */
    void markAsDeadLetter(SubscriberId subscriberId, long globalSequence, int deliveryAttempts, String error) {
        var now = now();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.createUpdate(bind("UPDATE {:deliveriesTable} SET is_dead_letter = TRUE, dead_lettered_at = :now, delivery_attempts = :attempts, last_error = :lastError " +
                                             "WHERE subscriber_id = :subscriberId AND global_sequence = :globalSequence",
                                     arg("deliveriesTable", deliveriesTableName)))
                  .bind("now", now)
                  .bind("attempts", deliveryAttempts)
                  .bind("lastError", error)
                  .bind("subscriberId", subscriberId.value())
                  .bind("globalSequence", globalSequence)
                  .execute();
            advanceCheckpoint(handle, subscriberId, globalSequence, now);
        });
    }

    private void advanceCheckpoint(Handle handle, SubscriberId subscriberId, long globalSequence, OffsetDateTime now) {
        handle.createUpdate(bind("UPDATE {:subscriptionsTable} SET last_dispatched_sequence = :globalSequence, updated_at = :now " +
                                         "WHERE subscriber_id = :subscriberId AND last_dispatched_sequence < :globalSequence",
                                 arg("subscriptionsTable", subscriptionsTableName)))
              .bind("globalSequence", globalSequence)
              .bind("now", now)
              .bind("subscriberId", subscriberId.value())
              .execute();
    }

    /**
     * Delete the subscriber's deliveries (pending and dead lettered) at or after <code>fromSequence</code>
     * and move its checkpoint back to <code>fromSequence - 1</code>.<br>
     * Deliveries below <code>fromSequence</code> are kept and a checkpoint that is already below <code>fromSequence - 1</code>
     * is left as is, so events that were queued but not yet handled are still delivered
     */
    void resetForReplay(SubscriberId subscriberId, long fromSequence) {
        var now = now();
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            var deleted = handle.createUpdate(bind("DELETE FROM {:deliveriesTable} WHERE subscriber_id = :subscriberId AND global_sequence >= :fromSequence",
                                                   arg("deliveriesTable", deliveriesTableName)))
                                .bind("subscriberId", subscriberId.value())
                                .bind("fromSequence", fromSequence)
                                .execute();
            var movedBack = handle.createUpdate(bind("UPDATE {:subscriptionsTable} SET last_dispatched_sequence = :checkpoint, updated_at = :now " +
                                                             "WHERE subscriber_id = :subscriberId AND last_dispatched_sequence > :checkpoint",
                                                     arg("subscriptionsTable", subscriptionsTableName)))
                                  .bind("checkpoint", fromSequence - 1)
                                  .bind("now", now)
                                  .bind("subscriberId", subscriberId.value())
                                  .execute();
            log.debug("[{}] Deleted {} deliveries at or after global sequence {}. Checkpoint {}",
                      subscriberId,
                      deleted,
                      fromSequence,
                      movedBack > 0 ? "moved back to " + (fromSequence - 1) : "kept");
        });
    }

    public List<DeadLetteredEvent> deadLetters(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT * FROM {:deliveriesTable} WHERE subscriber_id = :subscriberId AND is_dead_letter = TRUE " +
                                                                                                  "ORDER BY global_sequence ASC",
                                                                                          arg("deliveriesTable", deliveriesTableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .map(deadLetterMapper)
                                                                        .list());
    }

    /**
     * @return true if the dead letter existed and was queued for delivery again
     */
    boolean redeliverDeadLetter(SubscriberId subscriberId, long globalSequence) {
        var now = now();
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createUpdate(bind("UPDATE {:deliveriesTable} SET is_dead_letter = FALSE, dead_lettered_at = NULL, delivery_attempts = 0, next_delivery_at = :now " +
                                                                                                   "WHERE subscriber_id = :subscriberId AND global_sequence = :globalSequence AND is_dead_letter = TRUE",
                                                                                           arg("deliveriesTable", deliveriesTableName)))
                                                                        .bind("now", now)
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .bind("globalSequence", globalSequence)
                                                                        .execute() > 0);
    }

    /**
     * @return number of queued deliveries for the subscriber that aren't dead lettered
     */
    public long pendingDeliveries(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                        .createQuery(bind("SELECT COUNT(*) FROM {:deliveriesTable} WHERE subscriber_id = :subscriberId AND is_dead_letter = FALSE",
                                                                                          arg("deliveriesTable", deliveriesTableName)))
                                                                        .bind("subscriberId", subscriberId.value())
                                                                        .mapTo(Long.class)
                                                                        .one());
    }

    static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
