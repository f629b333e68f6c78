package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * {@link SubscriptionManager} for the subscribers of a {@link PostgresqlEventBus}.<br>
 * Subscribers that are subscribed in this process are changed on their {@link SubscriberWorker} thread,
 * other subscribers are changed directly in the subscriptions table.
 */
public class PostgresqlSubscriptionManager implements SubscriptionManager {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlSubscriptionManager.class);

    private final PostgresqlEventBus eventBus;
    private final EventBusStorage    storage;

    PostgresqlSubscriptionManager(PostgresqlEventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "No eventBus provided");
        this.storage = eventBus.storage();
    }

    @Override
    public Optional<SubscriptionCheckpoint> checkpoint(SubscriberId subscriberId) {
        return storage.subscription(subscriberId);
    }

    @Override
    public Result<Void> pause(SubscriberId subscriberId) {
        return changeStatus(subscriberId, SubscriptionStatus.PAUSED);
    }

    @Override
    public Result<Void> resume(SubscriberId subscriberId) {
        return changeStatus(subscriberId, SubscriptionStatus.ACTIVE);
    }

    private Result<Void> changeStatus(SubscriberId subscriberId, SubscriptionStatus status) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        try {
            var worker = eventBus.localWorker(subscriberId);
            var updated = worker.isPresent() ?
                          worker.get().runOnWorkerThread(() -> storage.updateStatus(subscriberId, status)) :
                          storage.updateStatus(subscriberId, status);
            if (!updated) {
                return Result.failure(Failure.from(new UnknownSubscriberException(subscriberId)));
            }
            log.info("[{}] Subscription is now {}", subscriberId, status);
            if (status == SubscriptionStatus.ACTIVE) {
                worker.ifPresent(SubscriberWorker::wakeUp);
            }
            return Result.ok();
        } catch (RuntimeException e) {
            log.debug(msg("[{}] Failed to change the subscription status to {}", subscriberId, status), e);
            return Result.failure(Failure.from(e));
        }
    }

    @Override
    public Result<Void> replay(SubscriberId subscriberId, long fromSequence) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        if (fromSequence < 1) {
            throw new IllegalArgumentException(msg("fromSequence must be 1 or larger, but was {}", fromSequence));
        }
        try {
            var subscription = storage.subscription(subscriberId);
            if (subscription.isEmpty()) {
                return Result.failure(Failure.from(new UnknownSubscriberException(subscriberId)));
            }
            log.info("[{}] Replaying from global sequence {}", subscriberId, fromSequence);
            var worker = eventBus.localWorker(subscriberId);
            if (worker.isPresent()) {
                return worker.get().replay(fromSequence);
            }
            storage.resetForReplay(subscriberId, fromSequence);
            eventBus.historyQueuer().queue(subscriberId,
                                           subscription.get().topicPattern,
                                           fromSequence,
                                           eventBus.eventStore().lastGlobalSequence());
            log.info("[{}] Subscriber isn't subscribed in this process, so its handler will not be notified about the reset", subscriberId);
            return Result.ok();
        } catch (RuntimeException e) {
            log.debug(msg("[{}] Failed to replay from global sequence {}", subscriberId, fromSequence), e);
            return Result.failure(Failure.from(e));
        }
    }

    @Override
    public List<DeadLetteredEvent> deadLetters(SubscriberId subscriberId) {
        return storage.deadLetters(subscriberId);
    }

    @Override
    public Result<Void> redeliverDeadLetter(SubscriberId subscriberId, long globalSequence) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        try {
            var worker = eventBus.localWorker(subscriberId);
            var requeued = worker.isPresent() ?
                           worker.get().runOnWorkerThread(() -> storage.redeliverDeadLetter(subscriberId, globalSequence)) :
                           storage.redeliverDeadLetter(subscriberId, globalSequence);
            if (!requeued) {
                return Result.failure(Failure.from(new UnknownSubscriberException(msg("Subscriber '{}' has no dead letter with global sequence {}",
                                                                                      subscriberId,
                                                                                      globalSequence))));
            }
            log.info("[{}] Dead letter with global sequence {} queued for redelivery", subscriberId, globalSequence);
            worker.ifPresent(SubscriberWorker::wakeUp);
            return Result.ok();
        } catch (RuntimeException e) {
            log.debug(msg("[{}] Failed to redeliver dead letter with global sequence {}", subscriberId, globalSequence), e);
            return Result.failure(Failure.from(e));
        }
    }

    @Override
    public Optional<SubscriptionMetrics> metrics(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        return eventBus.localWorker(subscriberId).map(SubscriberWorker::metrics);
    }
}
