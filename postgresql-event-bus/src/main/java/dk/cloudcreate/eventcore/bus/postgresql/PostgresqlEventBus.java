package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.Lifecycle;
import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.outbox.OutboxRelay;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.PersistedEventHandler;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Durable {@link EventBus} backed by the same database as the {@link EventStore}.<br>
 * <br>
 * Subscriptions are stored in a table, so every publisher knows the fan-out, including subscribers that are only subscribed in other processes
 * or that aren't running right now. {@link #publish(PersistedEvent)} queues one delivery row per matching subscription; queuing is
 * idempotent per subscriber and global sequence and skips events at or below the subscriber's checkpoint.<br>
 * <br>
 * Every subscriber subscribed in this process gets its own {@link SubscriberWorker}, which delivers the subscriber's queued events one at a time
 * in global sequence order. A slow or failing subscriber therefore only delays itself.<br>
 * <br>
 * Events are normally published by an {@link OutboxRelay}:
 * <pre>{@code
 * var eventBus = new PostgresqlEventBus(eventStore, PostgresqlEventBusConfiguration.defaultConfiguration());
 * eventBus.subscribe(TopicPattern.forAggregateType(ORDERS), orderProjection, SubscriberId.of("OrderProjection"));
 * eventBus.start();
 * var relay = new OutboxRelay(eventStore, eventBus, OutboxRelayConfiguration.defaultConfiguration());
 * relay.start();
 * }</pre>
 */
public class PostgresqlEventBus implements EventBus, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventBus.class);

    private final EventStore                                     eventStore;
    private final PostgresqlEventBusConfiguration                configuration;
    private final EventBusStorage                                storage;
    private final EventHistoryQueuer                             historyQueuer;
    private final ConcurrentMap<SubscriberId, SubscriberWorker>  workers = new ConcurrentHashMap<>();
    private final PostgresqlSubscriptionManager                  subscriptionManager;

    private volatile boolean started;

    public PostgresqlEventBus(EventStore eventStore, PostgresqlEventBusConfiguration configuration) {
        this.eventStore = Objects.requireNonNull(eventStore, "No eventStore provided");
        this.configuration = Objects.requireNonNull(configuration, "No configuration provided");
        this.storage = new EventBusStorage(eventStore.getUnitOfWorkFactory(), configuration);
        this.historyQueuer = new EventHistoryQueuer(eventStore, storage, configuration.replayBatchSize);
        this.subscriptionManager = new PostgresqlSubscriptionManager(this);
        storage.initializeStorage();
    }

    @Override
    public void start() {
        if (!started) {
            log.info("Starting PostgresqlEventBus with {} local subscriber(s) using {}", workers.size(), configuration);
            started = true;
            workers.values().forEach(SubscriberWorker::start);
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("Stopping PostgresqlEventBus");
            started = false;
            workers.values().forEach(SubscriberWorker::stop);
            log.info("PostgresqlEventBus stopped");
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public Result<Void> publish(PersistedEvent event) {
        Objects.requireNonNull(event, "No event provided");
        try {
            var queuedFor = eventStore.getUnitOfWorkFactory().withUnitOfWork(unitOfWork -> {
                var subscribers = new ArrayList<SubscriberId>();
                for (var subscription : storage.subscriptions()) {
                    if (subscription.topicPattern.matches(event) && storage.enqueue(subscription.subscriberId, event)) {
                        subscribers.add(subscription.subscriberId);
                    }
                }
                return subscribers;
            });
            log.trace("Queued event with global sequence {} for {} subscriber(s): {}", event.globalSequence(), queuedFor.size(), queuedFor);
            queuedFor.forEach(subscriberId -> localWorker(subscriberId).ifPresent(SubscriberWorker::wakeUp));
            return Result.ok();
        } catch (RuntimeException e) {
            log.debug(msg("Failed to publish event with global sequence {}", event.globalSequence()), e);
            return Result.failure(FailureKind.PUBLISH_ERROR,
                                  new PublishException(msg("Failed to publish event with global sequence {}: {}", event.globalSequence(), e.getMessage()), e));
        }
    }

    @Override
    public void subscribe(TopicPattern topicPattern, PersistedEventHandler handler, SubscriberId subscriberId, SubscriptionOptions options) {
        Objects.requireNonNull(topicPattern, "No topicPattern provided");
        Objects.requireNonNull(handler, "No handler provided");
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        Objects.requireNonNull(options, "No options provided");

        var worker = new SubscriberWorker(subscriberId,
                                          topicPattern,
                                          handler,
                                          options,
                                          eventStore,
                                          storage,
                                          historyQueuer,
                                          configuration.pollingInterval);
        if (workers.putIfAbsent(subscriberId, worker) != null) {
            throw new EventBusException(msg("Subscriber '{}' is already subscribed", subscriberId));
        }
        try {
            var initialCheckpoint = options.startPosition == StartPosition.LATEST ? eventStore.lastGlobalSequence() : 0L;
            var created           = storage.registerSubscription(subscriberId, topicPattern, initialCheckpoint);
            if (created && options.startPosition == StartPosition.BEGINNING) {
                worker.queueHistoryOnStart(eventStore.lastGlobalSequence());
            }
            log.info("[{}] Subscribed to '{}'. {} subscription, start position {}",
                     subscriberId,
                     topicPattern,
                     created ? "New" : "Existing",
                     options.startPosition);
        } catch (RuntimeException e) {
            workers.remove(subscriberId);
            throw e;
        }
        if (started) {
            worker.start();
        }
    }

    @Override
    public boolean unsubscribe(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        var worker = workers.remove(subscriberId);
        if (worker == null) {
            return false;
        }
        worker.stop();
        log.info("[{}] Unsubscribed. The checkpoint is kept", subscriberId);
        return true;
    }

    @Override
    public boolean isSubscribed(SubscriberId subscriberId) {
        Objects.requireNonNull(subscriberId, "No subscriberId provided");
        return workers.containsKey(subscriberId);
    }

    public SubscriptionManager subscriptionManager() {
        return subscriptionManager;
    }

    /**
     * @return the storage, e.g. to inspect the queued deliveries
     */
    public EventBusStorage storage() {
        return storage;
    }

    public PostgresqlEventBusConfiguration configuration() {
        return configuration;
    }

    EventStore eventStore() {
        return eventStore;
    }

    EventHistoryQueuer historyQueuer() {
        return historyQueuer;
    }

    Optional<SubscriberWorker> localWorker(SubscriberId subscriberId) {
        return Optional.ofNullable(workers.get(subscriberId));
    }

    @Override
    public String toString() {
        return "PostgresqlEventBus{" +
                "configuration=" + configuration +
                ", localSubscribers=" + workers.keySet() +
                ", started=" + started +
                '}';
    }
}
