package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

import dk.cloudcreate.eventcore.common.Lifecycle;
import dk.cloudcreate.eventcore.common.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Hands the events appended to the {@link EventStore} over to an {@link EventBus} in global sequence order with at-least-once semantics.<br>
 * <br>
 * The relay runs on a single scheduler thread. Each cycle reads the next batch after its persisted cursor and publishes the events one by one.
 * When every event in the batch has been acknowledged, the batch's outbox entries are marked {@link OutboxEntryStatus#DISPATCHED} and the cursor
 * is advanced in one transaction. A crash before that point means the batch is published again after restart.<br>
 * <br>
 * A failed publish is retried using {@link OutboxRelayConfiguration#publishRedeliveryPolicy}. When the policy is exhausted the batch's
 * entries are marked {@link OutboxEntryStatus#FAILED} and an alert is logged on the <code>OutboxRelay.Alert</code> logger.
 * The relay never skips a batch: it keeps retrying with the policy's maximum delay.<br>
 * <br>
 * Commits in this process wake the relay up, so events are normally relayed without waiting for the polling interval.
 */
public class OutboxRelay implements Lifecycle {
    private static final Logger log      = LoggerFactory.getLogger(OutboxRelay.class);
    private static final Logger alertLog = LoggerFactory.getLogger("OutboxRelay.Alert");

    private final EventStore               eventStore;
    private final EventBus                 eventBus;
    private final OutboxRelayConfiguration configuration;
    private final OutboxRepository         outboxRepository;
    private final AtomicBoolean            wakeUpScheduled = new AtomicBoolean();
    private final Consumer<PersistedEvents> commitListener;

    private volatile boolean                  started;
    private          ScheduledExecutorService scheduler;
    /**
     * Only accessed from the relay thread
     */
    private          PendingBatch             pendingBatch;

    public OutboxRelay(EventStore eventStore, EventBus eventBus, OutboxRelayConfiguration configuration) {
        this.eventStore = Objects.requireNonNull(eventStore, "No eventStore provided");
        this.eventBus = Objects.requireNonNull(eventBus, "No eventBus provided");
        this.configuration = Objects.requireNonNull(configuration, "No configuration provided");
        this.outboxRepository = new OutboxRepository(eventStore.getUnitOfWorkFactory(),
                                                     eventStore.configuration().outboxTableName,
                                                     configuration.cursorTableName);
        this.commitListener = persistedEvents -> {
            if (persistedEvents.commitStage == CommitStage.AfterCommit) {
                wakeUp();
            }
        };
        outboxRepository.initializeStorage();
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting OutboxRelay using {}", configuration.relayName, configuration);
            scheduler = Executors.newSingleThreadScheduledExecutor(ThreadFactoryBuilder.builder()
                                                                                       .nameFormat("OutboxRelay-" + configuration.relayName + "-%d")
                                                                                       .daemon(true)
                                                                                       .build());
            started = true;
            eventStore.localEventBus().addAsyncSubscriber(commitListener);
            scheduler.scheduleWithFixedDelay(this::relayCycle,
                                             0,
                                             configuration.pollingInterval.toMillis(),
                                             TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping OutboxRelay", configuration.relayName);
            started = false;
            eventStore.localEventBus().removeAsyncSubscriber(commitListener);
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[{}] OutboxRelay thread didn't stop within 5 seconds", configuration.relayName);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            pendingBatch = null;
            log.info("[{}] OutboxRelay stopped", configuration.relayName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    public OutboxRepository outboxRepository() {
        return outboxRepository;
    }

    /**
     * Trigger a relay cycle now instead of waiting for the polling interval
     */
    public void wakeUp() {
        if (started && wakeUpScheduled.compareAndSet(false, true)) {
            try {
                scheduler.execute(() -> {
                    wakeUpScheduled.set(false);
                    relayCycle();
                });
            } catch (RejectedExecutionException e) {
                wakeUpScheduled.set(false);
                log.debug("[{}] Ignoring wake up since the OutboxRelay is stopping", configuration.relayName);
            }
        }
    }

    private void relayCycle() {
        try {
            while (started) {
                if (pendingBatch == null) {
                    var fromSequence = outboxRepository.lastRelayedSequence(configuration.relayName) + 1;
                    var events       = eventStore.readAll(fromSequence, configuration.batchSize).collect(Collectors.toList());
                    if (events.isEmpty()) {
                        return;
                    }
                    pendingBatch = new PendingBatch(events);
                }
                if (Instant.now().isBefore(pendingBatch.nextAttemptAt)) {
                    return;
                }
                if (!relay(pendingBatch)) {
                    return;
                }
                pendingBatch = null;
            }
        } catch (RuntimeException e) {
            log.error(msg("[{}] OutboxRelay cycle failed", configuration.relayName), e);
        }
    }

    /**
     * @return true if the whole batch was published and marked dispatched
     */
    private boolean relay(PendingBatch batch) {
        batch.attempts++;
        while (batch.nextIndex < batch.events.size()) {
            var event  = batch.events.get(batch.nextIndex);
            var result = publish(event);
            if (result.isFailure()) {
                onPublishFailure(batch, event, result.failure());
                return false;
            }
            batch.nextIndex++;
        }
        outboxRepository.markDispatchedAndAdvanceCursor(configuration.relayName, batch.fromSequence(), batch.toSequence(), batch.attempts);
        if (batch.markedFailed) {
            log.info("[{}] Batch {}-{} was relayed after {} attempts", configuration.relayName, batch.fromSequence(), batch.toSequence(), batch.attempts);
        } else {
            log.debug("[{}] Relayed batch {}-{}", configuration.relayName, batch.fromSequence(), batch.toSequence());
        }
        return true;
    }

    private Result<Void> publish(PersistedEvent event) {
        try {
            return eventBus.publish(event);
        } catch (RuntimeException e) {
            return Result.failure(FailureKind.PUBLISH_ERROR, new PublishException(msg("Publishing event with global sequence {} failed", event.globalSequence()), e));
        }
    }

    private void onPublishFailure(PendingBatch batch, PersistedEvent event, Failure failure) {
        var policy = configuration.publishRedeliveryPolicy;
        Duration delay;
        if (policy.isExhausted(batch.attempts)) {
            delay = policy.maximumFollowupRedeliveryThreshold;
            if (!batch.markedFailed) {
                outboxRepository.markFailed(batch.fromSequence(), batch.toSequence(), batch.attempts, failure.message());
                batch.markedFailed = true;
                alertLog.error(msg("[{}] Failed to relay batch {}-{} after {} attempts. Last failure while publishing event with global sequence {}: {}. Will keep retrying every {}",
                                   configuration.relayName,
                                   batch.fromSequence(),
                                   batch.toSequence(),
                                   batch.attempts,
                                   event.globalSequence(),
                                   failure,
                                   delay),
                               failure.cause());
            }
        } else {
            delay = policy.calculateNextRedeliveryDelay(batch.attempts - 1);
            log.warn("[{}] Failed to publish event with global sequence {} (attempt {}). Retrying in {}: {}",
                     configuration.relayName,
                     event.globalSequence(),
                     batch.attempts,
                     delay,
                     failure);
        }
        batch.nextAttemptAt = Instant.now().plus(delay);
        scheduler.schedule(this::relayCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static final class PendingBatch {
        private final List<PersistedEvent> events;
        private       int                  nextIndex;
        private       int                  attempts;
        private       Instant              nextAttemptAt = Instant.MIN;
        private       boolean              markedFailed;

        private PendingBatch(List<PersistedEvent> events) {
            this.events = events;
        }

        private long fromSequence() {
            return events.get(0).globalSequence();
        }

        private long toSequence() {
            return events.get(events.size() - 1).globalSequence();
        }
    }
}
