package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.Lifecycle;
import dk.cloudcreate.eventcore.common.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.subscription.PersistedEventHandler;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Delivers the queued events of one subscriber, one at a time in global sequence order.<br>
 * The worker owns two threads: a scheduler thread that reads the next delivery and records its outcome, and a handler thread
 * that invokes the {@link PersistedEventHandler} so the invocation can be abandoned after {@link SubscriptionOptions#handlerTimeout}.<br>
 * A failed delivery is retried according to {@link SubscriptionOptions#redeliveryPolicy}; the worker waits for the retry instead of
 * moving on to later events. Once the policy is exhausted the delivery is marked as a dead letter and the worker continues with the next event.<br>
 * All checkpoint and status changes for the subscriber made in this process run on the scheduler thread.
 */
final class SubscriberWorker implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(SubscriberWorker.class);

    private final SubscriberId                    subscriberId;
    private final TopicPattern                    topicPattern;
    private final PersistedEventHandler           handler;
    private final SubscriptionOptions             options;
    private final EventStore                      eventStore;
    private final EventBusStorage                 storage;
    private final EventHistoryQueuer              historyQueuer;
    private final Duration                        pollingInterval;
    private final SubscriptionMetrics             metrics;
    private final AtomicBoolean                   wakeUpScheduled = new AtomicBoolean();

    private volatile boolean                  started;
    private          ScheduledExecutorService scheduler;
    private volatile ExecutorService          handlerExecutor;
    /**
     * Handler thread of a timed out invocation that ignored the interrupt. No handler callback runs until it has terminated
     */
    private volatile ExecutorService          abandonedHandlerExecutor;
    /**
     * History to queue when the worker starts. Only set for new subscribers starting at {@link StartPosition#BEGINNING}
     */
    private volatile long                     historyToSequence = -1;

    SubscriberWorker(SubscriberId subscriberId,
                     TopicPattern topicPattern,
                     PersistedEventHandler handler,
                     SubscriptionOptions options,
                     EventStore eventStore,
                     EventBusStorage storage,
                     EventHistoryQueuer historyQueuer,
                     Duration pollingInterval) {
        this.subscriberId = Objects.requireNonNull(subscriberId, "No subscriberId provided");
        this.topicPattern = Objects.requireNonNull(topicPattern, "No topicPattern provided");
        this.handler = Objects.requireNonNull(handler, "No handler provided");
        this.options = Objects.requireNonNull(options, "No options provided");
        this.eventStore = Objects.requireNonNull(eventStore, "No eventStore provided");
        this.storage = Objects.requireNonNull(storage, "No storage provided");
        this.historyQueuer = Objects.requireNonNull(historyQueuer, "No historyQueuer provided");
        this.pollingInterval = Objects.requireNonNull(pollingInterval, "No pollingInterval provided");
        this.metrics = new SubscriptionMetrics(subscriberId);
    }

    @Override
    public synchronized void start() {
        if (!started) {
            log.info("[{}] Starting SubscriberWorker for '{}' using {}", subscriberId, topicPattern, options);
            scheduler = Executors.newSingleThreadScheduledExecutor(ThreadFactoryBuilder.builder()
                                                                                       .nameFormat("EventBus-" + subscriberId + "-Scheduler-%d")
                                                                                       .daemon(true)
                                                                                       .build());
            handlerExecutor = newHandlerExecutor();
            started = true;
            scheduler.scheduleWithFixedDelay(this::deliveryCycle,
                                             0,
                                             pollingInterval.toMillis(),
                                             TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public synchronized void stop() {
        if (started) {
            log.info("[{}] Stopping SubscriberWorker", subscriberId);
            started = false;
            scheduler.shutdownNow();
            handlerExecutor.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[{}] SubscriberWorker scheduler didn't stop within 5 seconds", subscriberId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            handlerExecutor = null;
            var abandoned = abandonedHandlerExecutor;
            if (abandoned != null) {
                abandoned.shutdownNow();
                abandonedHandlerExecutor = null;
            }
            log.info("[{}] SubscriberWorker stopped", subscriberId);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    SubscriberId subscriberId() {
        return subscriberId;
    }

    SubscriptionMetrics metrics() {
        return metrics;
    }

    /**
     * Queue the matching events up to (and including) <code>toSequence</code> when the worker starts
     */
    void queueHistoryOnStart(long toSequence) {
        historyToSequence = toSequence;
    }

    /**
     * Look for pending deliveries now instead of waiting for the polling interval
     */
    void wakeUp() {
        if (started && wakeUpScheduled.compareAndSet(false, true)) {
            try {
                scheduler.execute(() -> {
                    wakeUpScheduled.set(false);
                    deliveryCycle();
                });
            } catch (RejectedExecutionException e) {
                wakeUpScheduled.set(false);
                log.debug("[{}] Ignoring wake up since the SubscriberWorker is stopping", subscriberId);
            }
        }
    }

    /**
     * Run <code>task</code> on the scheduler thread, so it never runs concurrently with a delivery.
     * If the worker isn't started the task runs on the calling thread
     */
    <T> T runOnWorkerThread(Callable<T> task) {
        ScheduledExecutorService currentScheduler;
        synchronized (this) {
            currentScheduler = started ? scheduler : null;
        }
        try {
            if (currentScheduler == null) {
                return task.call();
            }
            return currentScheduler.submit(task).get();
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EventBusException(msg("[{}] Task failed on the SubscriberWorker thread", subscriberId), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventBusException(msg("[{}] Interrupted while waiting for the SubscriberWorker thread", subscriberId), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventBusException(msg("[{}] Task failed", subscriberId), e);
        }
    }

    /**
     * Reset the subscriber to <code>fromSequence - 1</code>, let the handler know and queue the matching events again
     */
    Result<Void> replay(long fromSequence) {
        var result = runOnWorkerThread(() -> {
            storage.resetForReplay(subscriberId, fromSequence);
            var resetFailure = invokeHandler(() -> handler.onResetFrom(fromSequence));
            historyQueuer.queue(subscriberId, topicPattern, fromSequence, eventStore.lastGlobalSequence());
            if (resetFailure.isPresent()) {
                log.error(msg("[{}] onResetFrom({}) failed. The events were queued again", subscriberId, fromSequence), resetFailure.get());
                return Result.<Void>failure(FailureKind.HANDLER_ERROR,
                                            new EventBusException(msg("[{}] onResetFrom({}) failed: {}", subscriberId, fromSequence, resetFailure.get().getMessage()),
                                                                  resetFailure.get()));
            }
            return Result.ok();
        });
        wakeUp();
        return result;
    }

    /**
     * @return true if there's no history left to queue
     */
    private boolean queueHistory() {
        var toSequence = historyToSequence;
        if (toSequence < 0) {
            return true;
        }
        try {
            historyQueuer.queue(subscriberId, topicPattern, 1, toSequence);
            historyToSequence = -1;
            return true;
        } catch (RuntimeException e) {
            log.error(msg("[{}] Failed to queue the event history. Delivery is held back until the history has been queued", subscriberId), e);
            return false;
        }
    }

    private void deliveryCycle() {
        try {
            // Delivering a newer event first would move the checkpoint past the history
            if (!queueHistory() || !abandonedInvocationHasCompleted()) {
                return;
            }
            while (started && !Thread.currentThread().isInterrupted()) {
                var subscription = storage.subscription(subscriberId);
                if (subscription.isEmpty()) {
                    log.warn("[{}] Subscription row is missing. Skipping delivery cycle", subscriberId);
                    return;
                }
                if (subscription.get().status != SubscriptionStatus.ACTIVE) {
                    log.trace("[{}] Subscription is {}. Skipping delivery cycle", subscriberId, subscription.get().status);
                    return;
                }
                var nextDelivery = storage.nextDelivery(subscriberId);
                if (nextDelivery.isEmpty()) {
                    return;
                }
                var delivery = nextDelivery.get();
                var now      = OffsetDateTime.now(ZoneOffset.UTC);
                if (delivery.nextDeliveryAt.isAfter(now)) {
                    var delay = Duration.between(now, delivery.nextDeliveryAt);
                    log.trace("[{}] Next delivery {} is due in {}", subscriberId, delivery.globalSequence, delay);
                    scheduler.schedule(this::deliveryCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
                    return;
                }
                if (!deliver(delivery)) {
                    return;
                }
            }
        } catch (RuntimeException e) {
            log.error(msg("[{}] Delivery cycle failed", subscriberId), e);
        }
    }

    /**
     * @return true if the worker can continue with the next delivery right away
     */
    private boolean deliver(PendingDelivery delivery) {
        var event = loadEvent(delivery.globalSequence);
        if (event.isEmpty()) {
            log.error("[{}] Event with global sequence {} doesn't exist. Marking the subscription as {}",
                      subscriberId,
                      delivery.globalSequence,
                      SubscriptionStatus.FAILED);
            storage.updateStatus(subscriberId, SubscriptionStatus.FAILED);
            return false;
        }

        var attempt = delivery.deliveryAttempts + 1;
        log.debug("[{}] Delivering event with global sequence {} (aggregate '{}', version {}). Attempt {}",
                  subscriberId,
                  delivery.globalSequence,
                  event.get().aggregateId(),
                  event.get().aggregateVersion(),
                  attempt);
        var invokedAt  = Instant.now();
        var startNanos = System.nanoTime();
        var failure    = invokeHandler(() -> handler.handle(event.get()));
        if (!started || Thread.currentThread().isInterrupted()) {
            log.debug("[{}] Worker stopped while delivering event with global sequence {}. It will be delivered again", subscriberId, delivery.globalSequence);
            return false;
        }
        metrics.recordInvocation(invokedAt, System.nanoTime() - startNanos, failure.isEmpty());

        if (abandonedHandlerExecutor != null) {
            var error = describe(failure.orElseThrow());
            storage.scheduleRedelivery(subscriberId, delivery.globalSequence, attempt, EventBusStorage.now(), error);
            storage.updateStatus(subscriberId, SubscriptionStatus.FAILED);
            log.error("[{}] Handler invocation for event with global sequence {} timed out and didn't stop when interrupted. " +
                              "Marking the subscription as {}. The event is delivered again once the invocation has completed and the subscription is resumed",
                      subscriberId,
                      delivery.globalSequence,
                      SubscriptionStatus.FAILED);
            return false;
        }

        if (failure.isEmpty()) {
            storage.completeDelivery(subscriberId, delivery.globalSequence);
            log.trace("[{}] Event with global sequence {} handled", subscriberId, delivery.globalSequence);
            return true;
        }

        var error = describe(failure.get());
        if (options.redeliveryPolicy.isExhausted(attempt)) {
            storage.markAsDeadLetter(subscriberId, delivery.globalSequence, attempt, error);
            metrics.recordDeadLetter();
            log.error(msg("[{}] Event with global sequence {} failed {} time(s) and was marked as a dead letter: {}",
                          subscriberId,
                          delivery.globalSequence,
                          attempt,
                          error),
                      failure.get());
            return true;
        }

        var redeliveryDelay = options.redeliveryPolicy.calculateNextRedeliveryDelay(attempt - 1);
        storage.scheduleRedelivery(subscriberId,
                                   delivery.globalSequence,
                                   attempt,
                                   EventBusStorage.now().plus(redeliveryDelay),
                                   error);
        log.warn("[{}] Event with global sequence {} failed (attempt {}). Redelivering in {}: {}",
                 subscriberId,
                 delivery.globalSequence,
                 attempt,
                 redeliveryDelay,
                 error);
        scheduler.schedule(this::deliveryCycle, redeliveryDelay.toMillis(), TimeUnit.MILLISECONDS);
        return false;
    }

    private Optional<PersistedEvent> loadEvent(long globalSequence) {
        return eventStore.readAll(globalSequence, 1)
                         .filter(event -> event.globalSequence() == globalSequence)
                         .findFirst();
    }

    /**
     * Run the handler callback on the handler thread
     *
     * @return the failure, if the callback threw or timed out
     */
    private Optional<Throwable> invokeHandler(Runnable handlerCallback) {
        if (!abandonedInvocationHasCompleted()) {
            return Optional.of(new EventBusException(msg("[{}] A timed out handler invocation is still running", subscriberId)));
        }
        var executor = handlerExecutor;
        if (executor == null) {
            try {
                handlerCallback.run();
                return Optional.empty();
            } catch (RuntimeException e) {
                return Optional.of(e);
            }
        }
        var future = executor.submit(handlerCallback);
        try {
            future.get(options.handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.of(e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            executor.shutdownNow();
            if (!awaitTermination(executor)) {
                abandonedHandlerExecutor = executor;
            }
            handlerExecutor = newHandlerExecutor();
            return Optional.of(new EventBusException(msg("[{}] Handler didn't complete within {}", subscriberId, options.handlerTimeout)));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.of(e);
        }
    }

    /**
     * Give an interrupted handler invocation up to {@link SubscriptionOptions#handlerTimeout} to finish
     */
    private boolean awaitTermination(ExecutorService executor) {
        try {
            return executor.awaitTermination(options.handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean abandonedInvocationHasCompleted() {
        var abandoned = abandonedHandlerExecutor;
        if (abandoned == null) {
            return true;
        }
        if (abandoned.isTerminated()) {
            log.info("[{}] Timed out handler invocation has completed", subscriberId);
            abandonedHandlerExecutor = null;
            return true;
        }
        log.trace("[{}] Timed out handler invocation is still running. Holding back delivery", subscriberId);
        return false;
    }

    private ExecutorService newHandlerExecutor() {
        return Executors.newSingleThreadExecutor(ThreadFactoryBuilder.builder()
                                                                     .nameFormat("EventBus-" + subscriberId + "-Handler-%d")
                                                                     .daemon(true)
                                                                     .build());
    }

    private static String describe(Throwable failure) {
        return failure.getClass().getName() + ": " + failure.getMessage();
    }

    @Override
    public String toString() {
        return "SubscriberWorker{" +
                "subscriberId=" + subscriberId +
                ", topicPattern=" + topicPattern +
                ", started=" + started +
                '}';
    }
}
