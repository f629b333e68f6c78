package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

import dk.cloudcreate.eventcore.common.transaction.UnitOfWork;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.*;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.*;
import reactor.core.scheduler.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * In-process bus that publishes the {@link PersistedEvents} of every {@link UnitOfWork} at the
 * {@link CommitStage#BeforeCommit}, {@link CommitStage#AfterCommit} and {@link CommitStage#AfterRollback} stages.<br>
 * Synchronous subscribers are called on the committing thread (and may fail a {@link CommitStage#BeforeCommit}).
 * Asynchronous subscribers are called on a Reactor scheduler and never delay the committing thread.<br>
 * Delivery to asynchronous subscribers is best effort and isn't durable.
 */
public class EventStoreLocalEventBus {
    private static final Logger log = LoggerFactory.getLogger("EventStoreLocalEventBus");

    private final List<Consumer<PersistedEvents>>                syncSubscribers  = new CopyOnWriteArrayList<>();
    private final ConcurrentMap<Consumer<PersistedEvents>, Disposable> asyncSubscribers = new ConcurrentHashMap<>();
    private final Sinks.Many<PersistedEvents>                    asyncSink        = Sinks.many().multicast().directBestEffort();
    private final Scheduler                                      asyncScheduler   = Schedulers.boundedElastic();

    public EventStoreLocalEventBus(EventStoreUnitOfWorkFactory unitOfWorkFactory) {
        Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory was supplied");
        unitOfWorkFactory.registerPersistedEventsCommitLifeCycleCallback(new PersistedEventsCommitLifecycleCallback() {
            @Override
            public void beforeCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents) {
                publish(new PersistedEvents(CommitStage.BeforeCommit, unitOfWork, persistedEvents));
            }

            @Override
            public void afterCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents) {
                publish(new PersistedEvents(CommitStage.AfterCommit, unitOfWork, persistedEvents));
            }

            @Override
            public void afterRollback(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents) {
                publish(new PersistedEvents(CommitStage.AfterRollback, unitOfWork, persistedEvents));
            }
        });
    }

    /**
     * Publish to all subscribers. Synchronous subscribers that fail during {@link CommitStage#BeforeCommit}
     * propagate their exception (which rolls back the {@link UnitOfWork}); at the other stages failures are logged
     *
     * @param persistedEvents the events
     */
    public void publish(PersistedEvents persistedEvents) {
        Objects.requireNonNull(persistedEvents, "No persistedEvents provided");
        for (var subscriber : syncSubscribers) {
            try {
                subscriber.accept(persistedEvents);
            } catch (RuntimeException e) {
                if (persistedEvents.commitStage == CommitStage.BeforeCommit) {
                    throw e;
                }
                onErrorHandler(subscriber, persistedEvents, e);
            }
        }
        synchronized (asyncSink) {
            var emitResult = asyncSink.tryEmitNext(persistedEvents);
            if (emitResult.isFailure() && emitResult != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("Failed to publish {} to the asynchronous subscribers: {}", persistedEvents, emitResult);
            }
        }
    }

    private void onErrorHandler(Consumer<PersistedEvents> persistedEventsConsumer, PersistedEvents persistedEvents, Exception e) {
        log.error(msg("Failed to publish {} to consumer {}", persistedEvents, persistedEventsConsumer.getClass().getName()), e);
    }

    /**
     * @return the asynchronous stream of {@link PersistedEvents}
     */
    public Flux<PersistedEvents> asFlux() {
        return asyncSink.asFlux();
    }

    public EventStoreLocalEventBus addAsyncSubscriber(Consumer<PersistedEvents> subscriber) {
        Objects.requireNonNull(subscriber, "No subscriber provided");
        asyncSubscribers.computeIfAbsent(subscriber, consumer -> asyncSink.asFlux()
                                                                          .onBackpressureBuffer()
                                                                          .publishOn(asyncScheduler)
                                                                          .subscribe(persistedEvents -> {
                                                                              try {
                                                                                  consumer.accept(persistedEvents);
                                                                              } catch (RuntimeException e) {
                                                                                  onErrorHandler(consumer, persistedEvents, e);
                                                                              }
                                                                          }));
        return this;
    }

    public EventStoreLocalEventBus removeAsyncSubscriber(Consumer<PersistedEvents> subscriber) {
        var disposable = asyncSubscribers.remove(Objects.requireNonNull(subscriber, "No subscriber provided"));
        if (disposable != null) {
            disposable.dispose();
        }
        return this;
    }

    public EventStoreLocalEventBus addSyncSubscriber(Consumer<PersistedEvents> subscriber) {
        syncSubscribers.add(Objects.requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }

    public EventStoreLocalEventBus removeSyncSubscriber(Consumer<PersistedEvents> subscriber) {
        syncSubscribers.remove(Objects.requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }
}
