package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.types.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.EventStoreLocalEventBus;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.persistence.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.EventType;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.*;
import java.util.stream.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final EventStoreUnitOfWorkFactory    unitOfWorkFactory;
    private final EventStoreConfiguration        configuration;
    private final EventStreamPersistenceStrategy persistenceStrategy;
    private final EventStoreLocalEventBus        eventStoreLocalEventBus;

    /**
     * Create a {@link PostgresqlEventStore} that manages its own {@link EventStoreManagedUnitOfWorkFactory} and logs its SQL
     * using the {@link EventStoreSqlLogger}
     *
     * @param jdbi          the jdbi instance
     * @param configuration the event store configuration
     * @return the event store with its storage initialized
     */
    public static PostgresqlEventStore create(Jdbi jdbi, EventStoreConfiguration configuration) {
        Objects.requireNonNull(jdbi, "No jdbi provided");
        Objects.requireNonNull(configuration, "No configuration provided");
        jdbi.setSqlLogger(new EventStoreSqlLogger());
        return new PostgresqlEventStore(new EventStoreManagedUnitOfWorkFactory(jdbi, configuration.queryTimeout.orElse(null)),
                                        configuration);
    }

    public PostgresqlEventStore(EventStoreUnitOfWorkFactory unitOfWorkFactory, EventStoreConfiguration configuration) {
        this(unitOfWorkFactory, configuration, new PostgresqlEventStreamPersistenceStrategy(unitOfWorkFactory, configuration));
    }

    public PostgresqlEventStore(EventStoreUnitOfWorkFactory unitOfWorkFactory,
                                EventStoreConfiguration configuration,
                                EventStreamPersistenceStrategy persistenceStrategy) {
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = Objects.requireNonNull(configuration, "No configuration provided");
        this.persistenceStrategy = Objects.requireNonNull(persistenceStrategy, "No persistenceStrategy provided");
        this.eventStoreLocalEventBus = new EventStoreLocalEventBus(unitOfWorkFactory);
        persistenceStrategy.initializeStorage();
    }

    @Override
    public Result<List<PersistedEvent>> append(AggregateType aggregateType, Object aggregateId, long expectedVersion, List<?> events) {
        Objects.requireNonNull(aggregateType, "No aggregateType provided");
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        Objects.requireNonNull(events, "No events provided");
        var persistableEvents = events.stream()
                                      .map(PersistableEvent::from)
                                      .collect(Collectors.toList());
        var persistedAggregateId = aggregateId.toString();

        var existingUnitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (existingUnitOfWork.isPresent()) {
            var unitOfWork = existingUnitOfWork.get();
            try {
                var persistedEvents = persistenceStrategy.append(unitOfWork, aggregateType, persistedAggregateId, expectedVersion, persistableEvents);
                unitOfWork.registerEventsPersisted(persistedEvents);
                return Result.success(persistedEvents);
            } catch (RuntimeException e) {
                log.debug("[{}:{}] Append failed. Marking the UnitOfWork as rollback only: {}", aggregateType, persistedAggregateId, e.getMessage());
                unitOfWork.markAsRollbackOnly(e);
                return Result.failure(Failure.from(e));
            }
        }

        return unitOfWorkFactory.inUnitOfWork(unitOfWork -> {
            var persistedEvents = persistenceStrategy.append(unitOfWork, aggregateType, persistedAggregateId, expectedVersion, persistableEvents);
            unitOfWork.registerEventsPersisted(persistedEvents);
            return persistedEvents;
        });
    }

    @Override
    public Stream<PersistedEvent> read(Object aggregateId, long fromVersion) {
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        if (fromVersion < 0) {
            throw new IllegalArgumentException(msg("fromVersion must be 0 or larger, was {}", fromVersion));
        }
        var persistedAggregateId = aggregateId.toString();
        return pagedStream(Math.max(fromVersion, 1),
                           Long.MAX_VALUE,
                           (nextVersion, pageSize) -> query(msg("read events related to aggregate '{}'", persistedAggregateId),
                                                            unitOfWork -> persistenceStrategy.loadAggregateEvents(unitOfWork, persistedAggregateId, nextVersion, pageSize)),
                           PersistedEvent::aggregateVersion);
    }

    @Override
    public Stream<PersistedEvent> readAll(long fromSequence, int limit) {
        requireValidRange(fromSequence, limit);
        return pagedStream(Math.max(fromSequence, 1),
                           limit,
                           (nextSequence, pageSize) -> query(msg("read events from global sequence {}", nextSequence),
                                                             unitOfWork -> persistenceStrategy.loadEventsByGlobalSequence(unitOfWork, nextSequence, pageSize)),
                           PersistedEvent::globalSequence);
    }

    @Override
    public Stream<PersistedEvent> readByEventType(EventType eventType, long fromSequence, int limit) {
        Objects.requireNonNull(eventType, "No eventType provided");
        requireValidRange(fromSequence, limit);
        return pagedStream(Math.max(fromSequence, 1),
                           limit,
                           (nextSequence, pageSize) -> query(msg("read '{}' events from global sequence {}", eventType, nextSequence),
                                                             unitOfWork -> persistenceStrategy.loadEventsByEventType(unitOfWork, eventType, nextSequence, pageSize)),
                           PersistedEvent::globalSequence);
    }

    @Override
    public Stream<PersistedEvent> readByCorrelationId(CorrelationId correlationId) {
        Objects.requireNonNull(correlationId, "No correlationId provided");
        return pagedStream(1,
                           Long.MAX_VALUE,
                           (nextSequence, pageSize) -> query(msg("read events with correlation id '{}'", correlationId),
                                                             unitOfWork -> persistenceStrategy.loadEventsByCorrelationId(unitOfWork, correlationId, nextSequence, pageSize)),
                           PersistedEvent::globalSequence);
    }

    @Override
    public Optional<PersistedEvent> loadEvent(EventId eventId) {
        Objects.requireNonNull(eventId, "No eventId provided");
        return query(msg("load event '{}'", eventId),
                     unitOfWork -> persistenceStrategy.loadEvent(unitOfWork, eventId));
    }

    @Override
    public long currentVersion(Object aggregateId) {
        Objects.requireNonNull(aggregateId, "No aggregateId provided");
        return query(msg("resolve the current version of aggregate '{}'", aggregateId),
                     unitOfWork -> persistenceStrategy.currentVersion(unitOfWork, aggregateId.toString()).orElse(0L));
    }

    @Override
    public long lastGlobalSequence() {
        return query("resolve the last global sequence", persistenceStrategy::lastGlobalSequence);
    }

    @Override
    public Flux<PersistedEvent> pollEvents(long fromSequence, int batchSize, Duration pollingInterval) {
        requireValidRange(fromSequence, batchSize);
        Objects.requireNonNull(pollingInterval, "No pollingInterval provided");
        var pollingLog   = LoggerFactory.getLogger("EventStore.PollingEventStream");
        var nextSequence = new AtomicLong(Math.max(fromSequence, 1));
        pollingLog.debug("Creating polling EventStream with fromSequence {} and batch size {}", fromSequence, batchSize);

        return Flux.defer(() -> {
                       try {
                           var events = readAll(nextSequence.get(), batchSize).collect(Collectors.toList());
                           if (events.isEmpty()) {
                               pollingLog.trace("Polling from global sequence {} returned no events", nextSequence.get());
                           } else {
                               pollingLog.debug("Polling from global sequence {} returned {} events", nextSequence.get(), events.size());
                           }
                           return Flux.fromIterable(events);
                       } catch (RuntimeException e) {
                           pollingLog.error(msg("Polling from global sequence {} failed", nextSequence.get()), e);
                           return Flux.error(e);
                       }
                   })
                   .doOnNext(event -> nextSequence.set(event.globalSequence() + 1))
                   .repeatWhen(completed -> completed.delayElements(pollingInterval));
    }

    @Override
    public EventStoreUnitOfWorkFactory getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    @Override
    public EventStoreLocalEventBus localEventBus() {
        return eventStoreLocalEventBus;
    }

    @Override
    public EventStoreConfiguration configuration() {
        return configuration;
    }

    /**
     * Global sequences start at 1, so a <code>fromSequence</code> of 0 means "from the start"
     */
    private static void requireValidRange(long fromSequence, long limit) {
        if (fromSequence < 0) {
            throw new IllegalArgumentException(msg("fromSequence must be 0 or larger, was {}", fromSequence));
        }
        if (limit < 1) {
            throw new IllegalArgumentException(msg("limit must be 1 or larger, was {}", limit));
        }
    }

    /**
     * Run a read inside the current {@link dk.cloudcreate.eventcore.common.transaction.UnitOfWork} or a new one
     *
     * @throws StorageException if the read failed
     */
    private <R> R query(String description, Function<EventStoreUnitOfWork, R> query) {
        try {
            return unitOfWorkFactory.withUnitOfWork(query::apply);
        } catch (RuntimeException e) {
            throw new StorageException(msg("Failed to {}", description), e);
        }
    }

    private Stream<PersistedEvent> pagedStream(long fromPosition,
                                               long limit,
                                               PageLoader pageLoader,
                                               ToLongFunction<PersistedEvent> positionOf) {
        var iterator = new PagingIterator(fromPosition, limit, configuration.queryPageSize, pageLoader, positionOf);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @FunctionalInterface
    private interface PageLoader {
        List<PersistedEvent> load(long fromPosition, int pageSize);
    }

    /**
     * Loads the next page lazily when the previous page has been consumed. A page shorter than the page size ends the iteration
     */
    private static final class PagingIterator implements Iterator<PersistedEvent> {
        private final int                            pageSize;
        private final PageLoader                     pageLoader;
        private final ToLongFunction<PersistedEvent> positionOf;
        private       long                           nextPosition;
        private       long                           remaining;
        private       Iterator<PersistedEvent>       currentPage = Collections.emptyIterator();
        private       boolean                        exhausted;

        private PagingIterator(long fromPosition, long limit, int pageSize, PageLoader pageLoader, ToLongFunction<PersistedEvent> positionOf) {
            this.nextPosition = fromPosition;
            this.remaining = limit;
            this.pageSize = pageSize;
            this.pageLoader = pageLoader;
            this.positionOf = positionOf;
        }

        @Override
        public boolean hasNext() {
            if (remaining <= 0) {
                return false;
            }
            if (currentPage.hasNext()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            var size = (int) Math.min(pageSize, remaining);
            var page = pageLoader.load(nextPosition, size);
            if (page.size() < size) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                nextPosition = positionOf.applyAsLong(page.get(page.size() - 1)) + 1;
            }
            currentPage = page.iterator();
            return currentPage.hasNext();
        }

        @Override
        public PersistedEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            remaining--;
            return currentPage.next();
        }
    }
}
