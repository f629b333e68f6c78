package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.common.result.*;
import dk.cloudcreate.eventcore.common.transaction.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.*;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.AggregateType;
import org.slf4j.*;

import java.util.*;
import java.util.function.Supplier;

/**
 * Opinionated {@link Aggregate} Repository that's built to persist and load a specific {@link Aggregate} type in combination
 * with the {@link EventStore}, its {@link UnitOfWorkFactory} and an {@link AggregateRootInstanceFactory}.<br>
 * Loaded and persisted aggregates are associated with the current {@link UnitOfWork}. Their uncommitted changes are appended to the
 * {@link EventStore}, using the aggregate's {@link Aggregate#version()} as expected version, when the {@link UnitOfWork} is committed.
 * If another writer appended to the same aggregate in the meantime the commit fails with {@link FailureKind#CONCURRENCY_CONFLICT}.<br>
 * Use {@link #from(EventStore, AggregateType, AggregateRootInstanceFactory, Class)} to create a new repository or extend {@link DefaultAggregateRootRepository}.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public interface AggregateRootRepository<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    static <ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> AggregateRootRepository<ID, AGGREGATE_TYPE> from(EventStore eventStore,
                                                                                                                          AggregateType aggregateType,
                                                                                                                          AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                                                                                                          Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return new DefaultAggregateRootRepository<>(eventStore, aggregateType, aggregateRootInstanceFactory, aggregateImplementationType);
    }

    /**
     * Try to load an {@link Aggregate} instance with the specified <code>aggregateId</code> from the underlying {@link EventStore}<br>
     * If the aggregate instance exists it will be associated with the {@link UnitOfWorkFactory#getRequiredUnitOfWork()}
     * and any changes to it will be persisted when the {@link UnitOfWork} is committed.
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return an {@link Optional} with the matching {@link Aggregate} instance if it exists, otherwise {@link Optional#empty()}
     * @throws NoActiveUnitOfWorkException if there's no active {@link UnitOfWork}
     * @throws StorageException            if the events couldn't be read
     */
    default Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId) {
        return tryLoad(aggregateId, OptionalLong.empty());
    }

    /**
     * Like {@link #tryLoad(Object)}, but verifies that the aggregate's current version matches <code>expectedVersion</code>
     *
     * @throws OptimisticAggregateLoadException if the aggregate exists with a different version
     */
    default Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId, long expectedVersion) {
        return tryLoad(aggregateId, OptionalLong.of(expectedVersion));
    }

    Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId, OptionalLong expectedVersion);

    /**
     * Load an {@link Aggregate} instance and associate it with the {@link UnitOfWorkFactory#getRequiredUnitOfWork()}
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return the aggregate or a {@link FailureKind#NOT_FOUND} failure
     */
    default Result<AGGREGATE_TYPE> load(ID aggregateId) {
        return toResult(aggregateId, () -> tryLoad(aggregateId));
    }

    /**
     * Load an {@link Aggregate} instance with an expected version and associate it with the {@link UnitOfWorkFactory#getRequiredUnitOfWork()}
     *
     * @param aggregateId     the id of the aggregate we want to load
     * @param expectedVersion the version the caller expects the aggregate to have
     * @return the aggregate, a {@link FailureKind#NOT_FOUND} failure or, if the version differs, a {@link FailureKind#CONCURRENCY_CONFLICT} failure
     */
    default Result<AGGREGATE_TYPE> load(ID aggregateId, long expectedVersion) {
        return toResult(aggregateId, () -> tryLoad(aggregateId, expectedVersion));
    }

    private Result<AGGREGATE_TYPE> toResult(ID aggregateId, Supplier<Optional<AGGREGATE_TYPE>> loader) {
        try {
            return loader.get()
                         .map(Result::success)
                         .orElseGet(() -> Result.failure(Failure.from(new AggregateNotFoundException(aggregateId, aggregateImplementationType()))));
        } catch (OptimisticAggregateLoadException | StorageException e) {
            return Result.failure(Failure.from(e));
        }
    }

    /**
     * Associate a newly created and not yet persisted {@link Aggregate} instance with the {@link UnitOfWorkFactory#getRequiredUnitOfWork()}<br>
     * Its changes will be persisted when the {@link UnitOfWork} is committed.
     *
     * @param aggregate the aggregate instance to persist
     * @throws NoActiveUnitOfWorkException if there's no active {@link UnitOfWork}
     */
    void persist(AGGREGATE_TYPE aggregate);

    Class<AGGREGATE_TYPE> aggregateImplementationType();

    /**
     * The {@link AggregateType} this repository uses when appending events
     */
    AggregateType aggregateType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultAggregateRootRepository<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> implements AggregateRootRepository<ID, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRootRepository.class);

        private final EventStore                                           eventStore;
        private final AggregateType                                        aggregateType;
        private final AggregateRootInstanceFactory                         aggregateRootInstanceFactory;
        private final Class<AGGREGATE_TYPE>                                aggregateImplementationType;
        private final AggregateRootRepositoryUnitOfWorkLifecycleCallback   unitOfWorkCallback;

        public DefaultAggregateRootRepository(EventStore eventStore,
                                              AggregateType aggregateType,
                                              AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                              Class<AGGREGATE_TYPE> aggregateImplementationType) {
            this.eventStore = Objects.requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateType = Objects.requireNonNull(aggregateType, "You must supply an aggregateType");
            this.aggregateRootInstanceFactory = Objects.requireNonNull(aggregateRootInstanceFactory, "You must supply an AggregateRootInstanceFactory");
            this.aggregateImplementationType = Objects.requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
            unitOfWorkCallback = new AggregateRootRepositoryUnitOfWorkLifecycleCallback();
        }

        protected EventStore eventStore() {
            return eventStore;
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId, OptionalLong expectedVersion) {
            Objects.requireNonNull(aggregateId, "You must supply an aggregateId");
            Objects.requireNonNull(expectedVersion, "You must supply an expectedVersion option");
            log.trace("Trying to load {} with id '{}' and expectedVersion {}", aggregateImplementationType.getName(), aggregateId, expectedVersion);
            var unitOfWork = eventStore.getUnitOfWorkFactory().getRequiredUnitOfWork();

            AGGREGATE_TYPE aggregate = aggregateRootInstanceFactory.create(aggregateId, aggregateImplementationType);
            try (var persistedEvents = eventStore.read(aggregateId)) {
                aggregate.rehydrate(aggregateId, persistedEvents);
            }
            if (aggregate.version() == 0) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getName(), aggregateId);
                return Optional.empty();
            }
            if (expectedVersion.isPresent() && expectedVersion.getAsLong() != aggregate.version()) {
                log.trace("Found {} with id '{}' but expectedVersion {} != actualVersion {}",
                          aggregateImplementationType.getName(),
                          aggregateId,
                          expectedVersion.getAsLong(),
                          aggregate.version());
                throw new OptimisticAggregateLoadException(aggregateId,
                                                           aggregateImplementationType,
                                                           expectedVersion.getAsLong(),
                                                           aggregate.version());
            }
            log.debug("Loaded {} with id '{}' at version {}", aggregateImplementationType.getName(), aggregateId, aggregate.version());
            return Optional.of(unitOfWork.registerLifecycleCallbackForResource(aggregate, unitOfWorkCallback));
        }

        @Override
        public void persist(AGGREGATE_TYPE aggregate) {
            Objects.requireNonNull(aggregate, "You must supply an aggregate");
            log.debug("Adding {} with id '{}' to the current UnitOfWork so it will be persisted at commit time", aggregateImplementationType.getName(), aggregate.aggregateId());
            eventStore.getUnitOfWorkFactory()
                      .getRequiredUnitOfWork()
                      .registerLifecycleCallbackForResource(aggregate, unitOfWorkCallback);
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateImplementationType() {
            return aggregateImplementationType;
        }

        @Override
        public AggregateType aggregateType() {
            return aggregateType;
        }

        @Override
        public String toString() {
            return "AggregateRootRepository{" +
                    "aggregateType=" + aggregateType +
                    ", aggregateImplementationType=" + aggregateImplementationType.getName() +
                    '}';
        }

        /**
         * Appends the uncommitted changes of the aggregates associated with a {@link UnitOfWork} before it commits,
         * and clears them after the commit
         */
        private class AggregateRootRepositoryUnitOfWorkLifecycleCallback implements UnitOfWorkLifecycleCallback<AGGREGATE_TYPE> {
            @Override
            public void beforeCommit(UnitOfWork unitOfWork, List<AGGREGATE_TYPE> associatedResources) {
                log.trace("beforeCommit processing {} '{}' registered with the UnitOfWork being committed", associatedResources.size(), aggregateImplementationType.getName());
                associatedResources.forEach(aggregate -> {
                    var eventsToPersist = aggregate.uncommittedChanges();
                    if (eventsToPersist.isEmpty()) {
                        log.trace("No changes detected for '{}' with id '{}'", aggregateImplementationType.getName(), aggregate.aggregateId());
                        return;
                    }
                    log.debug("Persisting {} event(s) related to '{}' with id '{}' and expectedVersion {}",
                              eventsToPersist.size(),
                              aggregateImplementationType.getName(),
                              aggregate.aggregateId(),
                              aggregate.version());
                    eventStore.append(aggregateType,
                                      aggregate.aggregateId(),
                                      aggregate.version(),
                                      eventsToPersist)
                              .orElseThrow();
                });
            }

            @Override
            public void afterCommit(UnitOfWork unitOfWork, List<AGGREGATE_TYPE> associatedResources) {
                associatedResources.forEach(Aggregate::markChangesAsCommitted);
            }

            @Override
            public void beforeRollback(UnitOfWork unitOfWork, List<AGGREGATE_TYPE> associatedResources, Exception causeOfTheRollback) {
            }

            @Override
            public void afterRollback(UnitOfWork unitOfWork, List<AGGREGATE_TYPE> associatedResources, Exception causeOfTheRollback) {
                log.debug("Discarding {} '{}' since the UnitOfWork was rolled back", associatedResources.size(), aggregateImplementationType.getName());
                associatedResources.forEach(Aggregate::discard);
            }
        }
    }
}
