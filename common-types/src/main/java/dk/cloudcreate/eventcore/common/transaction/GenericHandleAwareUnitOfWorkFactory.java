package dk.cloudcreate.eventcore.common.transaction;

import dk.cloudcreate.eventcore.common.result.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.statement.SqlStatements;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Generic {@link HandleAwareUnitOfWorkFactory} that manages a Jdbi {@link Handle} backed transaction per thread.<br>
 * Subclasses decide which concrete {@link HandleAwareUnitOfWork} type is created through {@link #createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory)}
 *
 * @param <UOW> the concrete {@link HandleAwareUnitOfWork} type
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi                 jdbi;
    private final Optional<Duration>   queryTimeout;
    private final ThreadLocal<UOW>     unitOfWorks = new ThreadLocal<>();

    public GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this(jdbi, null);
    }

    /**
     * @param jdbi         the jdbi instance
     * @param queryTimeout optional timeout applied to every statement executed through a {@link UnitOfWork} handle.
     *                     A statement exceeding it fails and the {@link UnitOfWork} is rolled back
     */
    public GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi, Duration queryTimeout) {
        this.jdbi = Objects.requireNonNull(jdbi, "No jdbi instance provided");
        this.queryTimeout = Optional.ofNullable(queryTimeout);
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    protected void removeUnitOfWork(UnitOfWork unitOfWork) {
        if (unitOfWorks.get() == unitOfWork) {
            unitOfWorks.remove();
        }
    }

    private Handle openHandle() {
        var handle = jdbi.open();
        queryTimeout.ifPresent(timeout -> handle.getConfig(SqlStatements.class)
                                                .setQueryTimeout((int) Math.max(1, timeout.toSeconds())));
        return handle;
    }

    /**
     * {@link HandleAwareUnitOfWork} backed by one Jdbi {@link Handle} and its transaction.
     * Subclasses can hook into the commit/rollback flow through {@link #beforeCommitting()}, {@link #afterCommitting()} and {@link #afterRollback(Exception)}
     */
    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWork.class);

        private final GenericHandleAwareUnitOfWorkFactory<?>                   unitOfWorkFactory;
        private final Map<UnitOfWorkLifecycleCallback<Object>, List<Object>> resourcesPerCallback = new LinkedHashMap<>();
        private       Handle                                                  handle;
        private       UnitOfWorkStatus                                        status;
        private       Exception                                               causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = unitOfWorkFactory.openHandle();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.trace("UnitOfWork was already started");
            } else {
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
        }

        @Override
        public Result<Void> commit() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted() || status == UnitOfWorkStatus.Committing) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                return rollbackInsteadOfCommit();
            }

            log.trace("Committing UnitOfWork");
            status = UnitOfWorkStatus.Committing;
            try {
                for (var entry : new ArrayList<>(resourcesPerCallback.entrySet())) {
                    entry.getKey().beforeCommit(this, entry.getValue());
                }
                beforeCommitting();
                if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                    return rollbackInsteadOfCommit();
                }
                handle.commit();
            } catch (Exception e) {
                log.debug(msg("Failed to commit UnitOfWork. Rolling back: {}", e.getMessage()), e);
                rollback(e);
                return Result.failure(Failure.from(e));
            }
            status = UnitOfWorkStatus.Committed;
            closeHandle();

            for (var entry : resourcesPerCallback.entrySet()) {
                try {
                    entry.getKey().afterCommit(this, entry.getValue());
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit", entry.getKey().getClass().getName()), e);
                }
            }
            afterCommitting();
            return Result.ok();
        }

        private Result<Void> rollbackInsteadOfCommit() {
            var cause = causeOfRollback != null ? causeOfRollback : new UnitOfWorkException("UnitOfWork was marked as rollback only");
            log.debug("UnitOfWork was marked as rollback only, so it will be rolled back instead of committed");
            rollback(cause);
            return Result.failure(Failure.from(cause));
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted()) {
                log.trace("Ignoring rollback of UnitOfWork with status {}", status);
                return;
            }
            if (cause != null) {
                causeOfRollback = cause;
            }
            if (status == UnitOfWorkStatus.Ready) {
                status = UnitOfWorkStatus.RolledBack;
                return;
            }
            log.trace("Rolling back UnitOfWork");
            for (var entry : resourcesPerCallback.entrySet()) {
                try {
                    entry.getKey().beforeRollback(this, entry.getValue(), causeOfRollback);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during beforeRollback", entry.getKey().getClass().getName()), e);
                }
            }
            try {
                handle.rollback();
            } catch (RuntimeException e) {
                log.error("Failed to rollback the underlying transaction", e);
            } finally {
                status = UnitOfWorkStatus.RolledBack;
                closeHandle();
            }
            for (var entry : resourcesPerCallback.entrySet()) {
                try {
                    entry.getKey().afterRollback(this, entry.getValue(), causeOfRollback);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterRollback", entry.getKey().getClass().getName()), e);
                }
            }
            afterRollback(causeOfRollback);
        }

        private void closeHandle() {
            try {
                handle.close();
            } catch (RuntimeException e) {
                log.error("Failed to close the UnitOfWork handle", e);
            } finally {
                unitOfWorkFactory.removeUnitOfWork(this);
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isCompleted()) {
                throw new UnitOfWorkException(msg("Cannot mark a UnitOfWork with status {} as rollback only", status));
            }
            if (cause != null) {
                causeOfRollback = cause;
            }
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("The UnitOfWork isn't active (status {})", status));
            }
            return handle;
        }

        @SuppressWarnings("unchecked")
        @Override
        public <T> T registerLifecycleCallbackForResource(T resource, UnitOfWorkLifecycleCallback<T> associatedUnitOfWorkCallback) {
            Objects.requireNonNull(resource, "No resource provided");
            Objects.requireNonNull(associatedUnitOfWorkCallback, "No associatedUnitOfWorkCallback provided");
            var resources = resourcesPerCallback.computeIfAbsent((UnitOfWorkLifecycleCallback<Object>) associatedUnitOfWorkCallback, callback -> new ArrayList<>());
            if (resources.stream().noneMatch(existing -> existing == resource)) {
                resources.add(resource);
            }
            return resource;
        }

        protected void beforeCommitting() {
        }

        protected void afterCommitting() {
        }

        protected void afterRollback(Exception cause) {
        }
    }
}
