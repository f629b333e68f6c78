package dk.cloudcreate.eventcore.common.transaction;

import dk.cloudcreate.eventcore.common.functional.*;
import dk.cloudcreate.eventcore.common.result.*;
import org.slf4j.*;

import java.util.*;

/**
 * This interface creates a {@link UnitOfWork}
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create (and start) a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    /**
     * Get the {@link UnitOfWork} associated with the calling thread, if any
     */
    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run <code>unitOfWorkConsumer</code> inside the current {@link UnitOfWork} or, if there isn't one, inside a new {@link UnitOfWork}
     * that is committed afterwards.
     *
     * @param unitOfWorkConsumer the work
     * @throws UnitOfWorkException if the work or the commit failed
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        Objects.requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run <code>unitOfWorkFunction</code> inside the current {@link UnitOfWork} or, if there isn't one, inside a new {@link UnitOfWork}
     * that is committed afterwards.
     *
     * @param unitOfWorkFunction the work
     * @param <R>                the result type
     * @return the value returned by <code>unitOfWorkFunction</code>
     * @throws UnitOfWorkException if the work or the commit failed
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        Objects.requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.debug("Creating a new UnitOfWork for this withUnitOfWork(CheckedFunction) method call as there wasn't an existing UnitOfWork");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.debug("NestedUnitOfWork: Reusing existing UnitOfWork for this withUnitOfWork(CheckedFunction) method call"));
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Committing the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.commit().orElseThrow();
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Won't commit the UnitOfWork as it wasn't created by this withUnitOfWork(CheckedFunction) method call");
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking UnitOfWork as rollback only as it wasn't created by this withUnitOfWork(CheckedFunction) method call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof UnitOfWorkException) {
                throw (UnitOfWorkException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }

    /**
     * Variant of {@link #withUnitOfWork(CheckedFunction)} that reports failures as a {@link Result} instead of throwing,
     * so a caller can tell a {@link FailureKind#CONCURRENCY_CONFLICT} (reload and retry) apart from a {@link FailureKind#STORAGE_ERROR}.<br>
     * A failure inside a nested {@link UnitOfWork} marks the outer {@link UnitOfWork} as rollback only.
     *
     * @param unitOfWorkFunction the work
     * @param <R>                the result type
     * @return the result of the work and the commit
     */
    default <R> Result<R> inUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        Objects.requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork         = existingUnitOfWork.orElseGet(this::getOrCreateNewUnitOfWork);
        R   value;
        try {
            value = unitOfWorkFunction.apply(unitOfWork);
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWork.rollback(e);
            } else {
                unitOfWork.markAsRollbackOnly(e);
            }
            var failure = Failure.from(e);
            unitOfWorkLog.debug("inUnitOfWork failed with {}", failure);
            return Result.failure(failure);
        }
        if (existingUnitOfWork.isPresent()) {
            return Result.success(value);
        }
        return unitOfWork.commit().map(ignore -> value);
    }
}
