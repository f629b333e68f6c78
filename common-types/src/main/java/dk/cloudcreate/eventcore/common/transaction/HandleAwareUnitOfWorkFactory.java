package dk.cloudcreate.eventcore.common.transaction;

/**
 * {@link UnitOfWorkFactory} whose units of work expose their Jdbi handle
 *
 * @param <UOW> the concrete unit of work type
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
}
