package dk.cloudcreate.eventcore.common.transaction;

/**
 * The status of a {@link UnitOfWork}:<br>
 * <code>Ready -> Started -> Committing -> Committed | RolledBack</code>
 */
public enum UnitOfWorkStatus {
    /**
     * The {@link UnitOfWork} has just been created, but not yet {@link #Started}
     */
    Ready(false),
    /**
     * The {@link UnitOfWork} has been started (i.e. the underlying transaction has begun)
     */
    Started(false),
    /**
     * {@link UnitOfWork#commit()} is running the before-commit callbacks and committing the underlying transaction
     */
    Committing(false),
    /**
     * The {@link UnitOfWork} has been committed
     */
    Committed(true),
    /**
     * The {@link UnitOfWork} has been rolled back
     */
    RolledBack(true),
    /**
     * The {@link UnitOfWork} is still active, but MUST be rolled back at the end of the transaction
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
