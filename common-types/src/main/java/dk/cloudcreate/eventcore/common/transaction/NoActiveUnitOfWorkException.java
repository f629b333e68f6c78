package dk.cloudcreate.eventcore.common.transaction;

public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork is associated with the current thread");
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
