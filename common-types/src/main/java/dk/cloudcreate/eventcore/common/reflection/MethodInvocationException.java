package dk.cloudcreate.eventcore.common.reflection;

public class MethodInvocationException extends RuntimeException {
    public MethodInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
