package dk.cloudcreate.eventcore.common.result;

/**
 * Implemented by exceptions that know which {@link FailureKind} they represent
 */
public interface FailureKindAware {
    FailureKind failureKind();
}
