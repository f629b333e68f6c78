package dk.cloudcreate.eventcore.common.functional;

/**
 * Variant of {@link java.util.function.Function} whose {@link #apply(Object)} may throw a checked {@link Exception}
 *
 * @param <T> the argument type
 * @param <R> the result type
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {
    R apply(T argument) throws Exception;
}
