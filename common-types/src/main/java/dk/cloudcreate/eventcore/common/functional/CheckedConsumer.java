package dk.cloudcreate.eventcore.common.functional;

/**
 * Variant of {@link java.util.function.Consumer} whose {@link #accept(Object)} may throw a checked {@link Exception}
 *
 * @param <T> the argument type
 */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T argument) throws Exception;
}
