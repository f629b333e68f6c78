package dk.cloudcreate.eventcore.aggregates;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;
import java.util.concurrent.*;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Factory that helps the {@link AggregateRootRepository} to create an instance of a given {@link Aggregate} before it's rehydrated.
 *
 * @see #defaultConstructorFactory()
 * @see #objenesisAggregateRootFactory()
 */
public interface AggregateRootInstanceFactory {
    /**
     * Calls the no-arguments constructor (which may be private) on the concrete {@link Aggregate} type
     */
    DefaultConstructorAggregateRootInstanceFactory DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY = new DefaultConstructorAggregateRootInstanceFactory();
    /**
     * Uses {@link Objenesis} to create a new instance of the {@link Aggregate}<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so you {@link Aggregate} design needs to take
     * this into consideration.<br>
     * All concrete aggregates that extends {@link AggregateRoot} have been prepared to be initialized by {@link Objenesis}
     */
    ObjenesisAggregateRootInstanceFactory          OBJENESIS_AGGREGATE_ROOT_FACTORY           = new ObjenesisAggregateRootInstanceFactory();

    <ID, AGGREGATE extends Aggregate<ID, AGGREGATE>> AGGREGATE create(ID aggregateId, Class<AGGREGATE> aggregateType);

    static AggregateRootInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_AGGREGATE_ROOT_FACTORY;
    }

    static AggregateRootInstanceFactory objenesisAggregateRootFactory() {
        return OBJENESIS_AGGREGATE_ROOT_FACTORY;
    }

    class DefaultConstructorAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        @Override
        public <ID, AGGREGATE extends Aggregate<ID, AGGREGATE>> AGGREGATE create(ID aggregateId, Class<AGGREGATE> aggregateType) {
            Objects.requireNonNull(aggregateType, "You must provide an aggregateType");
            try {
                var constructor = aggregateType.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor.newInstance();
            } catch (NoSuchMethodException e) {
                throw new AggregateException(msg("'{}' doesn't have a no-arguments constructor. Use the Objenesis AggregateRootInstanceFactory instead",
                                                 aggregateType.getName()), e);
            } catch (InvocationTargetException e) {
                throw new AggregateException(msg("The no-arguments constructor of '{}' failed", aggregateType.getName()), e.getCause());
            } catch (InstantiationException | IllegalAccessException e) {
                throw new AggregateException(msg("Failed to create an instance of '{}'", aggregateType.getName()), e);
            }
        }
    }

    class ObjenesisAggregateRootInstanceFactory implements AggregateRootInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <ID, AGGREGATE extends Aggregate<ID, AGGREGATE>> AGGREGATE create(ID aggregateId, Class<AGGREGATE> aggregateType) {
            Objects.requireNonNull(aggregateType, "You must provide an aggregateType");
            return (AGGREGATE) instantiatorMap.computeIfAbsent(aggregateType,
                                                               objenesis::getInstantiatorOf)
                                              .newInstance();
        }
    }
}
