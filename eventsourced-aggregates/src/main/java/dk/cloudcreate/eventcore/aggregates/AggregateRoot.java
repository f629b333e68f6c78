package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.common.reflection.AnnotatedMethodInvoker;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * A mutable {@link Aggregate} design where new events are applied using {@link #apply(Object)}, which stages the event
 * as an uncommitted change and calls the (private) {@link EventHandler} annotated method that most specifically matches the event type.<br>
 * The same {@link EventHandler} methods are called when the aggregate is rebuilt from its history using {@link #rehydrate(Object, Stream)}.
 * <p>
 * Each instance resolves and validates its {@link EventHandler} methods when it's constructed, or on the first event it applies
 * if it was created without calling a constructor.
 * <p>
 * Instances may be created by Objenesis (which doesn't call any constructor or initialize any fields), so all
 * internal fields are initialized lazily.
 * <p>
 * Note: <strong>The {@link AggregateRoot} works best in combination with the {@link AggregateRootRepository}</strong>
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT_TYPE>     the base type of the events this aggregate applies
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<ID, EVENT_TYPE, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT_TYPE, AGGREGATE_TYPE>> implements Aggregate<ID, AGGREGATE_TYPE> {
    private transient AnnotatedMethodInvoker invoker;

    private ID               aggregateId;
    private List<EVENT_TYPE> uncommittedChanges;
    private long             version;
    private boolean          hasBeenRehydrated;
    private boolean          isRehydrating;
    private boolean          discarded;

    /**
     * Used for rehydration, where the aggregate id is supplied by {@link #rehydrate(Object, Stream)}
     */
    protected AggregateRoot() {
        invoker();
    }

    protected AggregateRoot(ID aggregateId) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "You must provide an aggregateId");
        invoker();
    }

    private AnnotatedMethodInvoker invoker() {
        if (invoker == null) {
            var aggregateType   = this.getClass();
            var resolvedInvoker = new AnnotatedMethodInvoker(aggregateType, EventHandler.class);
            resolvedInvoker.candidateMethods().forEach(method -> {
                if (method.getParameterCount() != 1) {
                    throw new AggregateException(msg("@EventHandler method '{}' in '{}' must have exactly one parameter",
                                                     method.getName(),
                                                     aggregateType.getName()));
                }
            });
            invoker = resolvedInvoker;
        }
        return invoker;
    }

    @SuppressWarnings("unchecked")
    @Override
    public AGGREGATE_TYPE rehydrate(ID aggregateId, Stream<PersistedEvent> persistedEvents) {
        Objects.requireNonNull(aggregateId, "You must provide an aggregateId");
        Objects.requireNonNull(persistedEvents, "You must provide a persistedEvents stream");
        requireSameAggregateId(aggregateId);
        this.aggregateId = aggregateId;
        isRehydrating = true;
        try {
            persistedEvents.forEach(persistedEvent -> {
                if (persistedEvent.aggregateVersion() != version + 1) {
                    throw new AggregateException(msg("Can't rehydrate '{}' with id '{}': expected an event with version {} but got version {}",
                                                     this.getClass().getName(),
                                                     aggregateId,
                                                     version + 1,
                                                     persistedEvent.aggregateVersion()));
                }
                applyEventToTheAggregate((EVENT_TYPE) persistedEvent.event().deserialize());
                version = persistedEvent.aggregateVersion();
            });
        } finally {
            isRehydrating = false;
        }
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Rebuild the aggregate from events that aren't wrapped in {@link PersistedEvent}'s, e.g. in tests.
     * Each event advances the {@link #version()} by one
     *
     * @param aggregateId    the id of the aggregate
     * @param previousEvents the previous events related to this aggregate instance in the order they were applied
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE rehydrateFromEvents(ID aggregateId, Stream<? extends EVENT_TYPE> previousEvents) {
        Objects.requireNonNull(aggregateId, "You must provide an aggregateId");
        Objects.requireNonNull(previousEvents, "You must provide a previousEvents stream");
        requireSameAggregateId(aggregateId);
        this.aggregateId = aggregateId;
        isRehydrating = true;
        try {
            previousEvents.forEach(event -> {
                applyEventToTheAggregate(event);
                version++;
            });
        } finally {
            isRehydrating = false;
        }
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Apply a new non persisted/uncommitted event to this aggregate instance
     *
     * @param event the event to apply
     * @throws AggregateException if the aggregate doesn't have an id yet or has been {@link #discard() discarded}
     */
    protected void apply(EVENT_TYPE event) {
        Objects.requireNonNull(event, "You must supply an event");
        if (discarded) {
            throw new AggregateException(msg("Can't apply '{}' to '{}' with id '{}' since the aggregate was discarded after a rollback. Load the aggregate again",
                                             event.getClass().getName(),
                                             this.getClass().getName(),
                                             aggregateId));
        }
        if (aggregateId == null) {
            throw new AggregateException(msg("Can't apply '{}' to '{}' since the aggregate id hasn't been set",
                                             event.getClass().getName(),
                                             this.getClass().getName()));
        }
        applyEventToTheAggregate(event);
        _uncommittedChanges().add(event);
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate<br>
     * The default implementation calls the most specific (private) method annotated with {@link EventHandler}.
     * Events without a matching method are ignored, since aggregates don't need to handle every event
     *
     * @param event the event to apply to the aggregate
     * @see #isRehydrating()
     */
    protected void applyEventToTheAggregate(EVENT_TYPE event) {
        invoker().invoke(this, event, null);
    }

    private void requireSameAggregateId(ID aggregateId) {
        if (this.aggregateId != null && !this.aggregateId.equals(aggregateId)) {
            throw new AggregateException(msg("Can't rehydrate '{}' with id '{}' using the history of aggregate '{}'",
                                             this.getClass().getName(),
                                             this.aggregateId,
                                             aggregateId));
        }
    }

    @Override
    public ID aggregateId() {
        if (aggregateId == null) {
            throw new AggregateException(msg("The aggregate id of '{}' hasn't been set", this.getClass().getName()));
        }
        return aggregateId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Is the event being supplied to {@link #applyEventToTheAggregate(Object)} a historic event
     */
    protected final boolean isRehydrating() {
        return isRehydrating;
    }

    @Override
    public List<EVENT_TYPE> uncommittedChanges() {
        return Collections.unmodifiableList(_uncommittedChanges());
    }

    @Override
    public void markChangesAsCommitted() {
        version += _uncommittedChanges().size();
        uncommittedChanges = new ArrayList<>();
    }

    @Override
    public void discard() {
        discarded = true;
        uncommittedChanges = new ArrayList<>();
    }

    @Override
    public boolean isDiscarded() {
        return discarded;
    }

    private List<EVENT_TYPE> _uncommittedChanges() {
        if (uncommittedChanges == null) {
            uncommittedChanges = new ArrayList<>();
        }
        return uncommittedChanges;
    }
}
