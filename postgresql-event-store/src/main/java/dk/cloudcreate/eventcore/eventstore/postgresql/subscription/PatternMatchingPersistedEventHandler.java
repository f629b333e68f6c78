package dk.cloudcreate.eventcore.eventstore.postgresql.subscription;

import dk.cloudcreate.eventcore.common.reflection.AnnotatedMethodInvoker;
import dk.cloudcreate.eventcore.eventstore.postgresql.eventstream.PersistedEvent;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * {@link PersistedEventHandler} that routes each event to the {@link SubscriptionEventHandler} annotated method
 * whose first parameter type most specifically matches the deserialized event.<br>
 * The handler methods are resolved (and validated) when the handler is created.<br>
 * Events without a matching method are ignored, unless {@link #handleUnmatchedEvent(PersistedEvent)} is overridden
 */
public abstract class PatternMatchingPersistedEventHandler implements PersistedEventHandler {
    private final AnnotatedMethodInvoker invoker;

    protected PatternMatchingPersistedEventHandler() {
        invoker = new AnnotatedMethodInvoker(this.getClass(), SubscriptionEventHandler.class);
        invoker.candidateMethods().forEach(method -> {
            if (method.getParameterCount() == 2 && !PersistedEvent.class.equals(method.getParameterTypes()[1])) {
                throw new IllegalArgumentException(msg("The second parameter of @SubscriptionEventHandler method '{}' in '{}' must be of type {}",
                                                       method.getName(),
                                                       this.getClass().getName(),
                                                       PersistedEvent.class.getSimpleName()));
            }
        });
    }

    @Override
    public void handle(PersistedEvent event) {
        Object deserializedEvent = event.event().deserialize();
        if (!invoker.invoke(this, deserializedEvent, event)) {
            handleUnmatchedEvent(event);
        }
    }

    /**
     * Called for events without a matching {@link SubscriptionEventHandler} method. Default is to ignore the event
     *
     * @param event the unmatched event
     */
    protected void handleUnmatchedEvent(PersistedEvent event) {
    }
}
