package dk.cloudcreate.eventcore.bus.postgresql;

import dk.cloudcreate.eventcore.common.types.SubscriberId;
import dk.cloudcreate.eventcore.eventstore.postgresql.EventStore;
import dk.cloudcreate.eventcore.eventstore.postgresql.bus.TopicPattern;
import org.slf4j.*;

import java.util.stream.Collectors;

/**
 * Queues deliveries for events already in the {@link EventStore}, used when a new subscriber starts from the beginning
 * and when a subscriber is replayed
 */
final class EventHistoryQueuer {
    private static final Logger log = LoggerFactory.getLogger(EventHistoryQueuer.class);

    private final EventStore      eventStore;
    private final EventBusStorage storage;
    private final int             batchSize;

    EventHistoryQueuer(EventStore eventStore, EventBusStorage storage, int batchSize) {
        this.eventStore = eventStore;
        this.storage = storage;
        this.batchSize = batchSize;
    }

    /**
     * Queue the events matching <code>topicPattern</code> with a global sequence in the range <code>fromSequence</code>..<code>toSequence</code> (both inclusive)
     *
     * @return number of deliveries queued
     */
    int queue(SubscriberId subscriberId, TopicPattern topicPattern, long fromSequence, long toSequence) {
        var queued       = 0;
        var nextSequence = fromSequence;
        while (nextSequence <= toSequence) {
            var events = eventStore.readAll(nextSequence, batchSize).collect(Collectors.toList());
            if (events.isEmpty()) {
                break;
            }
            for (var event : events) {
                if (event.globalSequence() > toSequence) {
                    break;
                }
                if (topicPattern.matches(event) && storage.enqueue(subscriberId, event)) {
                    queued++;
                }
            }
            nextSequence = events.get(events.size() - 1).globalSequence() + 1;
        }
        log.debug("[{}] Queued {} historic event(s) in the range {}-{}", subscriberId, queued, fromSequence, toSequence);
        return queued;
    }
}
