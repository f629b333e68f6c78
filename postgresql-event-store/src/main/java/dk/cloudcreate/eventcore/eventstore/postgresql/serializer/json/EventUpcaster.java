package dk.cloudcreate.eventcore.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dk.cloudcreate.eventcore.eventstore.postgresql.types.*;

/**
 * Upgrades the JSON of one {@link EventType} from {@link #fromRevision()} to the next revision.<br>
 * Upcasters are chained, so an event persisted with revision 1 and read by code at revision 3
 * passes through the 1 to 2 and the 2 to 3 upcasters
 *
 * @see JacksonJSONSerializer#addEventUpcaster(EventUpcaster)
 * @see Revision
 */
public interface EventUpcaster {
    EventType eventType();

    EventRevision fromRevision();

    /**
     * @param eventJson the event JSON in the shape of {@link #fromRevision()}
     * @return the event JSON in the shape of the next revision (may be the same, modified, instance)
     */
    ObjectNode upcast(ObjectNode eventJson);
}
