package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import java.util.*;

/**
 * Additional user controlled key/value metadata stored together with an event
 */
public final class EventMetaData extends HashMap<String, String> {
    public EventMetaData() {
    }

    public EventMetaData(Map<String, String> metaData) {
        super(Objects.requireNonNull(metaData, "No metaData provided"));
    }

    public static EventMetaData empty() {
        return new EventMetaData();
    }

    public static EventMetaData of(String key, String value) {
        var metaData = new EventMetaData();
        metaData.put(key, value);
        return metaData;
    }

    public static EventMetaData of(String key1, String value1, String key2, String value2) {
        var metaData = of(key1, value1);
        metaData.put(key2, value2);
        return metaData;
    }

    public EventMetaData with(String key, String value) {
        var copy = new EventMetaData(this);
        copy.put(key, value);
        return copy;
    }
}
