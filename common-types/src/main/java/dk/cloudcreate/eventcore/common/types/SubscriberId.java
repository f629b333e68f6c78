package dk.cloudcreate.eventcore.common.types;

import java.util.*;

/**
 * Identifies an Event Bus subscriber. The id is also the key of the subscriber's checkpoint
 */
public final class SubscriberId extends StringValueType<SubscriberId> {
    public SubscriberId(CharSequence value) {
        super(value);
    }

    public static SubscriberId of(CharSequence value) {
        return new SubscriberId(value);
    }

    public static Optional<SubscriberId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(SubscriberId::new);
    }

    public static SubscriberId random() {
        return new SubscriberId(UUID.randomUUID().toString());
    }
}
