package dk.cloudcreate.eventcore.common.types;

import java.util.*;

/**
 * Correlation id shared by all events that belong to the same logical flow (e.g. one command and everything it causes)
 */
public final class CorrelationId extends StringValueType<CorrelationId> {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static Optional<CorrelationId> optionalFrom(CharSequence value) {
        return Optional.ofNullable(value).map(CorrelationId::new);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }
}
