package dk.cloudcreate.eventcore.eventstore.postgresql.eventstream;

import dk.cloudcreate.eventcore.common.types.StringValueType;

/**
 * Name of the category of aggregates an event stream belongs to, e.g. "Orders".<br>
 * Used for topic routing. It's only a name and not the Fully Qualified Class Name of an aggregate implementation class
 */
public final class AggregateType extends StringValueType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
