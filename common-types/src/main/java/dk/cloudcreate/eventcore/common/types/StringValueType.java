package dk.cloudcreate.eventcore.common.types;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for single value String based types (such as identifiers).<br>
 * Two instances are equal if they're of the same concrete type and have the same {@link #value()}
 *
 * @param <SELF> the concrete type
 */
public abstract class StringValueType<SELF extends StringValueType<SELF>> implements CharSequence, Comparable<SELF>, Serializable {
    private final String value;

    protected StringValueType(CharSequence value) {
        Objects.requireNonNull(value, "You must provide a value");
        this.value = value.toString();
    }

    public String value() {
        return value;
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }

    @Override
    public int compareTo(SELF other) {
        return value.compareTo(other.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((StringValueType<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return value;
    }
}
