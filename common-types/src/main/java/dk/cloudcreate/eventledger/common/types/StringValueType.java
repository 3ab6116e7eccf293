package dk.cloudcreate.eventledger.common.types;

import java.io.Serializable;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Base class for immutable single value types that wrap a {@link String}, such as {@link SourceId}.<br>
 * Two instances are equal when they have the same concrete type and the same {@link #value()}
 *
 * @param <SELF> the concrete value type
 */
public abstract class StringValueType<SELF extends StringValueType<SELF>> implements Serializable, Comparable<SELF> {
    private final String value;

    protected StringValueType(CharSequence value) {
        this.value = notNull(value, "You must provide a value").toString();
    }

    /**
     * The wrapped value
     */
    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public int compareTo(SELF o) {
        return value.compareTo(o.value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((StringValueType<?>) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
