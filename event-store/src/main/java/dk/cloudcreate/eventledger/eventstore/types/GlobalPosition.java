package dk.cloudcreate.eventledger.eventstore.types;

import dk.cloudcreate.eventledger.common.types.StringValueType;
import dk.cloudcreate.eventledger.eventstore.persistence.EventPersistence;

/**
 * Opaque cursor into the global order in which events were committed across all aggregates.<br>
 * Only the {@link EventPersistence} that produced a {@link GlobalPosition} knows how to interpret it,
 * callers should just pass the <code>nextGlobalPosition</code> of one page into the request for the next page.
 */
public final class GlobalPosition extends StringValueType<GlobalPosition> {
    /**
     * The position before the first event in the store
     */
    public static final GlobalPosition START = new GlobalPosition("");

    private GlobalPosition(CharSequence value) {
        super(value);
    }

    public static GlobalPosition of(CharSequence value) {
        return new GlobalPosition(value);
    }

    public static GlobalPosition of(long value) {
        return new GlobalPosition(Long.toString(value));
    }

    public boolean isStart() {
        return value().isBlank();
    }
}
