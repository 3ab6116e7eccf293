package dk.cloudcreate.eventledger.eventstore.types;

import dk.cloudcreate.eventledger.common.types.StringValueType;

import java.util.UUID;

/**
 * Unique id of a single event
 */
public final class EventId extends StringValueType<EventId> {
    private EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }
}
