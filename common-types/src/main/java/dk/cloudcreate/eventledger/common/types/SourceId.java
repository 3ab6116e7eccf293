package dk.cloudcreate.eventledger.common.types;

import java.util.UUID;

/**
 * Identifies the logical command/request that produced a batch of events.<br>
 * The source id is attached to every event stored in the same batch, which allows an event persistence implementation to
 * detect that the same command is being replayed.
 */
public final class SourceId extends StringValueType<SourceId> {
    /**
     * Special value that represents a missing source id
     */
    public static final SourceId NONE = new SourceId("");

    private SourceId(CharSequence value) {
        super(value);
    }

    public static SourceId of(CharSequence value) {
        return new SourceId(value);
    }

    public static SourceId newRandom() {
        return new SourceId(UUID.randomUUID().toString());
    }

    /**
     * Is this the {@link #NONE} source id, or a blank value
     */
    public boolean isNone() {
        return value().isBlank();
    }
}
