package dk.cloudcreate.eventledger.eventstore.metadata;

import dk.cloudcreate.eventledger.common.types.SourceId;
import dk.cloudcreate.eventledger.eventstore.EventStoreException;
import dk.cloudcreate.eventledger.eventstore.types.*;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static dk.cloudcreate.eventledger.eventstore.metadata.MetadataKeys.*;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * Immutable string key/value metadata attached to an event.<br>
 * All the <code>with</code> methods return a new {@link Metadata} instance; on key collisions the last written value wins.
 * Entries keep their insertion order.
 */
public final class Metadata {
    private static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, String> entries;

    private Metadata(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Metadata empty() {
        return EMPTY;
    }

    public static Metadata of(Map<String, String> entries) {
        notNull(entries, "You must provide entries");
        entries.forEach((key, value) -> {
            notNull(key, "Metadata keys cannot be null");
            notNull(value, "Metadata value for key '%s' cannot be null", key);
        });
        return new Metadata(entries);
    }

    public static Metadata of(String key, String value) {
        return empty().with(key, value);
    }

    public Metadata with(String key, String value) {
        notNull(key, "You must provide a key");
        notNull(value, "You must provide a value for key '%s'", key);
        var copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new Metadata(copy);
    }

    public Metadata with(Map<String, String> additionalEntries) {
        notNull(additionalEntries, "You must provide additionalEntries");
        var copy = new LinkedHashMap<>(entries);
        additionalEntries.forEach((key, value) -> {
            notNull(key, "Metadata keys cannot be null");
            notNull(value, "Metadata value for key '%s' cannot be null", key);
            copy.put(key, value);
        });
        return new Metadata(copy);
    }

    public Metadata with(Metadata additionalMetadata) {
        notNull(additionalMetadata, "You must provide additionalMetadata");
        return with(additionalMetadata.entries);
    }

    public Metadata without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        var copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return new Metadata(copy);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public String eventName() {
        return getRequired(EVENT_NAME);
    }

    public int eventVersion() {
        return parse(EVENT_VERSION, Integer::parseInt);
    }

    public long aggregateSequenceNumber() {
        return parse(AGGREGATE_SEQUENCE_NUMBER, Long::parseLong);
    }

    public String aggregateId() {
        return getRequired(AGGREGATE_ID);
    }

    public String aggregateName() {
        return getRequired(AGGREGATE_NAME);
    }

    public String batchId() {
        return getRequired(BATCH_ID);
    }

    /**
     * The {@link SourceId} or {@link SourceId#NONE} if none was attached
     */
    public SourceId sourceId() {
        return get(SOURCE_ID).map(SourceId::of).orElse(SourceId.NONE);
    }

    public EventId eventId() {
        return EventId.of(getRequired(EVENT_ID));
    }

    public OffsetDateTime timestamp() {
        return parse(TIMESTAMP, OffsetDateTime::parse);
    }

    public Optional<GlobalPosition> globalPosition() {
        return get(GLOBAL_POSITION).map(GlobalPosition::of);
    }

    private String getRequired(String key) {
        var value = entries.get(key);
        if (value == null) {
            throw new EventStoreException(msg("Metadata doesn't contain the key '{}'", key));
        }
        return value;
    }

    private <T> T parse(String key, Parser<T> parser) {
        var value = getRequired(key);
        try {
            return parser.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new EventStoreException(msg("Metadata value '{}' for key '{}' is malformed", value, key), e);
        }
    }

    @FunctionalInterface
    private interface Parser<T> {
        T parse(String value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metadata)) return false;
        return entries.equals(((Metadata) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
