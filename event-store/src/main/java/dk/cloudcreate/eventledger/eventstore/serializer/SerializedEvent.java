package dk.cloudcreate.eventledger.eventstore.serializer;

import dk.cloudcreate.eventledger.eventstore.metadata.Metadata;

import static org.apache.commons.lang3.Validate.*;

/**
 * An event payload and its metadata serialized to JSON, ready to be committed by an event persistence.<br>
 * {@link #aggregateSequenceNumber()} is the sequence number the event must be committed under.
 */
public final class SerializedEvent {
    private final String   serializedData;
    private final String   serializedMetadata;
    private final long     aggregateSequenceNumber;
    private final Metadata metadata;

    public SerializedEvent(String serializedData, String serializedMetadata, long aggregateSequenceNumber, Metadata metadata) {
        this.serializedData = notNull(serializedData, "You must provide serializedData");
        this.serializedMetadata = notNull(serializedMetadata, "You must provide serializedMetadata");
        isTrue(aggregateSequenceNumber > 0, "aggregateSequenceNumber must be positive, was %d", aggregateSequenceNumber);
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.metadata = notNull(metadata, "You must provide metadata");
    }

    public String serializedData() {
        return serializedData;
    }

    public String serializedMetadata() {
        return serializedMetadata;
    }

    public long aggregateSequenceNumber() {
        return aggregateSequenceNumber;
    }

    public Metadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "SerializedEvent{" +
                "aggregateSequenceNumber=" + aggregateSequenceNumber +
                ", metadata=" + metadata +
                '}';
    }
}
