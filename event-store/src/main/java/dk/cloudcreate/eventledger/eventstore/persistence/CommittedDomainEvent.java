package dk.cloudcreate.eventledger.eventstore.persistence;

import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;

import java.util.Objects;

import static org.apache.commons.lang3.Validate.*;

/**
 * An event as it was committed by an {@link EventPersistence}: payload and metadata are still serialized
 */
public final class CommittedDomainEvent {
    private final String         aggregateId;
    private final long           aggregateSequenceNumber;
    private final GlobalPosition globalPosition;
    private final String         data;
    private final String         metadata;

    public CommittedDomainEvent(String aggregateId, long aggregateSequenceNumber, GlobalPosition globalPosition, String data, String metadata) {
        this.aggregateId = notBlank(aggregateId, "You must provide an aggregateId");
        isTrue(aggregateSequenceNumber > 0, "aggregateSequenceNumber must be positive, was %d", aggregateSequenceNumber);
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.globalPosition = notNull(globalPosition, "You must provide a globalPosition");
        this.data = notNull(data, "You must provide data");
        this.metadata = notNull(metadata, "You must provide metadata");
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long aggregateSequenceNumber() {
        return aggregateSequenceNumber;
    }

    public GlobalPosition globalPosition() {
        return globalPosition;
    }

    /**
     * The serialized event payload
     */
    public String data() {
        return data;
    }

    /**
     * The serialized event metadata
     */
    public String metadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommittedDomainEvent)) return false;
        var that = (CommittedDomainEvent) o;
        return aggregateSequenceNumber == that.aggregateSequenceNumber &&
                aggregateId.equals(that.aggregateId) &&
                globalPosition.equals(that.globalPosition) &&
                data.equals(that.data) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, aggregateSequenceNumber);
    }

    @Override
    public String toString() {
        return "CommittedDomainEvent{" +
                "aggregateId='" + aggregateId + '\'' +
                ", aggregateSequenceNumber=" + aggregateSequenceNumber +
                ", globalPosition=" + globalPosition +
                '}';
    }
}
