package dk.cloudcreate.eventledger.eventstore.snapshots;

import java.util.Objects;

import static org.apache.commons.lang3.Validate.*;

/**
 * Describes which aggregate a snapshot was taken of and at which aggregate sequence number
 */
public final class SnapshotMetadata {
    private final String aggregateId;
    private final String aggregateName;
    private final long   aggregateSequenceNumber;
    private final String snapshotName;
    private final int    snapshotVersion;

    public SnapshotMetadata(String aggregateId, String aggregateName, long aggregateSequenceNumber, String snapshotName, int snapshotVersion) {
        this.aggregateId = notBlank(aggregateId, "You must provide an aggregateId");
        this.aggregateName = notBlank(aggregateName, "You must provide an aggregateName");
        isTrue(aggregateSequenceNumber > 0, "aggregateSequenceNumber must be positive, was %d", aggregateSequenceNumber);
        this.aggregateSequenceNumber = aggregateSequenceNumber;
        this.snapshotName = notBlank(snapshotName, "You must provide a snapshotName");
        this.snapshotVersion = snapshotVersion;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateName() {
        return aggregateName;
    }

    /**
     * The sequence number of the last event included in the snapshot
     */
    public long aggregateSequenceNumber() {
        return aggregateSequenceNumber;
    }

    public String snapshotName() {
        return snapshotName;
    }

    public int snapshotVersion() {
        return snapshotVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SnapshotMetadata)) return false;
        var that = (SnapshotMetadata) o;
        return aggregateSequenceNumber == that.aggregateSequenceNumber &&
                snapshotVersion == that.snapshotVersion &&
                aggregateId.equals(that.aggregateId) &&
                aggregateName.equals(that.aggregateName) &&
                snapshotName.equals(that.snapshotName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, aggregateName, aggregateSequenceNumber, snapshotName, snapshotVersion);
    }

    @Override
    public String toString() {
        return "SnapshotMetadata{" +
                "aggregateId='" + aggregateId + '\'' +
                ", aggregateName='" + aggregateName + '\'' +
                ", aggregateSequenceNumber=" + aggregateSequenceNumber +
                ", snapshotName='" + snapshotName + '\'' +
                ", snapshotVersion=" + snapshotVersion +
                '}';
    }
}
