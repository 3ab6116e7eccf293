package dk.cloudcreate.eventledger.eventstore.snapshots;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * A snapshot of an aggregate's state together with its {@link SnapshotMetadata}
 *
 * @param <S> the snapshot type
 */
public final class SnapshotContainer<S> {
    private final S                snapshot;
    private final SnapshotMetadata metadata;

    public SnapshotContainer(S snapshot, SnapshotMetadata metadata) {
        this.snapshot = notNull(snapshot, "You must provide a snapshot");
        this.metadata = notNull(metadata, "You must provide metadata");
    }

    public S snapshot() {
        return snapshot;
    }

    public SnapshotMetadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "SnapshotContainer{" +
                "snapshot=" + snapshot.getClass().getSimpleName() +
                ", metadata=" + metadata +
                '}';
    }
}
