package dk.cloudcreate.eventledger.aggregates.snapshot;

import dk.cloudcreate.eventledger.aggregates.SnapshotAggregateRoot;

/**
 * Decides when a {@link SnapshotAggregateRoot} should store a new snapshot after committing events
 */
@FunctionalInterface
public interface SnapshotStrategy {
    boolean shouldCreateSnapshot(SnapshotAggregateRoot<?, ?, ?> aggregate);
}
