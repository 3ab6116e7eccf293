package dk.cloudcreate.eventledger.aggregates.snapshot;

import dk.cloudcreate.eventledger.aggregates.SnapshotAggregateRoot;

import static org.apache.commons.lang3.Validate.isTrue;

/**
 * Create a snapshot when the aggregate version is at least <code>snapshotAfterVersions</code> ahead of the version of the
 * last snapshot (or ahead of version 0 if the aggregate has no snapshot)
 */
public final class SnapshotEveryFewVersionsStrategy implements SnapshotStrategy {
    public static final int                              DEFAULT_SNAPSHOT_AFTER_VERSIONS = 100;
    public static final SnapshotEveryFewVersionsStrategy DEFAULT                         = with(DEFAULT_SNAPSHOT_AFTER_VERSIONS);

    private final int snapshotAfterVersions;

    private SnapshotEveryFewVersionsStrategy(int snapshotAfterVersions) {
        isTrue(snapshotAfterVersions > 0, "snapshotAfterVersions must be positive, was %d", snapshotAfterVersions);
        this.snapshotAfterVersions = snapshotAfterVersions;
    }

    public static SnapshotEveryFewVersionsStrategy with(int snapshotAfterVersions) {
        return new SnapshotEveryFewVersionsStrategy(snapshotAfterVersions);
    }

    @Override
    public boolean shouldCreateSnapshot(SnapshotAggregateRoot<?, ?, ?> aggregate) {
        return aggregate.version() - aggregate.snapshotVersion().orElse(0L) >= snapshotAfterVersions;
    }

    public int snapshotAfterVersions() {
        return snapshotAfterVersions;
    }

    @Override
    public String toString() {
        return "SnapshotEveryFewVersionsStrategy{" +
                "snapshotAfterVersions=" + snapshotAfterVersions +
                '}';
    }
}
