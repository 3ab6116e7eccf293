package dk.cloudcreate.eventledger.eventstore.snapshots;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import reactor.core.publisher.Mono;

/**
 * {@link SnapshotStore} that never has any snapshots and ignores stored snapshots
 */
public final class NoSnapshotStore implements SnapshotStore {
    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<SnapshotContainer<S>> loadSnapshot(Class<A> aggregateType, ID id, Class<S> snapshotType) {
        return Mono.empty();
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<Void> storeSnapshot(Class<A> aggregateType, ID id, SnapshotContainer<S> snapshotContainer) {
        return Mono.empty();
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<Void> deleteSnapshot(Class<A> aggregateType, ID id) {
        return Mono.empty();
    }
}
