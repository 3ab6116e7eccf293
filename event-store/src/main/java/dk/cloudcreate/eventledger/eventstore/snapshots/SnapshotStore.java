package dk.cloudcreate.eventledger.eventstore.snapshots;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import reactor.core.publisher.Mono;

/**
 * Stores the latest snapshot of an aggregate, which allows the aggregate to be hydrated from the snapshot plus the events
 * committed after it, instead of replaying all of its events
 */
public interface SnapshotStore {
    /**
     * Load the latest snapshot of the aggregate
     *
     * @return the snapshot or an empty {@link Mono} if the aggregate doesn't have a snapshot of the requested type
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<SnapshotContainer<S>> loadSnapshot(Class<A> aggregateType, ID id, Class<S> snapshotType);

    /**
     * Store the snapshot, replacing any snapshot with a lower aggregate sequence number
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<Void> storeSnapshot(Class<A> aggregateType, ID id, SnapshotContainer<S> snapshotContainer);

    /**
     * Delete the snapshot of the aggregate, if any
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<Void> deleteSnapshot(Class<A> aggregateType, ID id);
}
