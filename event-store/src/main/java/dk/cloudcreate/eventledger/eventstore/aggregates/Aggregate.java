package dk.cloudcreate.eventledger.eventstore.aggregates;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.EventStore;
import dk.cloudcreate.eventledger.eventstore.snapshots.SnapshotStore;
import reactor.core.publisher.Mono;

/**
 * An event sourced aggregate: a consistency boundary whose state is derived from the ordered events stored for its identity.<br>
 * The aggregate itself decides how it is hydrated (full replay or snapshot + tail), see {@link #load(EventStore, SnapshotStore)}
 *
 * @param <A>  the concrete aggregate type
 * @param <ID> the aggregate identity type
 */
public interface Aggregate<A extends Aggregate<A, ID>, ID extends Identity<ID>> {
    /**
     * The identity of this aggregate instance
     */
    ID aggregateId();

    /**
     * The name of the aggregate type, see {@link AggregateNames}
     */
    default String name() {
        return AggregateNames.nameOf(getClass());
    }

    /**
     * The aggregate sequence number of the last event applied to this aggregate (0 when no events have been applied)
     */
    long version();

    /**
     * Has this aggregate had any events applied
     */
    default boolean isNew() {
        return version() == 0;
    }

    /**
     * Hydrate this aggregate from the event store (and snapshot store if the aggregate supports snapshots)
     *
     * @param eventStore    the event store
     * @param snapshotStore the snapshot store
     * @return a {@link Mono} that completes when the aggregate has been hydrated
     */
    Mono<Void> load(EventStore eventStore, SnapshotStore snapshotStore);
}
