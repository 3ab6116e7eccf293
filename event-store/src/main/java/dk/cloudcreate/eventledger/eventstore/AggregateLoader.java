package dk.cloudcreate.eventledger.eventstore;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.snapshots.SnapshotStore;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Loads aggregates: creates a new instance through the {@link AggregateFactory} and lets the aggregate hydrate itself
 * from the {@link EventStore} (and {@link SnapshotStore}).<br>
 * An aggregate without any events is returned as a new aggregate, see {@link Aggregate#isNew()}.
 */
public final class AggregateLoader {
    private static final Logger log = LoggerFactory.getLogger(AggregateLoader.class);

    private final AggregateFactory aggregateFactory;
    private final EventStore       eventStore;
    private final SnapshotStore    snapshotStore;

    public AggregateLoader(AggregateFactory aggregateFactory, EventStore eventStore, SnapshotStore snapshotStore) {
        this.aggregateFactory = notNull(aggregateFactory, "You must provide an aggregateFactory");
        this.eventStore = notNull(eventStore, "You must provide an eventStore");
        this.snapshotStore = notNull(snapshotStore, "You must provide a snapshotStore");
    }

    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<A> loadAggregate(Class<A> aggregateType, ID id) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an aggregate id");
        return Mono.defer(() -> {
            var aggregate = aggregateFactory.createNewAggregate(aggregateType, id);
            return aggregate.load(eventStore, snapshotStore)
                            .then(Mono.fromCallable(() -> {
                                log.trace("Loaded aggregate '{}' with id '{}' at version {}", aggregateType.getSimpleName(), id, aggregate.version());
                                return aggregate;
                            }));
        });
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }
}
