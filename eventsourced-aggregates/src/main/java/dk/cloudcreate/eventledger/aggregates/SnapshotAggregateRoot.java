package dk.cloudcreate.eventledger.aggregates;

import dk.cloudcreate.eventledger.aggregates.snapshot.*;
import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.EventStore;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import dk.cloudcreate.eventledger.eventstore.snapshots.*;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * An {@link AggregateRoot} that can be hydrated from a snapshot of its state plus the events committed after the snapshot.<br>
 * After each commit the {@link #snapshotStrategy()} decides whether a new snapshot is stored.
 *
 * @param <A>  the concrete aggregate type
 * @param <ID> the aggregate identity type
 * @param <S>  the snapshot type
 */
public abstract class SnapshotAggregateRoot<A extends SnapshotAggregateRoot<A, ID, S>, ID extends Identity<ID>, S> extends AggregateRoot<A, ID> {
    private static final Logger log = LoggerFactory.getLogger(SnapshotAggregateRoot.class);

    private Long snapshotVersion;

    protected SnapshotAggregateRoot(ID aggregateId) {
        super(aggregateId);
    }

    protected abstract Class<S> snapshotType();

    /**
     * Create a snapshot of the current aggregate state
     */
    protected abstract S createSnapshot();

    /**
     * Restore the aggregate state from the snapshot
     */
    protected abstract void restoreFromSnapshot(S snapshot);

    protected SnapshotStrategy snapshotStrategy() {
        return SnapshotEveryFewVersionsStrategy.DEFAULT;
    }

    /**
     * The version of the snapshot type, stored in the {@link SnapshotMetadata}
     */
    protected int snapshotTypeVersion() {
        return 1;
    }

    /**
     * The aggregate version at which the snapshot this aggregate was loaded from, or last stored, was taken
     */
    public Optional<Long> snapshotVersion() {
        return Optional.ofNullable(snapshotVersion);
    }

    @Override
    public Mono<Void> load(EventStore eventStore, SnapshotStore snapshotStore) {
        notNull(eventStore, "You must provide an eventStore");
        notNull(snapshotStore, "You must provide a snapshotStore");
        return snapshotStore.loadSnapshot(aggregateType(), aggregateId(), snapshotType())
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .flatMap(snapshotContainer -> {
                                if (snapshotContainer.isEmpty()) {
                                    return super.load(eventStore, snapshotStore);
                                }
                                var snapshotSequenceNumber = snapshotContainer.get().metadata().aggregateSequenceNumber();
                                restoreFromSnapshot(snapshotContainer.get().snapshot());
                                restoreVersion(snapshotSequenceNumber);
                                snapshotVersion = snapshotSequenceNumber;
                                log.trace("Restored aggregate '{}' from snapshot at version {}", aggregateId(), snapshotSequenceNumber);
                                return eventStore.loadEvents(aggregateType(), aggregateId(), snapshotSequenceNumber + 1)
                                                 .doOnNext(this::applyEvents)
                                                 .then();
                            });
    }

    @Override
    protected Mono<Void> afterCommit(SnapshotStore snapshotStore, List<DomainEvent<A, ID, ?>> committedEvents) {
        if (!snapshotStrategy().shouldCreateSnapshot(this)) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            var snapshot = createSnapshot();
            var metadata = new SnapshotMetadata(aggregateId().value(),
                                                name(),
                                                version(),
                                                snapshotType().getSimpleName(),
                                                snapshotTypeVersion());
            var snapshotAtVersion = version();
            return snapshotStore.storeSnapshot(aggregateType(), aggregateId(), new SnapshotContainer<>(snapshot, metadata))
                                .doOnSuccess(ignored -> {
                                    snapshotVersion = snapshotAtVersion;
                                    log.debug("Stored snapshot of aggregate '{}' at version {}", aggregateId(), snapshotAtVersion);
                                });
        });
    }
}
