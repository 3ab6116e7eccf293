package dk.cloudcreate.eventledger.eventstore.snapshots;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.concurrent.*;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * {@link SnapshotStore} that keeps the newest snapshot of each aggregate in memory
 */
public final class InMemorySnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private final ConcurrentMap<SnapshotKey, SnapshotContainer<?>> snapshots = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<SnapshotContainer<S>> loadSnapshot(Class<A> aggregateType, ID id, Class<S> snapshotType) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        notNull(snapshotType, "You must provide a snapshotType");
        return Mono.defer(() -> {
            var snapshotContainer = snapshots.get(new SnapshotKey(aggregateType, id.value()));
            if (snapshotContainer == null || !snapshotType.isInstance(snapshotContainer.snapshot())) {
                return Mono.empty();
            }
            return Mono.just((SnapshotContainer<S>) snapshotContainer);
        });
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>, S> Mono<Void> storeSnapshot(Class<A> aggregateType, ID id, SnapshotContainer<S> snapshotContainer) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        notNull(snapshotContainer, "You must provide a snapshotContainer");
        return Mono.fromRunnable(() -> {
            snapshots.merge(new SnapshotKey(aggregateType, id.value()),
                            snapshotContainer,
                            (existing, candidate) -> candidate.metadata().aggregateSequenceNumber() >= existing.metadata().aggregateSequenceNumber() ? candidate : existing);
            log.trace("Stored snapshot for aggregate '{}' at aggregate sequence number {}", id, snapshotContainer.metadata().aggregateSequenceNumber());
        });
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<Void> deleteSnapshot(Class<A> aggregateType, ID id) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        return Mono.fromRunnable(() -> snapshots.remove(new SnapshotKey(aggregateType, id.value())));
    }

    private static final class SnapshotKey {
        private final Class<?> aggregateType;
        private final String   aggregateId;

        private SnapshotKey(Class<?> aggregateType, String aggregateId) {
            this.aggregateType = aggregateType;
            this.aggregateId = aggregateId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SnapshotKey)) return false;
            var that = (SnapshotKey) o;
            return aggregateType.equals(that.aggregateType) && aggregateId.equals(that.aggregateId);
        }

        @Override
        public int hashCode() {
            return 31 * aggregateType.hashCode() + aggregateId.hashCode();
        }
    }
}
