package dk.cloudcreate.eventledger.eventstore.persistence.inmemory;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.persistence.*;
import dk.cloudcreate.eventledger.eventstore.serializer.SerializedEvent;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.*;

/**
 * {@link EventPersistence} that keeps all events in memory. Intended for tests and prototyping.<br>
 * The events of each aggregate are kept in an immutable list that is replaced inside the {@link ConcurrentHashMap#compute}
 * section of the aggregate, which makes the optimistic concurrency check and the append atomic per aggregate.
 * Global positions are assigned under a write lock, so readers of {@link #loadAllCommittedEvents(GlobalPosition, int)}
 * never see a partially committed batch.
 */
public final class InMemoryEventPersistence implements EventPersistence {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventPersistence.class);

    private final boolean                                rejectDuplicateSourceIds;
    private final ConcurrentMap<String, List<StoredEvent>> eventsByAggregateId = new ConcurrentHashMap<>();
    private final NavigableMap<Long, StoredEvent>        eventsByGlobalPosition = new TreeMap<>();
    private final ReentrantReadWriteLock                 globalLock             = new ReentrantReadWriteLock();
    private       long                                   lastGlobalPosition;

    public InMemoryEventPersistence() {
        this(false);
    }

    /**
     * @param rejectDuplicateSourceIds should a commit whose source id was already committed for the same aggregate be
     *                                 rejected with a {@link DuplicateOperationException}
     */
    public InMemoryEventPersistence(boolean rejectDuplicateSourceIds) {
        this.rejectDuplicateSourceIds = rejectDuplicateSourceIds;
    }

    @Override
    public boolean detectsDuplicateSourceIds() {
        return rejectDuplicateSourceIds;
    }

    @Override
    public Mono<List<CommittedDomainEvent>> commitEvents(Identity<?> id, List<SerializedEvent> serializedEvents) {
        notNull(id, "You must provide an aggregate id");
        notNull(serializedEvents, "You must provide serializedEvents");
        if (serializedEvents.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.fromCallable(() -> commit(id, serializedEvents));
    }

    private List<CommittedDomainEvent> commit(Identity<?> id, List<SerializedEvent> serializedEvents) {
        var committed = new ArrayList<CommittedDomainEvent>(serializedEvents.size());
        eventsByAggregateId.compute(id.value(), (aggregateId, existing) -> {
            var storedEvents = existing != null ? existing : List.<StoredEvent>of();
            var lastSequenceNumber = storedEvents.isEmpty() ? 0L : storedEvents.get(storedEvents.size() - 1).committedEvent.aggregateSequenceNumber();
            verifySequenceNumbers(id, lastSequenceNumber, serializedEvents);
            var sourceId = serializedEvents.get(0).metadata().sourceId();
            if (rejectDuplicateSourceIds && !sourceId.isNone() && storedEvents.stream().anyMatch(e -> e.sourceId.equals(sourceId))) {
                throw new DuplicateOperationException(msg("Source id '{}' has already been committed for aggregate '{}'", sourceId, id), sourceId);
            }

            var newStoredEvents = new ArrayList<>(storedEvents);
            globalLock.writeLock().lock();
            try {
                for (var serializedEvent : serializedEvents) {
                    var globalPosition = ++lastGlobalPosition;
                    var committedEvent = new CommittedDomainEvent(id.value(),
                                                                  serializedEvent.aggregateSequenceNumber(),
                                                                  GlobalPosition.of(globalPosition),
                                                                  serializedEvent.serializedData(),
                                                                  serializedEvent.serializedMetadata());
                    var storedEvent = new StoredEvent(committedEvent, serializedEvent.metadata().sourceId());
                    eventsByGlobalPosition.put(globalPosition, storedEvent);
                    newStoredEvents.add(storedEvent);
                    committed.add(committedEvent);
                }
            } finally {
                globalLock.writeLock().unlock();
            }
            return List.copyOf(newStoredEvents);
        });
        log.trace("Committed {} event(s) for aggregate '{}'", committed.size(), id);
        return committed;
    }

    private static void verifySequenceNumbers(Identity<?> id, long lastSequenceNumber, List<SerializedEvent> serializedEvents) {
        var expectedSequenceNumber = lastSequenceNumber + 1;
        for (var serializedEvent : serializedEvents) {
            if (serializedEvent.aggregateSequenceNumber() <= lastSequenceNumber) {
                throw new OptimisticConcurrencyException(msg("Aggregate '{}' already has an event with aggregate sequence number {}",
                                                             id, serializedEvent.aggregateSequenceNumber()));
            }
            if (serializedEvent.aggregateSequenceNumber() != expectedSequenceNumber) {
                throw new OptimisticConcurrencyException(msg("Expected aggregate sequence number {} for aggregate '{}' but got {}",
                                                             expectedSequenceNumber, id, serializedEvent.aggregateSequenceNumber()));
            }
            expectedSequenceNumber++;
        }
    }

    @Override
    public Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber) {
        return loadCommittedEvents(id, fromSequenceNumber, Long.MAX_VALUE);
    }

    @Override
    public Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber, long toSequenceNumber) {
        notNull(id, "You must provide an aggregate id");
        return Mono.fromCallable(() -> eventsByAggregateId.getOrDefault(id.value(), List.of())
                                                          .stream()
                                                          .map(storedEvent -> storedEvent.committedEvent)
                                                          .filter(e -> e.aggregateSequenceNumber() >= fromSequenceNumber && e.aggregateSequenceNumber() <= toSequenceNumber)
                                                          .collect(Collectors.toList()));
    }

    @Override
    public Mono<AllCommittedEventsPage> loadAllCommittedEvents(GlobalPosition globalPosition, int pageSize) {
        notNull(globalPosition, "You must provide a globalPosition");
        isTrue(pageSize > 0, "pageSize must be positive, was %d", pageSize);
        var fromPosition = toLong(globalPosition);
        return Mono.fromCallable(() -> {
            globalLock.readLock().lock();
            try {
                var page = eventsByGlobalPosition.tailMap(fromPosition, true)
                                                 .values()
                                                 .stream()
                                                 .limit(pageSize)
                                                 .map(storedEvent -> storedEvent.committedEvent)
                                                 .collect(Collectors.toList());
                var nextPosition = page.isEmpty() ? fromPosition : toLong(page.get(page.size() - 1).globalPosition()) + 1;
                return new AllCommittedEventsPage(GlobalPosition.of(nextPosition), page);
            } finally {
                globalLock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<Void> deleteEvents(Identity<?> id) {
        notNull(id, "You must provide an aggregate id");
        return Mono.fromRunnable(() -> {
            eventsByAggregateId.computeIfPresent(id.value(), (aggregateId, storedEvents) -> {
                globalLock.writeLock().lock();
                try {
                    storedEvents.forEach(storedEvent -> eventsByGlobalPosition.remove(toLong(storedEvent.committedEvent.globalPosition())));
                } finally {
                    globalLock.writeLock().unlock();
                }
                log.debug("Deleted {} event(s) for aggregate '{}'", storedEvents.size(), id);
                return null;
            });
        });
    }

    private static long toLong(GlobalPosition globalPosition) {
        if (globalPosition.isStart()) {
            return 1;
        }
        try {
            return Long.parseLong(globalPosition.value());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(msg("Global position '{}' isn't valid", globalPosition), e);
        }
    }

    private static final class StoredEvent {
        private final CommittedDomainEvent committedEvent;
        private final SourceId             sourceId;

        private StoredEvent(CommittedDomainEvent committedEvent, SourceId sourceId) {
            this.committedEvent = committedEvent;
            this.sourceId = sourceId;
        }
    }
}
