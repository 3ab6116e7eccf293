package dk.cloudcreate.eventledger.aggregates;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.EventStore;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.metadata.*;
import dk.cloudcreate.eventledger.eventstore.snapshots.SnapshotStore;
import dk.cloudcreate.eventledger.eventstore.types.EventId;
import reactor.core.publisher.Mono;

import java.time.*;
import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * A mutable {@link Aggregate} base class that keeps track of its version and its uncommitted events.<br>
 * New events are emitted using {@link #emit(AggregateEvent)}, which assigns the next aggregate sequence number, applies the
 * event to the aggregate and records it as uncommitted. Uncommitted events are stored using
 * {@link #commit(EventStore, SnapshotStore, SourceId)}.<p>
 * Events are applied through handlers registered in {@link #initialize()}:
 * <pre>{@code
 * public class Order extends AggregateRoot<Order, OrderId> {
 *     private boolean shipped;
 *
 *     public Order(OrderId id) {
 *         super(id);
 *     }
 *
 *     @Override
 *     protected void initialize() {
 *         register(OrderPlaced.class, e -> {});
 *         register(OrderShipped.class, e -> shipped = true);
 *     }
 *
 *     public void ship() {
 *         if (!shipped) {
 *             emit(new OrderShipped());
 *         }
 *     }
 * }
 * }</pre>
 * Aggregates created by the {@link ObjenesisAggregateFactory} don't have their constructor called, which is why all
 * internal state of the {@link AggregateRoot} is initialized lazily.
 *
 * @param <A>  the concrete aggregate type
 * @param <ID> the aggregate identity type
 */
public abstract class AggregateRoot<A extends AggregateRoot<A, ID>, ID extends Identity<ID>> implements Aggregate<A, ID> {
    private ID                                          aggregateId;
    private long                                        version;
    private List<UncommittedEvent>                      uncommittedEvents;
    private Map<Class<?>, Consumer<AggregateEvent<A, ID>>> eventHandlers;

    protected AggregateRoot(ID aggregateId) {
        this.aggregateId = notNull(aggregateId, "You must provide an aggregateId");
    }

    /**
     * Used by the {@link ObjenesisAggregateFactory}, which bypasses the constructor
     */
    final void initializeIdentity(ID aggregateId) {
        notNull(aggregateId, "You must provide an aggregateId");
        if (this.aggregateId != null && !this.aggregateId.equals(aggregateId)) {
            throw new AggregateException(msg("Aggregate '{}' already has id '{}'", getClass().getName(), this.aggregateId));
        }
        this.aggregateId = aggregateId;
    }

    /**
     * Register the event handlers of the aggregate using {@link #register(Class, Consumer)}.
     * Called once per instance, before the first event is applied
     */
    protected abstract void initialize();

    /**
     * Register the handler that applies events of the given type to the aggregate state
     *
     * @param eventType the event type
     * @param handler   the handler
     * @param <E>       the event type
     */
    @SuppressWarnings("unchecked")
    protected final <E extends AggregateEvent<A, ID>> void register(Class<E> eventType, Consumer<E> handler) {
        notNull(eventType, "You must provide an eventType");
        notNull(handler, "You must provide a handler");
        var existing = _eventHandlers().putIfAbsent(eventType, event -> handler.accept((E) event));
        if (existing != null) {
            throw new AggregateException(msg("Aggregate '{}' already has a handler for event type '{}'", getClass().getName(), eventType.getName()));
        }
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public long version() {
        return version;
    }

    @SuppressWarnings("unchecked")
    public Class<A> aggregateType() {
        return (Class<A>) getClass();
    }

    /**
     * Emit a new event with no additional metadata
     */
    protected void emit(AggregateEvent<A, ID> event) {
        emit(event, Metadata.empty());
    }

    /**
     * Emit a new event: assigns the next aggregate sequence number, adds the event metadata, applies the event to the
     * aggregate and records it as uncommitted
     *
     * @param event    the event
     * @param metadata additional metadata for the event
     */
    protected void emit(AggregateEvent<A, ID> event, Metadata metadata) {
        notNull(event, "You must provide an event");
        notNull(metadata, "You must provide metadata");
        var aggregateSequenceNumber = version + 1;
        var now                     = OffsetDateTime.now(ZoneOffset.UTC);
        var eventMetadata = metadata.with(Map.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, Long.toString(aggregateSequenceNumber),
                                                 MetadataKeys.AGGREGATE_ID, aggregateId.value(),
                                                 MetadataKeys.AGGREGATE_NAME, name(),
                                                 MetadataKeys.EVENT_ID, EventId.random().value(),
                                                 MetadataKeys.TIMESTAMP, now.toString(),
                                                 MetadataKeys.TIMESTAMP_EPOCH, Long.toString(now.toEpochSecond())));
        applyEvent(event);
        version = aggregateSequenceNumber;
        _uncommittedEvents().add(UncommittedEvent.of(event, eventMetadata));
    }

    /**
     * Apply committed events to the aggregate, in order
     *
     * @param domainEvents the events, which must belong to this aggregate and continue from its current version
     * @throws AggregateException if an event belongs to another aggregate or doesn't follow the current version
     */
    public void applyEvents(List<? extends DomainEvent<A, ID, ?>> domainEvents) {
        notNull(domainEvents, "You must provide domainEvents");
        for (var domainEvent : domainEvents) {
            if (!aggregateId.equals(domainEvent.aggregateIdentity())) {
                throw new AggregateException(msg("Cannot apply event {} of aggregate '{}' to aggregate '{}'",
                                                 domainEvent.aggregateSequenceNumber(), domainEvent.aggregateIdentity(), aggregateId));
            }
            if (domainEvent.aggregateSequenceNumber() != version + 1) {
                throw new AggregateException(msg("Cannot apply event {} of type '{}' to aggregate '{}' at version {}",
                                                 domainEvent.aggregateSequenceNumber(), domainEvent.eventType().getSimpleName(), aggregateId, version));
            }
            applyEvent(domainEvent.aggregateEvent());
            version = domainEvent.aggregateSequenceNumber();
        }
    }

    private void applyEvent(AggregateEvent<A, ID> event) {
        var handler = _eventHandlers().get(event.getClass());
        if (handler == null) {
            throw new AggregateException(msg("Aggregate '{}' doesn't have a handler for event type '{}'", getClass().getName(), event.getClass().getName()));
        }
        handler.accept(event);
    }

    /**
     * Hydrate the aggregate by replaying all of its events
     */
    @Override
    public Mono<Void> load(EventStore eventStore, SnapshotStore snapshotStore) {
        notNull(eventStore, "You must provide an eventStore");
        return eventStore.loadEvents(aggregateType(), aggregateId)
                         .doOnNext(this::applyEvents)
                         .then();
    }

    /**
     * Store the uncommitted events of the aggregate as one batch and mark them as committed
     *
     * @param eventStore    the event store
     * @param snapshotStore the snapshot store (used by {@link SnapshotAggregateRoot})
     * @param sourceId      the source id of the operation that produced the events
     * @return the committed domain events
     */
    public Mono<List<DomainEvent<A, ID, ?>>> commit(EventStore eventStore, SnapshotStore snapshotStore, SourceId sourceId) {
        notNull(eventStore, "You must provide an eventStore");
        notNull(snapshotStore, "You must provide a snapshotStore");
        notNull(sourceId, "You must provide a sourceId");
        return Mono.defer(() -> {
            var eventsToCommit = List.copyOf(_uncommittedEvents());
            return eventStore.store(aggregateType(), aggregateId, eventsToCommit, sourceId)
                             .flatMap(domainEvents -> {
                                 _uncommittedEvents().removeAll(eventsToCommit);
                                 return afterCommit(snapshotStore, domainEvents).thenReturn(domainEvents);
                             });
        });
    }

    /**
     * Called after the uncommitted events have been stored
     */
    protected Mono<Void> afterCommit(SnapshotStore snapshotStore, List<DomainEvent<A, ID, ?>> committedEvents) {
        return Mono.empty();
    }

    /**
     * Set the version after the aggregate state has been restored from a snapshot
     */
    protected final void restoreVersion(long version) {
        this.version = version;
    }

    public List<UncommittedEvent> uncommittedEvents() {
        return Collections.unmodifiableList(_uncommittedEvents());
    }

    public boolean hasUncommittedEvents() {
        return !_uncommittedEvents().isEmpty();
    }

    private List<UncommittedEvent> _uncommittedEvents() {
        if (uncommittedEvents == null) {
            uncommittedEvents = new ArrayList<>();
        }
        return uncommittedEvents;
    }

    private Map<Class<?>, Consumer<AggregateEvent<A, ID>>> _eventHandlers() {
        if (eventHandlers == null) {
            eventHandlers = new HashMap<>();
            initialize();
        }
        return eventHandlers;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                '}';
    }
}
