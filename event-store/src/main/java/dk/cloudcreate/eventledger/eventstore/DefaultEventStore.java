package dk.cloudcreate.eventledger.eventstore;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.metadata.*;
import dk.cloudcreate.eventledger.eventstore.persistence.*;
import dk.cloudcreate.eventledger.eventstore.serializer.*;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import dk.cloudcreate.eventledger.eventstore.upgrade.*;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.*;

/**
 * Default {@link EventStore} implementation, which coordinates the {@link MetadataProvider}s, the {@link EventJsonSerializer},
 * the {@link EventUpgradeManager} and the {@link EventPersistence}.<br>
 * The metadata of every stored event is the union of (in this order, last writer wins):
 * <ol>
 *     <li>the metadata of the {@link MetadataProvider}s, in registration order</li>
 *     <li>the metadata attached to the {@link UncommittedEvent}</li>
 *     <li><code>aggregate_id</code>, <code>aggregate_name</code>, <code>batch_id</code> and <code>source_id</code> set by the store</li>
 * </ol>
 * Besides that the {@link EventJsonSerializer} sets the event name and version of the payload type.
 * <pre>{@code
 * var eventDefinitions = new EventDefinitionService()
 *         .addAggregateType(Order.class, OrderId::of)
 *         .addEventTypes(Order.class, OrderPlaced.class, OrderShipped.class);
 * var eventStore = new DefaultEventStore(new JacksonEventJsonSerializer(eventDefinitions),
 *                                        new DefaultEventUpgradeManager(eventDefinitions),
 *                                        List.of(new AddMachineNameMetadataProvider()),
 *                                        new InMemoryEventPersistence());
 * }</pre>
 */
public final class DefaultEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(DefaultEventStore.class);

    private final EventJsonSerializer    eventJsonSerializer;
    private final EventUpgradeManager    eventUpgradeManager;
    private final List<MetadataProvider> metadataProviders;
    private final EventPersistence       eventPersistence;

    public DefaultEventStore(EventJsonSerializer eventJsonSerializer,
                             EventUpgradeManager eventUpgradeManager,
                             List<MetadataProvider> metadataProviders,
                             EventPersistence eventPersistence) {
        this.eventJsonSerializer = notNull(eventJsonSerializer, "You must provide an eventJsonSerializer");
        this.eventUpgradeManager = notNull(eventUpgradeManager, "You must provide an eventUpgradeManager");
        this.metadataProviders = List.copyOf(notNull(metadataProviders, "You must provide metadataProviders"));
        this.eventPersistence = notNull(eventPersistence, "You must provide an eventPersistence");
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> store(Class<A> aggregateType,
                                                                                                        ID id,
                                                                                                        List<UncommittedEvent> uncommittedEvents,
                                                                                                        SourceId sourceId) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an aggregate id");
        notNull(sourceId, "You must provide a sourceId");
        isTrue(!sourceId.isNone(), "You must provide a sourceId that isn't none");
        if (uncommittedEvents == null || uncommittedEvents.isEmpty()) {
            return Mono.just(List.of());
        }

        return Mono.defer(() -> {
            var batchId = UUID.randomUUID().toString();
            log.trace("Storing {} event(s) for aggregate '{}' with id '{}' in batch '{}'", uncommittedEvents.size(), aggregateType.getSimpleName(), id, batchId);
            var storeMetadata = Map.of(MetadataKeys.AGGREGATE_ID, id.value(),
                                       MetadataKeys.AGGREGATE_NAME, AggregateNames.nameOf(aggregateType),
                                       MetadataKeys.BATCH_ID, batchId,
                                       MetadataKeys.SOURCE_ID, sourceId.value());
            var serializedEvents = uncommittedEvents.stream()
                                                    .map(uncommittedEvent -> serialize(aggregateType, id, uncommittedEvent, storeMetadata))
                                                    .collect(Collectors.toList());
            return eventPersistence.commitEvents(id, serializedEvents)
                                   .map(committedEvents -> {
                                       var domainEvents = committedEvents.stream()
                                                                         .map(committedEvent -> eventJsonSerializer.deserialize(aggregateType, id, committedEvent))
                                                                         .collect(Collectors.<DomainEvent<A, ID, ?>>toList());
                                       log.debug("Stored {} event(s) for aggregate '{}' with id '{}'", domainEvents.size(), aggregateType.getSimpleName(), id);
                                       return domainEvents;
                                   });
        });
    }

    private SerializedEvent serialize(Class<?> aggregateType, Identity<?> id, UncommittedEvent uncommittedEvent, Map<String, String> storeMetadata) {
        var metadata = Metadata.empty();
        for (var metadataProvider : metadataProviders) {
            var provided = metadataProvider.provideMetadata(aggregateType, id, uncommittedEvent.aggregateEvent(), uncommittedEvent.metadata());
            if (provided != null) {
                metadata = metadata.with(provided);
            }
        }
        metadata = metadata.with(uncommittedEvent.metadata())
                           .with(storeMetadata);
        return eventJsonSerializer.serialize(uncommittedEvent.aggregateEvent(), metadata);
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> loadEvents(Class<A> aggregateType, ID id, long fromSequenceNumber) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an aggregate id");
        validateFromSequenceNumber(fromSequenceNumber);
        return upgrade(aggregateType, id, eventPersistence.loadCommittedEvents(id, fromSequenceNumber));
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> loadEvents(Class<A> aggregateType, ID id, long fromSequenceNumber, long toSequenceNumber) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an aggregate id");
        validateFromSequenceNumber(fromSequenceNumber);
        if (toSequenceNumber <= fromSequenceNumber) {
            throw new InvalidEventRangeException(msg("toSequenceNumber ({}) must be greater than fromSequenceNumber ({})", toSequenceNumber, fromSequenceNumber));
        }
        return upgrade(aggregateType, id, eventPersistence.loadCommittedEvents(id, fromSequenceNumber, toSequenceNumber));
    }

    private static void validateFromSequenceNumber(long fromSequenceNumber) {
        if (fromSequenceNumber < FIRST_AGGREGATE_SEQUENCE_NUMBER) {
            throw new InvalidEventRangeException(msg("fromSequenceNumber ({}) must be at least {}", fromSequenceNumber, FIRST_AGGREGATE_SEQUENCE_NUMBER));
        }
    }

    private <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> upgrade(Class<A> aggregateType, ID id, Mono<List<CommittedDomainEvent>> committedEvents) {
        return committedEvents.flatMap(events -> {
            log.debug("Loaded {} event(s) for aggregate '{}' with id '{}'", events.size(), aggregateType.getSimpleName(), id);
            if (events.isEmpty()) {
                return Mono.just(List.<DomainEvent<A, ID, ?>>of());
            }
            var domainEvents = events.stream()
                                     .map(committedEvent -> eventJsonSerializer.deserialize(aggregateType, id, committedEvent))
                                     .collect(Collectors.<DomainEvent<A, ID, ?>>toList());
            return eventUpgradeManager.upgrade(aggregateType, domainEvents, EventUpgradeContext.newContext());
        });
    }

    @Override
    public Mono<AllEventsPage> loadAllEvents(GlobalPosition globalPosition, int pageSize, EventUpgradeContext context) {
        notNull(globalPosition, "You must provide a globalPosition");
        notNull(context, "You must provide a context");
        if (pageSize <= 0) {
            throw new InvalidEventRangeException(msg("pageSize ({}) must be positive", pageSize));
        }
        return eventPersistence.loadAllCommittedEvents(globalPosition, pageSize)
                               .flatMap(page -> {
                                   log.debug("Loaded {} event(s) from global position '{}', next global position is '{}'",
                                             page.committedDomainEvents().size(), globalPosition, page.nextGlobalPosition());
                                   var domainEvents = page.committedDomainEvents()
                                                          .stream()
                                                          .map(eventJsonSerializer::deserialize)
                                                          .collect(Collectors.<DomainEvent<?, ?, ?>>toList());
                                   return eventUpgradeManager.upgrade(domainEvents, context)
                                                             .map(upgraded -> new AllEventsPage(page.nextGlobalPosition(), upgraded));
                               });
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<Void> deleteAggregate(Class<A> aggregateType, ID id) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an aggregate id");
        log.debug("Deleting aggregate '{}' with id '{}'", aggregateType.getSimpleName(), id);
        return eventPersistence.deleteEvents(id);
    }
}
