package dk.cloudcreate.eventledger.eventstore.metadata;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.EventStore;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.Map;

/**
 * Contributes metadata to every event that is {@link EventStore#store stored}.<br>
 * Providers are invoked in registration order and their entries are merged before the event's own metadata,
 * so metadata attached to the event wins on key collisions.
 */
@FunctionalInterface
public interface MetadataProvider {
    /**
     * @param aggregateType    the aggregate type the event belongs to
     * @param id               the aggregate identity
     * @param aggregateEvent   the event payload
     * @param existingMetadata the metadata attached to the event by the aggregate
     * @return the metadata to add (never null)
     */
    Map<String, String> provideMetadata(Class<?> aggregateType, Identity<?> id, AggregateEvent<?, ?> aggregateEvent, Metadata existingMetadata);
}
