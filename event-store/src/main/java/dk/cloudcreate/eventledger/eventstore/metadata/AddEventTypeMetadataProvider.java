package dk.cloudcreate.eventledger.eventstore.metadata;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.Map;

/**
 * Adds the fully qualified class name of the event payload under {@link MetadataKeys#EVENT_TYPE}
 */
public final class AddEventTypeMetadataProvider implements MetadataProvider {
    @Override
    public Map<String, String> provideMetadata(Class<?> aggregateType, Identity<?> id, AggregateEvent<?, ?> aggregateEvent, Metadata existingMetadata) {
        return Map.of(MetadataKeys.EVENT_TYPE, aggregateEvent.getClass().getName());
    }
}
