package dk.cloudcreate.eventledger.eventstore.serializer;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import dk.cloudcreate.eventledger.eventstore.metadata.Metadata;
import dk.cloudcreate.eventledger.eventstore.persistence.CommittedDomainEvent;

/**
 * Converts event payloads and metadata to and from their persisted JSON form
 */
public interface EventJsonSerializer {
    /**
     * Serialize an event payload and its metadata. The event name and version of the payload type are added to the metadata
     *
     * @param aggregateEvent the event payload
     * @param metadata       the event metadata, which must contain the aggregate sequence number
     * @return the serialized event
     * @throws EventSerializationException if the event couldn't be serialized
     */
    SerializedEvent serialize(AggregateEvent<?, ?> aggregateEvent, Metadata metadata);

    /**
     * Deserialize a committed event for a known aggregate type and identity
     *
     * @throws EventDeserializationException if the event couldn't be deserialized
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> DomainEvent<A, ID, ?> deserialize(Class<A> aggregateType, ID id, CommittedDomainEvent committedEvent);

    /**
     * Deserialize a committed event where the aggregate type and identity are resolved from the event metadata
     *
     * @throws EventDeserializationException if the event couldn't be deserialized
     */
    DomainEvent<?, ?, ?> deserialize(CommittedDomainEvent committedEvent);

    /**
     * @throws EventDeserializationException if the metadata couldn't be deserialized
     */
    Metadata deserializeMetadata(String serializedMetadata);
}
