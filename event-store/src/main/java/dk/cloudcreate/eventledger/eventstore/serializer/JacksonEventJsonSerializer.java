package dk.cloudcreate.eventledger.eventstore.serializer;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.EventStoreException;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.metadata.*;
import dk.cloudcreate.eventledger.eventstore.persistence.CommittedDomainEvent;
import dk.cloudcreate.eventledger.eventstore.types.EventId;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * Jackson based {@link EventJsonSerializer}. Event payload types are resolved through the {@link EventDefinitionService}
 * using the <code>event_name</code> and <code>event_version</code> metadata, so the persisted form never contains Java class names
 */
public final class JacksonEventJsonSerializer implements EventJsonSerializer {
    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper           objectMapper;
    private final EventDefinitionService eventDefinitionService;

    public JacksonEventJsonSerializer(EventDefinitionService eventDefinitionService) {
        this(createDefaultObjectMapper(), eventDefinitionService);
    }

    public JacksonEventJsonSerializer(ObjectMapper objectMapper, EventDefinitionService eventDefinitionService) {
        this.objectMapper = notNull(objectMapper, "You must provide an objectMapper");
        this.eventDefinitionService = notNull(eventDefinitionService, "You must provide an eventDefinitionService");
    }

    /**
     * An {@link ObjectMapper} that uses field visibility, ignores unknown properties and supports JDK8 and java.time types
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_SETTERS)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .visibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.ANY)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .build();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public SerializedEvent serialize(AggregateEvent<?, ?> aggregateEvent, Metadata metadata) {
        notNull(aggregateEvent, "You must provide an aggregateEvent");
        notNull(metadata, "You must provide metadata");
        var definition = eventDefinitionService.findDefinition(aggregateEvent.getClass())
                                               .orElseThrow(() -> new EventSerializationException(msg("Event type '{}' hasn't been registered with the EventDefinitionService",
                                                                                                      aggregateEvent.getClass().getName())));
        var eventMetadata = metadata.with(MetadataKeys.EVENT_NAME, definition.name())
                                    .with(MetadataKeys.EVENT_VERSION, Integer.toString(definition.version()));
        if (!eventMetadata.containsKey(MetadataKeys.EVENT_ID)) {
            eventMetadata = eventMetadata.with(MetadataKeys.EVENT_ID, EventId.random().value());
        }
        if (!eventMetadata.containsKey(MetadataKeys.TIMESTAMP)) {
            var now = OffsetDateTime.now(ZoneOffset.UTC);
            eventMetadata = eventMetadata.with(MetadataKeys.TIMESTAMP, now.toString())
                                         .with(MetadataKeys.TIMESTAMP_EPOCH, Long.toString(now.toEpochSecond()));
        }

        long aggregateSequenceNumber;
        try {
            aggregateSequenceNumber = eventMetadata.aggregateSequenceNumber();
        } catch (EventStoreException e) {
            throw new EventSerializationException(msg("Event '{}' doesn't have a valid '{}' metadata value",
                                                      definition.name(), MetadataKeys.AGGREGATE_SEQUENCE_NUMBER), e);
        }

        try {
            return new SerializedEvent(objectMapper.writeValueAsString(aggregateEvent),
                                       objectMapper.writeValueAsString(eventMetadata.asMap()),
                                       aggregateSequenceNumber,
                                       eventMetadata);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(msg("Failed to serialize event '{}'", aggregateEvent.getClass().getName()), e);
        }
    }

    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> DomainEvent<A, ID, ?> deserialize(Class<A> aggregateType, ID id, CommittedDomainEvent committedEvent) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        notNull(committedEvent, "You must provide a committedEvent");
        var metadata = deserializeMetadata(committedEvent.metadata());
        return toDomainEvent(aggregateType, id, committedEvent, metadata);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public DomainEvent<?, ?, ?> deserialize(CommittedDomainEvent committedEvent) {
        notNull(committedEvent, "You must provide a committedEvent");
        var metadata = deserializeMetadata(committedEvent.metadata());
        String aggregateName;
        try {
            aggregateName = metadata.aggregateName();
        } catch (EventStoreException e) {
            throw new EventDeserializationException(msg("Committed event {} of aggregate '{}' doesn't have an aggregate name",
                                                        committedEvent.aggregateSequenceNumber(), committedEvent.aggregateId()), e);
        }
        AggregateTypeDefinition definition = eventDefinitionService.findAggregateType(aggregateName)
                                                                   .orElseThrow(() -> new EventDeserializationException(msg("Aggregate type with name '{}' hasn't been registered with the EventDefinitionService",
                                                                                                                            aggregateName)));
        Identity id;
        try {
            id = (Identity) definition.identityOf(committedEvent.aggregateId());
        } catch (RuntimeException e) {
            throw new EventDeserializationException(msg("Failed to create identity of aggregate '{}' from '{}'", aggregateName, committedEvent.aggregateId()), e);
        }
        return toDomainEvent(definition.aggregateType(), id, committedEvent, metadata);
    }

    @Override
    public Metadata deserializeMetadata(String serializedMetadata) {
        notNull(serializedMetadata, "You must provide serializedMetadata");
        try {
            return Metadata.of(objectMapper.readValue(serializedMetadata, METADATA_TYPE));
        } catch (JsonProcessingException e) {
            throw new EventDeserializationException("Failed to deserialize event metadata", e);
        }
    }

    @SuppressWarnings("unchecked")
    private <A extends Aggregate<A, ID>, ID extends Identity<ID>> DomainEvent<A, ID, ?> toDomainEvent(Class<A> aggregateType,
                                                                                                     ID id,
                                                                                                     CommittedDomainEvent committedEvent,
                                                                                                     Metadata metadata) {
        String eventName;
        int    eventVersion;
        try {
            eventName = metadata.eventName();
            eventVersion = metadata.eventVersion();
        } catch (EventStoreException e) {
            throw new EventDeserializationException(msg("Committed event {} of aggregate '{}' doesn't have an event name and version",
                                                        committedEvent.aggregateSequenceNumber(), committedEvent.aggregateId()), e);
        }
        var definition = eventDefinitionService.findDefinition(eventName, eventVersion)
                                               .orElseThrow(() -> new EventDeserializationException(msg("Event '{}' version {} hasn't been registered with the EventDefinitionService",
                                                                                                        eventName, eventVersion)));
        if (!definition.aggregateType().equals(aggregateType)) {
            throw new EventDeserializationException(msg("Event '{}' version {} belongs to aggregate type '{}' and not '{}'",
                                                        eventName, eventVersion, definition.aggregateType().getName(), aggregateType.getName()));
        }

        AggregateEvent<A, ID> aggregateEvent;
        try {
            aggregateEvent = (AggregateEvent<A, ID>) objectMapper.readValue(committedEvent.data(), definition.eventType());
        } catch (JsonProcessingException e) {
            throw new EventDeserializationException(msg("Failed to deserialize event '{}' version {} into '{}'",
                                                        eventName, eventVersion, definition.eventType().getName()), e);
        }
        return DomainEvent.of(aggregateType,
                              id,
                              aggregateEvent,
                              committedEvent.aggregateSequenceNumber(),
                              committedEvent.globalPosition(),
                              metadata);
    }
}
