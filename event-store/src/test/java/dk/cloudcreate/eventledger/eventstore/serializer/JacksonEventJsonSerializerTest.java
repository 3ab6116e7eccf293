package dk.cloudcreate.eventledger.eventstore.serializer;

import dk.cloudcreate.eventledger.eventstore.metadata.*;
import dk.cloudcreate.eventledger.eventstore.persistence.CommittedDomainEvent;
import dk.cloudcreate.eventledger.eventstore.test_data.*;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JacksonEventJsonSerializerTest {
    private final JacksonEventJsonSerializer serializer = new JacksonEventJsonSerializer(ThingyTestSupport.eventDefinitions());

    @Test
    void test_serialize_adds_event_name_version_id_and_timestamp() {
        // When
        var serialized = serializer.serialize(new ThingyPingEvent("hello"), Metadata.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, "7"));

        // Then
        assertThat(serialized.aggregateSequenceNumber()).isEqualTo(7L);
        assertThat(serialized.serializedData()).isEqualTo("{\"message\":\"hello\"}");
        assertThat(serialized.metadata().eventName()).isEqualTo("ThingyPing");
        assertThat(serialized.metadata().eventVersion()).isEqualTo(1);
        assertThat(serialized.metadata().containsKey(MetadataKeys.EVENT_ID)).isTrue();
        assertThat(serialized.metadata().containsKey(MetadataKeys.TIMESTAMP)).isTrue();
        assertThat(serializer.deserializeMetadata(serialized.serializedMetadata())).isEqualTo(serialized.metadata());
    }

    @Test
    void test_serialize_without_sequence_number_fails() {
        assertThatThrownBy(() -> serializer.serialize(new ThingyPingEvent("hello"), Metadata.empty()))
                .isInstanceOf(EventSerializationException.class);
    }

    @Test
    void test_serialize_of_an_unregistered_event_type_fails() {
        assertThatThrownBy(() -> serializer.serialize(new ThingyPingEventV2("hello", 1), Metadata.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, "1")))
                .isInstanceOf(EventSerializationException.class);
    }

    @Test
    void test_deserialize_of_an_unknown_event_version_fails() {
        // Given
        var id = ThingyId.newId();
        var metadata = Metadata.of(MetadataKeys.EVENT_NAME, "ThingyPing")
                               .with(MetadataKeys.EVENT_VERSION, "9")
                               .with(MetadataKeys.AGGREGATE_NAME, "Thingy");
        var committed = new CommittedDomainEvent(id.value(), 1, GlobalPosition.of(1), "{}", json(metadata));

        // Then
        assertThatThrownBy(() -> serializer.deserialize(Thingy.class, id, committed))
                .isInstanceOf(EventDeserializationException.class);
        assertThatThrownBy(() -> serializer.deserialize(committed))
                .isInstanceOf(EventDeserializationException.class);
    }

    @Test
    void test_deserialize_of_malformed_json_fails() {
        var id        = ThingyId.newId();
        var committed = new CommittedDomainEvent(id.value(), 1, GlobalPosition.of(1), "{\"message\":", "not json");

        assertThatThrownBy(() -> serializer.deserialize(Thingy.class, id, committed))
                .isInstanceOf(EventDeserializationException.class);
    }

    @Test
    void test_untyped_deserialize_resolves_aggregate_type_and_identity() {
        // Given
        var id       = ThingyId.newId();
        var serialized = serializer.serialize(new ThingyPingEvent("hi"),
                                              Metadata.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, "1")
                                                      .with(MetadataKeys.AGGREGATE_NAME, "Thingy")
                                                      .with(MetadataKeys.AGGREGATE_ID, id.value()));
        var committed = new CommittedDomainEvent(id.value(), 1, GlobalPosition.of(3), serialized.serializedData(), serialized.serializedMetadata());

        // When
        var domainEvent = serializer.deserialize(committed);

        // Then
        assertThat(domainEvent.aggregateType()).isEqualTo(Thingy.class);
        assertThat(domainEvent.aggregateIdentity()).isEqualTo(id);
        assertThat(domainEvent.aggregateEvent()).isEqualTo(new ThingyPingEvent("hi"));
        assertThat(domainEvent.globalPosition()).isEqualTo(GlobalPosition.of(3));
    }

    private String json(Metadata metadata) {
        try {
            return serializer.getObjectMapper().writeValueAsString(metadata.asMap());
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
