package dk.cloudcreate.eventledger.eventstore.metadata;

import dk.cloudcreate.eventledger.common.types.SourceId;
import dk.cloudcreate.eventledger.eventstore.EventStoreException;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetadataTest {
    @Test
    void test_with_returns_a_new_instance_and_last_writer_wins() {
        // Given
        var original = Metadata.of("key", "original");

        // When
        var updated = original.with("key", "updated").with(Map.of("other", "value"));

        // Then
        assertThat(original.get("key")).hasValue("original");
        assertThat(original.size()).isEqualTo(1);
        assertThat(updated.get("key")).hasValue("updated");
        assertThat(updated.get("other")).hasValue("value");
        assertThat(updated.without("other").containsKey("other")).isFalse();
    }

    @Test
    void test_typed_accessors() {
        var timestamp = OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC);
        var metadata = Metadata.of(Map.of(MetadataKeys.EVENT_NAME, "ThingyPing",
                                          MetadataKeys.EVENT_VERSION, "2",
                                          MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, "42",
                                          MetadataKeys.SOURCE_ID, "source-1",
                                          MetadataKeys.TIMESTAMP, timestamp.toString()));

        assertThat(metadata.eventName()).isEqualTo("ThingyPing");
        assertThat(metadata.eventVersion()).isEqualTo(2);
        assertThat(metadata.aggregateSequenceNumber()).isEqualTo(42L);
        assertThat(metadata.sourceId()).isEqualTo(SourceId.of("source-1"));
        assertThat(metadata.timestamp()).isEqualTo(timestamp);
        assertThat(metadata.globalPosition()).isEmpty();
    }

    @Test
    void test_missing_and_malformed_values() {
        var metadata = Metadata.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, "not-a-number");

        assertThat(metadata.sourceId().isNone()).isTrue();
        assertThatThrownBy(metadata::eventName).isInstanceOf(EventStoreException.class);
        assertThatThrownBy(metadata::aggregateSequenceNumber).isInstanceOf(EventStoreException.class);
        assertThatThrownBy(() -> metadata.with("key", null)).isInstanceOf(NullPointerException.class);
    }
}
