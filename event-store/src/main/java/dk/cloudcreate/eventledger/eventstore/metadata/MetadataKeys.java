package dk.cloudcreate.eventledger.eventstore.metadata;

/**
 * Well known {@link Metadata} keys
 */
public final class MetadataKeys {
    public static final String EVENT_NAME                = "event_name";
    public static final String EVENT_VERSION             = "event_version";
    public static final String AGGREGATE_SEQUENCE_NUMBER = "aggregate_sequence_number";
    public static final String AGGREGATE_ID              = "aggregate_id";
    public static final String AGGREGATE_NAME            = "aggregate_name";
    public static final String BATCH_ID                  = "batch_id";
    public static final String SOURCE_ID                 = "source_id";
    public static final String EVENT_ID                  = "event_id";
    public static final String TIMESTAMP                 = "timestamp";
    public static final String TIMESTAMP_EPOCH           = "timestamp_epoch";
    public static final String GLOBAL_POSITION           = "global_position";
    public static final String EVENT_TYPE                = "event_type";
    public static final String MACHINE_NAME              = "machine_name";

    private MetadataKeys() {
    }
}
