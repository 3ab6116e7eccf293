package dk.cloudcreate.eventledger.eventstore.postgresql;

/**
 * The Postgresql column type used for the event data and metadata columns
 */
public enum JSONColumnType {
    JSON,
    JSONB
}
