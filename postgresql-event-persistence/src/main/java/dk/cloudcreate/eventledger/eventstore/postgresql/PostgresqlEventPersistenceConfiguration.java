package dk.cloudcreate.eventledger.eventstore.postgresql;

import java.util.regex.Pattern;

import static org.apache.commons.lang3.Validate.*;

/**
 * Configuration of the {@link PostgresqlEventPersistence}.<br>
 * Start from {@link #standard()} and adjust using the <code>with...</code> methods, which all return a new configuration:
 * <pre>{@code
 * var configuration = PostgresqlEventPersistenceConfiguration.standard()
 *                                                            .withEventsTableName("order_events")
 *                                                            .withDuplicateSourceIdDetection(true);
 * }</pre>
 */
public final class PostgresqlEventPersistenceConfiguration {
    public static final String         DEFAULT_EVENTS_TABLE_NAME = "events";
    public static final JSONColumnType DEFAULT_JSON_COLUMN_TYPE  = JSONColumnType.JSONB;
    public static final int            DEFAULT_QUERY_FETCH_SIZE  = 100;

    private static final Pattern VALID_TABLE_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]{0,62}$");

    private final String         eventsTableName;
    private final JSONColumnType jsonColumnType;
    private final int            queryFetchSize;
    private final boolean        detectDuplicateSourceIds;

    private PostgresqlEventPersistenceConfiguration(String eventsTableName,
                                                    JSONColumnType jsonColumnType,
                                                    int queryFetchSize,
                                                    boolean detectDuplicateSourceIds) {
        notNull(eventsTableName, "You must provide an eventsTableName");
        isTrue(VALID_TABLE_NAME.matcher(eventsTableName).matches(), "Events table name '%s' isn't a valid table name", eventsTableName);
        this.eventsTableName = eventsTableName.toLowerCase();
        this.jsonColumnType = notNull(jsonColumnType, "You must provide a jsonColumnType");
        isTrue(queryFetchSize > 0, "queryFetchSize must be positive, was %d", queryFetchSize);
        this.queryFetchSize = queryFetchSize;
        this.detectDuplicateSourceIds = detectDuplicateSourceIds;
    }

    /**
     * Table {@value #DEFAULT_EVENTS_TABLE_NAME}, {@link JSONColumnType#JSONB} columns, a query fetch size of {@value #DEFAULT_QUERY_FETCH_SIZE}
     * and no duplicate source id detection
     */
    public static PostgresqlEventPersistenceConfiguration standard() {
        return new PostgresqlEventPersistenceConfiguration(DEFAULT_EVENTS_TABLE_NAME,
                                                           DEFAULT_JSON_COLUMN_TYPE,
                                                           DEFAULT_QUERY_FETCH_SIZE,
                                                           false);
    }

    public PostgresqlEventPersistenceConfiguration withEventsTableName(String eventsTableName) {
        return new PostgresqlEventPersistenceConfiguration(eventsTableName, jsonColumnType, queryFetchSize, detectDuplicateSourceIds);
    }

    public PostgresqlEventPersistenceConfiguration withJsonColumnType(JSONColumnType jsonColumnType) {
        return new PostgresqlEventPersistenceConfiguration(eventsTableName, jsonColumnType, queryFetchSize, detectDuplicateSourceIds);
    }

    public PostgresqlEventPersistenceConfiguration withQueryFetchSize(int queryFetchSize) {
        return new PostgresqlEventPersistenceConfiguration(eventsTableName, jsonColumnType, queryFetchSize, detectDuplicateSourceIds);
    }

    public PostgresqlEventPersistenceConfiguration withDuplicateSourceIdDetection(boolean detectDuplicateSourceIds) {
        return new PostgresqlEventPersistenceConfiguration(eventsTableName, jsonColumnType, queryFetchSize, detectDuplicateSourceIds);
    }

    public String eventsTableName() {
        return eventsTableName;
    }

    public JSONColumnType jsonColumnType() {
        return jsonColumnType;
    }

    public int queryFetchSize() {
        return queryFetchSize;
    }

    public boolean detectDuplicateSourceIds() {
        return detectDuplicateSourceIds;
    }

    @Override
    public String toString() {
        return "PostgresqlEventPersistenceConfiguration{" +
                "eventsTableName='" + eventsTableName + '\'' +
                ", jsonColumnType=" + jsonColumnType +
                ", queryFetchSize=" + queryFetchSize +
                ", detectDuplicateSourceIds=" + detectDuplicateSourceIds +
                '}';
    }
}
