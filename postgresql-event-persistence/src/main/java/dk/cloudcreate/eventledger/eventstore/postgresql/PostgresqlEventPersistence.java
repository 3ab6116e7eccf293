package dk.cloudcreate.eventledger.eventstore.postgresql;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.EventStoreException;
import dk.cloudcreate.eventledger.eventstore.persistence.*;
import dk.cloudcreate.eventledger.eventstore.serializer.SerializedEvent;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.jdbi.v3.core.*;
import org.slf4j.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.SQLException;
import java.util.*;
import java.util.concurrent.Callable;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.*;

/**
 * {@link EventPersistence} that stores the events of all aggregates in a single Postgresql table.<br>
 * The table is created, if it doesn't exist, when the {@link PostgresqlEventPersistence} is created:
 * <pre>
 * global_sequence_number    bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY
 * batch_id                  text NOT NULL
 * source_id                 text
 * aggregate_id              text NOT NULL
 * aggregate_name            text NOT NULL
 * aggregate_sequence_number bigint NOT NULL
 * data                      JSON/JSONB NOT NULL
 * metadata                  JSON/JSONB NOT NULL
 * UNIQUE (aggregate_id, aggregate_sequence_number)
 * </pre>
 * A batch is inserted in a single transaction. When another writer already committed an event with one of the
 * aggregate sequence numbers of the batch the unique constraint fails the insert, the transaction is rolled back and
 * the commit fails with an {@link OptimisticConcurrencyException}.<br>
 * All JDBC work runs on the {@link Schedulers#boundedElastic()} scheduler.
 */
public final class PostgresqlEventPersistence implements EventPersistence {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventPersistence.class);

    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final Jdbi                                    jdbi;
    private final PostgresqlEventPersistenceConfiguration configuration;
    private final String                                  insertSql;
    private final String                                  loadEventsSql;
    private final String                                  loadAllEventsSql;
    private final String                                  lastSequenceNumberSql;

    public PostgresqlEventPersistence(Jdbi jdbi) {
        this(jdbi, PostgresqlEventPersistenceConfiguration.standard());
    }

    public PostgresqlEventPersistence(Jdbi jdbi, PostgresqlEventPersistenceConfiguration configuration) {
        this.jdbi = notNull(jdbi, "You must provide a jdbi instance");
        this.configuration = notNull(configuration, "You must provide a configuration");
        jdbi.setSqlLogger(new EventPersistenceSqlLogger(configuration.eventsTableName()));

        var tableName = configuration.eventsTableName();
        var jsonType  = configuration.jsonColumnType().name();
        insertSql = "INSERT INTO " + tableName + " (\n" +
                "        batch_id,\n" +
                "        source_id,\n" +
                "        aggregate_id,\n" +
                "        aggregate_name,\n" +
                "        aggregate_sequence_number,\n" +
                "        data,\n" +
                "        metadata\n" +
                "     ) VALUES (\n" +
                "        :batchId,\n" +
                "        :sourceId,\n" +
                "        :aggregateId,\n" +
                "        :aggregateName,\n" +
                "        :aggregateSequenceNumber,\n" +
                "        :data::" + jsonType + ",\n" +
                "        :metadata::" + jsonType + "\n" +
                "     )";
        loadEventsSql = "SELECT * FROM " + tableName + " WHERE \n" +
                "   aggregate_id = :aggregateId AND\n" +
                "   aggregate_sequence_number BETWEEN :fromSequenceNumber AND :toSequenceNumber\n" +
                "   ORDER BY aggregate_sequence_number ASC";
        loadAllEventsSql = "SELECT * FROM " + tableName + " WHERE \n" +
                "   global_sequence_number >= :fromGlobalSequenceNumber\n" +
                "   ORDER BY global_sequence_number ASC LIMIT :pageSize";
        lastSequenceNumberSql = "SELECT COALESCE(MAX(aggregate_sequence_number), 0) FROM " + tableName + " WHERE aggregate_id = :aggregateId";

        initializeStorage();
    }

    private void initializeStorage() {
        var tableName = configuration.eventsTableName();
        var jsonType  = configuration.jsonColumnType().name();
        jdbi.useTransaction(handle -> {
            var tableExists = handle.select("SELECT to_regclass(?)", tableName)
                                    .mapTo(String.class)
                                    .findOne()
                                    .isPresent();
            if (!tableExists) {
                handle.execute("CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
                                       "            global_sequence_number bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                       "            batch_id text NOT NULL,\n" +
                                       "            source_id text,\n" +
                                       "            aggregate_id text NOT NULL,\n" +
                                       "            aggregate_name text NOT NULL,\n" +
                                       "            aggregate_sequence_number bigint NOT NULL,\n" +
                                       "            data " + jsonType + " NOT NULL,\n" +
                                       "            metadata " + jsonType + " NOT NULL,\n" +
                                       "          UNIQUE (aggregate_id, aggregate_sequence_number)\n" +
                                       "        )");
                log.info("Created the '{}' events table", tableName);
            }
            if (configuration.detectDuplicateSourceIds()) {
                var indexName = tableName + "_aggregate_id_source_id";
                handle.execute("CREATE INDEX IF NOT EXISTS " + indexName + " ON " + tableName + " (aggregate_id, source_id)");
                log.debug("Ensured the '{}' index on events table '{}'", indexName, tableName);
            }
        });
    }

    /**
     * Drop the events table, including all events, and create it again
     */
    public void resetStorage() {
        var tableName = configuration.eventsTableName();
        log.info("Resetting the '{}' events table", tableName);
        jdbi.useHandle(handle -> handle.execute("DROP TABLE IF EXISTS " + tableName));
        initializeStorage();
    }

    public PostgresqlEventPersistenceConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public boolean detectsDuplicateSourceIds() {
        return configuration.detectDuplicateSourceIds();
    }

    @Override
    public Mono<List<CommittedDomainEvent>> commitEvents(Identity<?> id, List<SerializedEvent> serializedEvents) {
        notNull(id, "You must provide an aggregate id");
        notNull(serializedEvents, "You must provide serializedEvents");
        if (serializedEvents.isEmpty()) {
            return Mono.just(List.of());
        }
        return blocking(() -> {
            try {
                return jdbi.inTransaction(handle -> commit(handle, id, serializedEvents));
            } catch (JdbiException e) {
                if (isUniqueViolation(e)) {
                    throw new OptimisticConcurrencyException(msg("Failed to commit {} event(s) for aggregate '{}', the first with aggregate sequence number {}, " +
                                                                         "as another writer has already committed an event with one of the same aggregate sequence numbers",
                                                                 serializedEvents.size(), id, serializedEvents.get(0).aggregateSequenceNumber()), e);
                }
                throw new EventStoreException(msg("Failed to commit {} event(s) for aggregate '{}'", serializedEvents.size(), id), e);
            }
        });
    }

    private List<CommittedDomainEvent> commit(Handle handle, Identity<?> id, List<SerializedEvent> serializedEvents) {
        var lastSequenceNumber = handle.createQuery(lastSequenceNumberSql)
                                       .bind("aggregateId", id.value())
                                       .mapTo(Long.class)
                                       .one();
        verifySequenceNumbers(id, lastSequenceNumber, serializedEvents);

        var firstMetadata = serializedEvents.get(0).metadata();
        var sourceId      = firstMetadata.sourceId();
        if (configuration.detectDuplicateSourceIds() && !sourceId.isNone()) {
            var alreadyCommitted = handle.createQuery("SELECT count(*) FROM " + configuration.eventsTableName() +
                                                              " WHERE aggregate_id = :aggregateId AND source_id = :sourceId")
                                         .bind("aggregateId", id.value())
                                         .bind("sourceId", sourceId.value())
                                         .mapTo(Long.class)
                                         .one();
            if (alreadyCommitted > 0) {
                throw new DuplicateOperationException(msg("Source id '{}' has already been committed for aggregate '{}'", sourceId, id), sourceId);
            }
        }

        var batch = handle.prepareBatch(insertSql);
        for (var serializedEvent : serializedEvents) {
            var metadata = serializedEvent.metadata();
            batch.bind("batchId", metadata.batchId())
                 .bind("sourceId", metadata.sourceId().isNone() ? null : metadata.sourceId().value())
                 .bind("aggregateId", id.value())
                 .bind("aggregateName", metadata.aggregateName())
                 .bind("aggregateSequenceNumber", serializedEvent.aggregateSequenceNumber())
                 .bind("data", serializedEvent.serializedData())
                 .bind("metadata", serializedEvent.serializedMetadata())
                 .add();
        }
        var globalSequenceNumbers = batch.executePreparedBatch("global_sequence_number")
                                         .mapTo(Long.class)
                                         .list();
        if (globalSequenceNumbers.size() != serializedEvents.size()) {
            throw new EventStoreException(msg("Expected {} generated global sequence numbers for aggregate '{}' but got {}",
                                              serializedEvents.size(), id, globalSequenceNumbers.size()));
        }

        var committedEvents = new ArrayList<CommittedDomainEvent>(serializedEvents.size());
        for (var i = 0; i < serializedEvents.size(); i++) {
            var serializedEvent = serializedEvents.get(i);
            committedEvents.add(new CommittedDomainEvent(id.value(),
                                                         serializedEvent.aggregateSequenceNumber(),
                                                         GlobalPosition.of(globalSequenceNumbers.get(i)),
                                                         serializedEvent.serializedData(),
                                                         serializedEvent.serializedMetadata()));
        }
        log.trace("Committed {} event(s) for aggregate '{}' in batch '{}'", committedEvents.size(), id, firstMetadata.batchId());
        return committedEvents;
    }

    /**
     * Concurrent writers that both pass this check are still separated by the unique (aggregate_id, aggregate_sequence_number) constraint
     */
    private static void verifySequenceNumbers(Identity<?> id, long lastSequenceNumber, List<SerializedEvent> serializedEvents) {
        var expectedSequenceNumber = lastSequenceNumber + 1;
        for (var serializedEvent : serializedEvents) {
            if (serializedEvent.aggregateSequenceNumber() != expectedSequenceNumber) {
                throw new OptimisticConcurrencyException(msg("Expected aggregate sequence number {} for aggregate '{}' but got {}, the last committed aggregate sequence number is {}",
                                                             expectedSequenceNumber, id, serializedEvent.aggregateSequenceNumber(), lastSequenceNumber));
            }
            expectedSequenceNumber++;
        }
    }

    @Override
    public Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber) {
        return loadCommittedEvents(id, fromSequenceNumber, Long.MAX_VALUE);
    }

    @Override
    public Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber, long toSequenceNumber) {
        notNull(id, "You must provide an aggregate id");
        return blocking(() -> jdbi.withHandle(handle -> handle.createQuery(loadEventsSql)
                                                              .bind("aggregateId", id.value())
                                                              .bind("fromSequenceNumber", fromSequenceNumber)
                                                              .bind("toSequenceNumber", toSequenceNumber)
                                                              .setFetchSize(configuration.queryFetchSize())
                                                              .map(CommittedDomainEventRowMapper.INSTANCE)
                                                              .list()));
    }

    @Override
    public Mono<AllCommittedEventsPage> loadAllCommittedEvents(GlobalPosition globalPosition, int pageSize) {
        notNull(globalPosition, "You must provide a globalPosition");
        isTrue(pageSize > 0, "pageSize must be positive, was %d", pageSize);
        var fromGlobalSequenceNumber = toGlobalSequenceNumber(globalPosition);
        return blocking(() -> {
            var page = jdbi.withHandle(handle -> handle.createQuery(loadAllEventsSql)
                                                       .bind("fromGlobalSequenceNumber", fromGlobalSequenceNumber)
                                                       .bind("pageSize", pageSize)
                                                       .setFetchSize(Math.min(pageSize, configuration.queryFetchSize()))
                                                       .map(CommittedDomainEventRowMapper.INSTANCE)
                                                       .list());
            var nextGlobalSequenceNumber = page.isEmpty() ?
                                           fromGlobalSequenceNumber :
                                           toGlobalSequenceNumber(page.get(page.size() - 1).globalPosition()) + 1;
            log.debug("Loaded {} event(s) from global sequence number {}. Next global sequence number is {}",
                      page.size(), fromGlobalSequenceNumber, nextGlobalSequenceNumber);
            return new AllCommittedEventsPage(GlobalPosition.of(nextGlobalSequenceNumber), page);
        });
    }

    @Override
    public Mono<Void> deleteEvents(Identity<?> id) {
        notNull(id, "You must provide an aggregate id");
        return blocking(() -> jdbi.withHandle(handle -> handle.createUpdate("DELETE FROM " + configuration.eventsTableName() + " WHERE aggregate_id = :aggregateId")
                                                              .bind("aggregateId", id.value())
                                                              .execute()))
                .doOnNext(rowsDeleted -> log.debug("Deleted {} event(s) for aggregate '{}'", rowsDeleted, id))
                .then();
    }

    private static <T> Mono<T> blocking(Callable<T> callable) {
        return Mono.fromCallable(callable)
                   .subscribeOn(Schedulers.boundedElastic());
    }

    private static long toGlobalSequenceNumber(GlobalPosition globalPosition) {
        if (globalPosition.isStart()) {
            return 1;
        }
        try {
            return Long.parseLong(globalPosition.value());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(msg("Global position '{}' isn't valid", globalPosition), e);
        }
    }

    /**
     * Batch failures are reported by the driver as a {@link java.sql.BatchUpdateException} that links the failure of the
     * individual statement through {@link SQLException#getNextException()}, so both the cause and the next exception chains are searched
     */
    static boolean isUniqueViolation(Throwable throwable) {
        for (var cause : ExceptionUtils.getThrowableList(throwable)) {
            if (cause instanceof SQLException) {
                var sqlException = (SQLException) cause;
                while (sqlException != null) {
                    if (UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                        return true;
                    }
                    sqlException = sqlException.getNextException();
                }
            }
        }
        return false;
    }
}
