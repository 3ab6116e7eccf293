package dk.cloudcreate.eventledger.eventstore.postgresql;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Logs the rendered SQL and execution time of the statements issued by the {@link PostgresqlEventPersistence}
 * to the <code>EventPersistence.Sql</code> logger.<br>
 * A unique violation on the events table is the expected outcome of two writers committing to the same aggregate
 * and is logged at debug level, as it surfaces to the caller as an optimistic concurrency conflict.
 */
public final class EventPersistenceSqlLogger implements SqlLogger {
    private final Logger log;
    private final String eventsTableName;

    public EventPersistenceSqlLogger(String eventsTableName) {
        this.eventsTableName = notBlank(eventsTableName, "You must provide an eventsTableName");
        log = LoggerFactory.getLogger("EventPersistence.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("[{}] Execution time: {} ms - {}", eventsTableName, Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        var executionTime = Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis();
        if (PostgresqlEventPersistence.isUniqueViolation(ex)) {
            log.debug("[{}] Concurrent commit rejected by the aggregate sequence number constraint after {} ms - {}", eventsTableName, executionTime, context.getRenderedSql());
            return;
        }
        log.error(msg("[{}] Failed Execution time: {} ms - {}", eventsTableName, executionTime, context.getRenderedSql()), ex);
    }
}
