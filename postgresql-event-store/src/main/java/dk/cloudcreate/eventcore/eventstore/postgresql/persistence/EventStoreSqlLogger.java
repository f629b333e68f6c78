package dk.cloudcreate.eventcore.eventstore.postgresql.persistence;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Jdbi {@link SqlLogger} that logs statement execution times at TRACE and failed statements at ERROR
 * using the <code>EventStore.Sql</code> logger
 */
public class EventStoreSqlLogger implements SqlLogger {
    private final Logger log;

    public EventStoreSqlLogger() {
        log = LoggerFactory.getLogger("EventStore.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        var failedAfter = context.getExecutionMoment() != null && context.getExceptionMoment() != null ?
                          Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis() : -1;
        log.error(msg("Failed Execution time: {} ms - {}", failedAfter, context.getRenderedSql()), ex);
    }
}
