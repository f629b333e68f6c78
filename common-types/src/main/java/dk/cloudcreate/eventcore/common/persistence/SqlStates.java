package dk.cloudcreate.eventcore.common.persistence;

import java.sql.SQLException;
import java.util.*;

/**
 * Classifies {@link SQLException}'s found in an exception cause chain
 */
public final class SqlStates {
    public static final String UNIQUE_VIOLATION      = "23505";
    public static final String SERIALIZATION_FAILURE = "40001";
    public static final String DEADLOCK_DETECTED     = "40P01";
    /**
     * H2's vendor code for a row that was concurrently updated by another transaction
     */
    public static final int    H2_CONCURRENT_UPDATE  = 90131;

    private SqlStates() {
    }

    public static Optional<SQLException> findSqlException(Throwable throwable) {
        var visited = Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());
        var current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof SQLException) {
                return Optional.of((SQLException) current);
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    public static boolean isUniqueViolation(Throwable throwable) {
        return findSqlException(throwable).map(e -> UNIQUE_VIOLATION.equals(e.getSQLState()))
                                          .orElse(false);
    }

    /**
     * @return true if the failure was caused by two transactions competing for the same rows
     * (unique key violation, serialization failure, deadlock or concurrent update)
     */
    public static boolean isConcurrentModification(Throwable throwable) {
        return findSqlException(throwable).map(e -> UNIQUE_VIOLATION.equals(e.getSQLState()) ||
                                                       SERIALIZATION_FAILURE.equals(e.getSQLState()) ||
                                                       DEADLOCK_DETECTED.equals(e.getSQLState()) ||
                                                       e.getErrorCode() == H2_CONCURRENT_UPDATE)
                                          .orElse(false);
    }
}
