package com.logstuff.storage;

import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classification of PostgreSQL failures by SQLSTATE.
 */
public final class SqlStates {

    public static final String UNDEFINED_TABLE = "42P01";
    public static final String DUPLICATE_TABLE = "42P07";
    public static final String DUPLICATE_OBJECT = "42710";
    public static final String DUPLICATE_FUNCTION = "42723";
    public static final String UNIQUE_VIOLATION = "23505";

    private static final Set<String> DUPLICATE_STATES =
        Set.of(DUPLICATE_TABLE, DUPLICATE_OBJECT, DUPLICATE_FUNCTION, UNIQUE_VIOLATION);

    // serialization_failure, deadlock_detected, admin_shutdown, crash_shutdown, cannot_connect_now
    private static final Set<String> TRANSIENT_STATES = Set.of("40001", "40P01", "57P01", "57P02", "57P03");

    private SqlStates() {
    }

    /**
     * SQLSTATE of the first {@link SQLException} in the cause chain, or null.
     */
    public static String sqlStateOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException && ((SQLException) t).getSQLState() != null) {
                return ((SQLException) t).getSQLState();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    /**
     * True when a create statement lost a race against a concurrent creator of the same object.
     * {@code CREATE TABLE IF NOT EXISTS} can still fail with a unique violation on the catalog
     * when two sessions create the same table at the same moment.
     */
    public static boolean isDuplicateObject(Throwable error) {
        String state = sqlStateOf(error);
        return state != null && DUPLICATE_STATES.contains(state);
    }

    public static boolean isUndefinedTable(Throwable error) {
        return UNDEFINED_TABLE.equals(sqlStateOf(error));
    }

    /**
     * True for SQLSTATE class 22: the values of one statement were rejected, e.g. a NUL
     * character in a jsonb document. Other statements on the same connection are unaffected.
     */
    public static boolean isDataException(Throwable error) {
        String state = sqlStateOf(error);
        return state != null && state.startsWith("22");
    }

    /**
     * True for failures that may succeed when retried on a fresh connection:
     * connection exceptions (class 08), serialization failures, deadlocks and server restarts.
     */
    public static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                || t instanceof RecoverableDataAccessException
                || t instanceof SQLTransientException
                || t instanceof SQLRecoverableException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        String state = sqlStateOf(error);
        return state != null && (state.startsWith("08") || TRANSIENT_STATES.contains(state));
    }

    /**
     * Wrap a store failure in {@link TransientStoreException} or {@link FatalStoreException}.
     */
    public static StoreException classify(String message, Throwable error) {
        if (isTransient(error)) {
            return new TransientStoreException(message, sqlStateOf(error), error);
        }
        return new FatalStoreException(message, sqlStateOf(error), error);
    }
}
