package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.core.PermanentException;
import com.acme.cqrs.core.TransientException;
import java.sql.SQLException;
import java.util.Locale;
import org.slf4j.Logger;

/**
 * Translates SQLException into the engine's retry classification: {@link TransientException} for
 * errors worth retrying, {@link PermanentException} for the rest.
 */
public class ExceptionTranslator {

    private static final String UNIQUE_VIOLATION = "23505";

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * @param operation description of the failed operation, used in the message
     * @return the exception to throw
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // unknown errors are retried
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /**
     * True for a primary-key or unique-index violation. Conditional inserts report these as a lost
     * condition rather than an error.
     */
    public static boolean isUniqueViolation(SQLException exception) {
        for (SQLException e = exception; e != null; e = e.getNextException()) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState()) || e.getErrorCode() == 23505) {
                return true;
            }
        }
        return false;
    }

    /**
     * Connection problems (SQLState 08), rollbacks and serialization failures (40), lock and
     * statement timeouts.
     */
    private static boolean isTransientError(SQLException exception) {
        String message = lower(exception.getMessage());
        if (message.contains("timeout") || message.contains("connection refused")
                || message.contains("deadlock") || message.contains("too many connections")
                || message.contains("pool exhausted")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null
                && (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57P03"))) {
            return true;
        }

        // H2: 50200 lock timeout, 90008 general timeout
        int errorCode = exception.getErrorCode();
        return errorCode == 50200 || errorCode == 90008;
    }

    /** Data (22), integrity (23), syntax or access (42) and catalog/schema (3D, 3F) errors. */
    private static boolean isPermanentError(SQLException exception) {
        String message = lower(exception.getMessage());
        if (message.contains("syntax error") || message.contains("not found")
                || message.contains("does not exist") || message.contains("constraint")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        return sqlState != null
                && (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                || sqlState.startsWith("3D") || sqlState.startsWith("3F"));
    }

    private static String lower(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
