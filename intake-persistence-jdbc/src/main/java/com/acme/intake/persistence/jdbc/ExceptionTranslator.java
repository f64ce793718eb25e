package com.acme.intake.persistence.jdbc;

import com.acme.intake.core.IntakeException;
import com.acme.intake.core.PermanentException;
import com.acme.intake.core.TransientException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Locale;
import org.slf4j.Logger;

/**
 * Utility class for translating SQLException to intake exceptions. Decides whether a failed
 * database call is worth retrying (transient) or not (permanent).
 */
public final class ExceptionTranslator {

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either PermanentException or TransientException.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     * @return PermanentException for non-retryable errors, TransientException for retryable ones
     */
    public static IntakeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {} (SQLState={}, code={})", operation,
                originalException.getSQLState(), originalException.getErrorCode(), originalException);

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

        // Unknown errors are retried; the attempt ceiling bounds them
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /**
     * Transient: connection failures, transaction rollbacks (deadlock, serialization), statement
     * or lock timeouts, server shutting down or starting up, pool exhaustion.
     */
    static boolean isTransientError(SQLException exception) {
        if (exception == null) {
            return false;
        }
        if (exception instanceof SQLTimeoutException
                || exception instanceof SQLTransientException
                || exception instanceof SQLRecoverableException) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 08xxx connection exception, 40xxx transaction rollback
            if (sqlState.startsWith("08") || sqlState.startsWith("40")) {
                return true;
            }
            // 57014 query canceled (statement timeout), 57P01-57P03 admin shutdown / cannot connect now
            if (sqlState.equals("57014") || sqlState.equals("57P01") || sqlState.equals("57P02")
                    || sqlState.equals("57P03")) {
                return true;
            }
            // 53xxx insufficient resources (too many connections, out of disk)
            if (sqlState.startsWith("53")) {
                return true;
            }
            // HYT00 timeout expired (H2 lock timeout)
            if (sqlState.equals("HYT00")) {
                return true;
            }
        }

        String message = lowerMessage(exception);
        return message.contains("timeout") || message.contains("timed out")
                || message.contains("connection refused") || message.contains("deadlock")
                || message.contains("too many connections") || message.contains("connection is not available");
    }

    /**
     * Permanent: data exceptions (bad value for a column type), integrity constraint violations,
     * syntax errors and undefined objects, invalid catalog or schema names.
     */
    static boolean isPermanentError(SQLException exception) {
        if (exception == null) {
            return false;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null) {
            // 22 data exception, 23 integrity constraint violation, 42 syntax error or access rule
            // violation, 3D invalid catalog name, 3F invalid schema name
            if (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                    || sqlState.startsWith("3D") || sqlState.startsWith("3F")) {
                return true;
            }
        }

        String message = lowerMessage(exception);
        return message.contains("syntax error") || message.contains("not found")
                || message.contains("does not exist") || message.contains("constraint violation")
                || message.contains("type mismatch");
    }

    private static String lowerMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
