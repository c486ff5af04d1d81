package com.ivamare.callsession.exception;

import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Classifies storage constraint violations so they can be re-raised as domain
 * errors instead of generic internal failures.
 *
 * <p>The schema encodes the temporal invariants as named check constraints:
 * <ul>
 *   <li>{@value #VALID_SESSION_TIMES} - {@code ended_at >= started_at}</li>
 *   <li>{@value #VALID_EVENT_TIME} - {@code event_time} within the trailing year</li>
 * </ul>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class ConstraintViolationClassifier {

    public static final String VALID_SESSION_TIMES = "valid_session_times";
    public static final String VALID_EVENT_TIME = "valid_event_time";

    /** Class 23 - check_violation */
    static final String CHECK_VIOLATION = "23514";

    /** Class 23 - unique_violation */
    static final String UNIQUE_VIOLATION = "23505";

    private ConstraintViolationClassifier() {
        // Utility class - no instantiation
    }

    /**
     * Determine whether the exception was caused by the named check constraint.
     *
     * <p>Matches on the check-violation SQL state when the driver exposes one,
     * and on the constraint name in the message otherwise.
     *
     * @param ex the exception to classify
     * @param constraintName the check constraint name
     * @return true if the named constraint was violated
     */
    public static boolean isCheckViolation(Throwable ex, String constraintName) {
        if (ex == null) {
            return false;
        }

        String needle = constraintName.toLowerCase(Locale.ROOT);
        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            boolean checkState = sqlState == null || CHECK_VIOLATION.equals(sqlState);
            if (checkState && mentions(sqlEx, needle)) {
                return true;
            }
        } else if (mentions(ex, needle)) {
            return true;
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isCheckViolation(cause, constraintName);
        }
        return false;
    }

    /**
     * Determine whether the exception is a unique-key violation.
     *
     * @param ex the exception to classify
     * @return true for duplicate key errors
     */
    public static boolean isUniqueViolation(Throwable ex) {
        if (ex == null) {
            return false;
        }
        if (ex instanceof DuplicateKeyException) {
            return true;
        }
        if (ex instanceof SQLException sqlEx && UNIQUE_VIOLATION.equals(sqlEx.getSQLState())) {
            return true;
        }
        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isUniqueViolation(cause);
        }
        return false;
    }

    private static boolean mentions(Throwable ex, String needle) {
        String message = ex.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(needle);
    }
}
