package com.skanga.mysqlmcp.db;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

/**
 * Classification of a database failure, derived from MySQL vendor codes, SQLStates and the cause chain.
 */
public enum DatabaseErrorKind {
    CONNECTION_REFUSED,
    ACCESS_DENIED,
    UNKNOWN_DATABASE,
    PERMISSION_DENIED,
    SQL_ERROR;

    static final int ER_DBACCESS_DENIED_ERROR = 1044;
    static final int ER_ACCESS_DENIED_ERROR = 1045;
    static final int ER_BAD_DB_ERROR = 1049;
    static final int ER_TABLEACCESS_DENIED_ERROR = 1142;
    static final int ER_COLUMNACCESS_DENIED_ERROR = 1143;
    static final int ER_SPECIFIC_ACCESS_DENIED_ERROR = 1227;
    static final int ER_PROCACCESS_DENIED_ERROR = 1370;

    private static final Set<Integer> PERMISSION_CODES = Set.of(
            ER_DBACCESS_DENIED_ERROR, ER_TABLEACCESS_DENIED_ERROR, ER_COLUMNACCESS_DENIED_ERROR,
            ER_SPECIFIC_ACCESS_DENIED_ERROR, ER_PROCACCESS_DENIED_ERROR);

    /**
     * Classifies a failure.
     *
     * @param failure    the exception raised by the driver or the pool
     * @param connecting true when the failure happened while acquiring a connection,
     *                   where a database-level denial means the login itself was refused
     */
    public static DatabaseErrorKind classify(Throwable failure, boolean connecting) {
        if (hasNetworkCause(failure)) {
            return CONNECTION_REFUSED;
        }

        SQLException sqlException = findVendorException(failure);
        if (sqlException == null) {
            return SQL_ERROR;
        }

        int vendorCode = sqlException.getErrorCode();
        if (vendorCode == ER_ACCESS_DENIED_ERROR) {
            return ACCESS_DENIED;
        }
        if (vendorCode == ER_DBACCESS_DENIED_ERROR && connecting) {
            return ACCESS_DENIED;
        }
        if (vendorCode == ER_BAD_DB_ERROR) {
            return UNKNOWN_DATABASE;
        }
        if (PERMISSION_CODES.contains(vendorCode)) {
            return PERMISSION_DENIED;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            return CONNECTION_REFUSED;
        }
        String message = sqlException.getMessage();
        if ("42000".equals(sqlState) && message != null && message.toLowerCase(Locale.ROOT).contains("denied")) {
            return PERMISSION_DENIED;
        }
        return SQL_ERROR;
    }

    private static boolean hasNetworkCause(Throwable failure) {
        for (Throwable current = failure; current != null; current = nextCause(current)) {
            if (current instanceof ConnectException ||
                    current instanceof UnknownHostException ||
                    current instanceof NoRouteToHostException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the SQLException that carries the server's answer. Pool wrappers carry no vendor code,
     * so the first exception in the chain with one wins, falling back to the outermost SQLException.
     */
    static SQLException findVendorException(Throwable failure) {
        SQLException outermost = null;
        for (Throwable current = failure; current != null; current = nextCause(current)) {
            if (current instanceof SQLException sqlException) {
                if (sqlException.getErrorCode() != 0) {
                    return sqlException;
                }
                if (outermost == null) {
                    outermost = sqlException;
                }
            }
        }
        return outermost;
    }

    private static Throwable nextCause(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
