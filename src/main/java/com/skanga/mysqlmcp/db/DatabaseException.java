package com.skanga.mysqlmcp.db;

import java.sql.SQLException;

/**
 * A classified database failure. The message is the server's own message where one is available,
 * so callers can show it to operators and clients unchanged.
 */
public class DatabaseException extends SQLException {
    private final DatabaseErrorKind kind;

    public DatabaseException(DatabaseErrorKind kind, String message, String sqlState, int vendorCode, Throwable cause) {
        super(message, sqlState, vendorCode, cause);
        this.kind = kind;
    }

    public DatabaseException(DatabaseErrorKind kind, String message) {
        this(kind, message, null, 0, null);
    }

    /**
     * Wraps a failure raised while borrowing a connection or opening the pool.
     */
    public static DatabaseException fromConnectFailure(Throwable failure) {
        return wrap(failure, true);
    }

    /**
     * Wraps a failure raised by a statement on an already borrowed connection.
     */
    public static DatabaseException fromStatementFailure(SQLException failure) {
        return wrap(failure, false);
    }

    private static DatabaseException wrap(Throwable failure, boolean connecting) {
        if (failure instanceof DatabaseException databaseException) {
            return databaseException;
        }
        DatabaseErrorKind kind = DatabaseErrorKind.classify(failure, connecting);
        SQLException vendorException = DatabaseErrorKind.findVendorException(failure);

        String message = vendorException != null ? vendorException.getMessage() : failure.getMessage();
        if (message == null || message.isBlank()) {
            message = failure.getClass().getSimpleName();
        }
        String sqlState = vendorException != null ? vendorException.getSQLState() : null;
        int vendorCode = vendorException != null ? vendorException.getErrorCode() : 0;
        return new DatabaseException(kind, message, sqlState, vendorCode, failure);
    }

    public DatabaseErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "DatabaseException[" + kind + ", code=" + getErrorCode() + ", state=" + getSQLState() + "]: " + getMessage();
    }
}
