package com.skanga.mysqlmcp.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseExceptionTest {

    @ParameterizedTest
    @CsvSource({
            "1045, 28000, true,  ACCESS_DENIED",
            "1045, 28000, false, ACCESS_DENIED",
            "1044, 42000, true,  ACCESS_DENIED",
            "1044, 42000, false, PERMISSION_DENIED",
            "1049, 42000, true,  UNKNOWN_DATABASE",
            "1049, 42000, false, UNKNOWN_DATABASE",
            "1142, 42000, false, PERMISSION_DENIED",
            "1143, 42000, false, PERMISSION_DENIED",
            "1227, 42000, false, PERMISSION_DENIED",
            "1370, 42000, false, PERMISSION_DENIED",
            "1064, 42000, false, SQL_ERROR",
            "1146, 42S02, false, SQL_ERROR",
            "0,    08S01, true,  CONNECTION_REFUSED",
            "0,    08001, false, CONNECTION_REFUSED"
    })
    void testClassify_VendorCodesAndStates(int vendorCode, String sqlState, boolean connecting,
                                           DatabaseErrorKind expected) {
        SQLException failure = new SQLException("server said no", sqlState, vendorCode);

        assertEquals(expected, DatabaseErrorKind.classify(failure, connecting));
    }

    @Test
    void testClassify_NetworkCauseAnywhereInChain() {
        SQLException communicationsFailure = new SQLException("Communications link failure", "08S01", 0,
                new IOException("socket", new ConnectException("Connection refused")));

        assertEquals(DatabaseErrorKind.CONNECTION_REFUSED, DatabaseErrorKind.classify(communicationsFailure, true));
        assertEquals(DatabaseErrorKind.CONNECTION_REFUSED,
                DatabaseErrorKind.classify(new RuntimeException(new UnknownHostException("nowhere")), true));
    }

    @Test
    void testClassify_DeniedMessageWithoutVendorCode() {
        SQLException failure = new SQLException("CREATE command denied to user 'r'@'%'", "42000", 0);

        assertEquals(DatabaseErrorKind.PERMISSION_DENIED, DatabaseErrorKind.classify(failure, false));
    }

    @Test
    void testClassify_NonSqlFailure() {
        assertEquals(DatabaseErrorKind.SQL_ERROR, DatabaseErrorKind.classify(new IllegalStateException("odd"), false));
    }

    @Test
    void testFromConnectFailure_UsesInnerVendorExceptionBehindPoolWrapper() {
        SQLException loginFailure = new SQLException("Access denied for user 'reader'@'%' (using password: YES)",
                "28000", 1045);
        SQLTransientConnectionException poolTimeout = new SQLTransientConnectionException(
                "MySqlMcpPool - Connection is not available, request timed out after 1000ms.", "28000", loginFailure);

        DatabaseException databaseException = DatabaseException.fromConnectFailure(poolTimeout);

        assertEquals(DatabaseErrorKind.ACCESS_DENIED, databaseException.getKind());
        assertEquals("Access denied for user 'reader'@'%' (using password: YES)", databaseException.getMessage());
        assertEquals(1045, databaseException.getErrorCode());
        assertEquals("28000", databaseException.getSQLState());
        assertSame(poolTimeout, databaseException.getCause());
    }

    @Test
    void testFromConnectFailure_PoolTimeoutWithoutCause() {
        SQLTransientConnectionException poolTimeout = new SQLTransientConnectionException(
                "MySqlMcpPool - Connection is not available, request timed out after 250ms.");

        DatabaseException databaseException = DatabaseException.fromConnectFailure(poolTimeout);

        assertEquals(DatabaseErrorKind.SQL_ERROR, databaseException.getKind());
        assertEquals(poolTimeout.getMessage(), databaseException.getMessage());
    }

    @Test
    void testFromStatementFailure_PassesThroughClassifiedException() {
        DatabaseException original = new DatabaseException(DatabaseErrorKind.PERMISSION_DENIED, "denied");

        assertSame(original, DatabaseException.fromStatementFailure(original));
    }

    @Test
    void testWrap_FallsBackToClassNameWhenMessageMissing() {
        DatabaseException databaseException = DatabaseException.fromConnectFailure(new IllegalStateException());

        assertEquals("IllegalStateException", databaseException.getMessage());
        assertEquals(0, databaseException.getErrorCode());
        assertNull(databaseException.getSQLState());
    }
}
