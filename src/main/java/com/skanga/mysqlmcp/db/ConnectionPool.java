package com.skanga.mysqlmcp.db;

import com.skanga.mysqlmcp.config.ConfigParams;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded pool of MySQL connections with a single "run SQL, get rows or a classified error" operation.
 * We use <a href="https://github.com/brettwooldridge/HikariCP">HikariCP</a> for pooling; callers that find
 * every connection busy wait up to the configured connection timeout.
 * This class is thread-safe.
 */
public class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);
    static final String MYSQL_DRIVER = "com.mysql.cj.jdbc.Driver";
    static final String POOL_NAME = "MySqlMcpPool";

    private final HikariDataSource dataSource;

    /**
     * Wraps an already configured data source. Useful for tests or when the pool is managed elsewhere.
     *
     * @param dataSource Pre-configured HikariDataSource
     */
    public ConnectionPool(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Opens a pool against the configured MySQL endpoint. One connection is established eagerly so
     * that unreachable servers, bad credentials and unknown databases are reported before any request is served.
     *
     * @param configParams connection settings
     * @return an open pool
     * @throws DatabaseException classified failure of the first connection attempt
     */
    public static ConnectionPool open(ConfigParams configParams) throws DatabaseException {
        HikariConfig poolConfig = createPoolConfig(configParams);
        logger.info("Initializing connection pool for {} as {} (database: {}, max connections: {}, timeout: {}ms)",
                configParams.endpoint(), configParams.user(), configParams.databaseOrNone(),
                configParams.maxConnections(), configParams.connectionTimeoutMs());
        try {
            return new ConnectionPool(new HikariDataSource(poolConfig));
        } catch (HikariPool.PoolInitializationException e) {
            Throwable failure = e.getCause() != null ? e.getCause() : e;
            logger.debug("Connection pool initialization failed", e);
            throw DatabaseException.fromConnectFailure(failure);
        }
    }

    static HikariConfig createPoolConfig(ConfigParams configParams) {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(configParams.jdbcUrl());
        poolConfig.setUsername(configParams.user());
        poolConfig.setPassword(configParams.password());
        poolConfig.setDriverClassName(MYSQL_DRIVER);
        poolConfig.setMaximumPoolSize(configParams.maxConnections());
        poolConfig.setMinimumIdle(1);
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setValidationTimeout(Math.min(5000, configParams.connectionTimeoutMs()));
        // Fail on the first attempt instead of retrying until the timeout
        poolConfig.setInitializationFailTimeout(1);
        poolConfig.setPoolName(POOL_NAME);

        poolConfig.addDataSourceProperty("cachePrepStmts", "true");
        poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
        poolConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        poolConfig.addDataSourceProperty("useLocalSessionState", "true");
        poolConfig.addDataSourceProperty("cacheServerConfiguration", "true");
        poolConfig.addDataSourceProperty("elideSetAutoCommits", "true");
        poolConfig.addDataSourceProperty("maintainTimeStats", "false");
        return poolConfig;
    }

    /**
     * Executes one statement on a pooled connection. The connection goes back to the pool whatever the outcome.
     *
     * @param sqlQuery  SQL text, may contain {@code ?} placeholders
     * @param paramList positional values for the placeholders, or an empty list
     * @return the rows produced, or a single {@code affected_rows} row for statements without a result set
     * @throws DatabaseException classified failure
     */
    public QueryRows execute(String sqlQuery, List<Object> paramList) throws DatabaseException {
        Connection dbConn = borrowConnection();
        try (dbConn) {
            if (paramList == null || paramList.isEmpty()) {
                try (Statement stmt = dbConn.createStatement()) {
                    return readResults(stmt, stmt.execute(sqlQuery));
                }
            }
            try (PreparedStatement prepStmt = dbConn.prepareStatement(sqlQuery)) {
                for (int i = 0; i < paramList.size(); i++) {
                    setParameterValue(prepStmt, i + 1, paramList.get(i));
                }
                return readResults(prepStmt, prepStmt.execute());
            }
        } catch (SQLException e) {
            DatabaseException failure = DatabaseException.fromStatementFailure(e);
            logger.debug("Statement failed ({}, code {}): {}", failure.getKind(), failure.getErrorCode(), failure.getMessage());
            throw failure;
        }
    }

    private Connection borrowConnection() throws DatabaseException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            DatabaseException failure = DatabaseException.fromConnectFailure(e);
            logger.warn("Could not obtain a connection ({}): {}", failure.getKind(), failure.getMessage());
            throw failure;
        }
    }

    public QueryRows execute(String sqlQuery) throws DatabaseException {
        return execute(sqlQuery, List.of());
    }

    private QueryRows readResults(Statement stmt, boolean isResultSet) throws SQLException {
        if (!isResultSet) {
            return QueryRows.affectedRows(stmt.getUpdateCount());
        }

        try (ResultSet resultSet = stmt.getResultSet()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();

            List<String> resultColumns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                resultColumns.add(metaData.getColumnLabel(i));
            }

            List<Map<String, Object>> resultRows = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> currRow = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    currRow.put(resultColumns.get(i - 1), resultSet.getObject(i));
                }
                resultRows.add(Collections.unmodifiableMap(currRow));
            }
            return new QueryRows(resultColumns, resultRows);
        }
    }

    private void setParameterValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, java.sql.Types.NULL);
        } else if (paramValue instanceof String stringValue) {
            prepStmt.setString(paramIndex, stringValue);
        } else if (paramValue instanceof Integer intValue) {
            prepStmt.setInt(paramIndex, intValue);
        } else if (paramValue instanceof Long longValue) {
            prepStmt.setLong(paramIndex, longValue);
        } else if (paramValue instanceof Double doubleValue) {
            prepStmt.setDouble(paramIndex, doubleValue);
        } else if (paramValue instanceof Boolean boolValue) {
            prepStmt.setBoolean(paramIndex, boolValue);
        } else if (paramValue instanceof BigDecimal decimalValue) {
            prepStmt.setBigDecimal(paramIndex, decimalValue);
        } else {
            prepStmt.setObject(paramIndex, paramValue);
        }
    }

    /**
     * Number of connections currently borrowed from the pool.
     */
    public int activeConnections() {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        return poolBean != null ? poolBean.getActiveConnections() : 0;
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /**
     * Closes every pooled connection. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.info("Database connection pool closed");
        }
    }
}
