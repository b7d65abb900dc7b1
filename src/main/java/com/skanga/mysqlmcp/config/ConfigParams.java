package com.skanga.mysqlmcp.config;

/**
 * Immutable connection and startup settings for the gateway.
 *
 * @param host                MySQL host name or address
 * @param port                MySQL TCP port
 * @param user                account the gateway connects as
 * @param password            password for {@code user}, may be empty
 * @param database            default database, or {@code null} when none is configured
 * @param maxConnections      upper bound on pooled connections
 * @param connectionTimeoutMs how long a caller waits for a pooled connection
 * @param readOnlyCheck       strategy used to prove the account is read-only
 */
public record ConfigParams(
        String host,
        int port,
        String user,
        String password,
        String database,
        int maxConnections,
        int connectionTimeoutMs,
        VerificationStrategy readOnlyCheck) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 3306;
    public static final String DEFAULT_USER = "root";
    public static final String DEFAULT_PASSWORD = "";
    public static final int DEFAULT_MAX_CONNECTIONS = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MS = 30000;
    // HikariCP rejects shorter connection and validation timeouts
    public static final int MIN_CONNECTION_TIMEOUT_MS = 250;

    public ConfigParams {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.host.empty"));
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.port.range", String.valueOf(port)));
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.max.connections.range", String.valueOf(maxConnections)));
        }
        if (connectionTimeoutMs < MIN_CONNECTION_TIMEOUT_MS) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.connection.timeout.range",
                    String.valueOf(MIN_CONNECTION_TIMEOUT_MS), String.valueOf(connectionTimeoutMs)));
        }
        if (user == null) {
            user = DEFAULT_USER;
        }
        if (password == null) {
            password = DEFAULT_PASSWORD;
        }
        if (database != null && database.isBlank()) {
            database = null;
        }
        if (readOnlyCheck == null) {
            readOnlyCheck = VerificationStrategy.GRANTS;
        }
    }

    /**
     * Settings for a local server with every optional value at its default.
     */
    public static ConfigParams defaultConfig(String host, int port, String user, String password, String database) {
        return new ConfigParams(host, port, user, password, database,
                DEFAULT_MAX_CONNECTIONS, DEFAULT_CONNECTION_TIMEOUT_MS, VerificationStrategy.GRANTS);
    }

    /**
     * JDBC URL for MySQL Connector/J. The default database is appended only when configured.
     */
    public String jdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + (database != null ? database : "");
    }

    /**
     * Host and port as an operator would type them, for diagnostics.
     */
    public String endpoint() {
        return host + ":" + port;
    }

    public String databaseOrNone() {
        return database != null ? database : "(none)";
    }

    @Override
    public String toString() {
        return "ConfigParams[host=" + host + ", port=" + port + ", user=" + user +
                ", password=" + (password.isEmpty() ? "" : "***") +
                ", database=" + databaseOrNone() + ", maxConnections=" + maxConnections +
                ", connectionTimeoutMs=" + connectionTimeoutMs + ", readOnlyCheck=" + readOnlyCheck + "]";
    }
}
