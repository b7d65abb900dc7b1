package com.skanga.mysqlmcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.mysqlmcp.config.ConfigParams;
import com.skanga.mysqlmcp.config.VerificationStrategy;
import com.skanga.mysqlmcp.security.StartupFault;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
class McpServerContainerTest {
    private static final String ROOT_PASSWORD = "test";

    // Native password auth lets the test accounts log in without RSA key retrieval
    @Container
    static MySQLContainer<?> mysqlContainer = new MySQLContainer<>("mysql:8.0")
            .withUsername("root")
            .withPassword(ROOT_PASSWORD)
            .withCommand("--default-authentication-plugin=mysql_native_password")
            .withStartupTimeout(Duration.ofMinutes(3))
            .withTmpFs(Map.of("/var/lib/mysql", "rw"));

    private final ObjectMapper objectMapper = JsonUtils.objectMapper();

    @BeforeAll
    static void setupAccountsAndData() throws Exception {
        String rootUrl = "jdbc:mysql://" + mysqlContainer.getHost() + ":" +
                mysqlContainer.getMappedPort(MySQLContainer.MYSQL_PORT) + "/";
        try (Connection conn = DriverManager.getConnection(rootUrl, "root", ROOT_PASSWORD);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE DATABASE app");
            stmt.execute("""
                CREATE TABLE app.users (
                    id INT PRIMARY KEY,
                    name VARCHAR(100) NOT NULL,
                    email VARCHAR(255),
                    created_at DATETIME DEFAULT CURRENT_TIMESTAMP
                )
                """);
            stmt.execute("INSERT INTO app.users (id, name, email) VALUES (1, 'Ada', 'ada@example.com'), (2, 'Linus', NULL)");

            stmt.execute("CREATE USER 'reader'@'%' IDENTIFIED BY 'reader-pw'");
            stmt.execute("GRANT SELECT, SHOW VIEW ON app.* TO 'reader'@'%'");

            stmt.execute("CREATE USER 'writer'@'%' IDENTIFIED BY 'writer-pw'");
            stmt.execute("GRANT ALL PRIVILEGES ON app.* TO 'writer'@'%'");
        }
    }

    private static ConfigParams config(String user, String password, String database, VerificationStrategy strategy) {
        return new ConfigParams(mysqlContainer.getHost(), mysqlContainer.getMappedPort(MySQLContainer.MYSQL_PORT),
                user, password, database, 4, 10000, strategy);
    }

    private JsonNode call(McpServer server, String requestJson) throws Exception {
        return server.handleRequest(objectMapper.readTree(requestJson));
    }

    @Test
    @DisplayName("Read-only account serves catalog and queries end-to-end")
    void shouldServeReadOnlyAccountEndToEnd() throws Exception {
        McpServer server = McpServer.startServer(config("reader", "reader-pw", "app", VerificationStrategy.GRANTS));
        try {
            TestUtils.initializeServer(server, objectMapper);

            JsonNode resources = call(server, """
                {"jsonrpc": "2.0", "id": 2, "method": "resources/list"}
                """).path("result").path("resources");
            assertThat(resources).hasSize(1);
            assertThat(resources.get(0).path("uri").asText()).isEqualTo("mysql://app/users");
            assertThat(resources.get(0).path("name").asText()).isEqualTo("app.users");

            JsonNode readResponse = call(server, """
                {"jsonrpc": "2.0", "id": 3, "method": "resources/read", "params": {"uri": "mysql://app/users"}}
                """);
            JsonNode columns = objectMapper.readTree(
                    readResponse.path("result").path("contents").get(0).path("text").asText());
            assertThat(columns).hasSize(4);
            assertThat(columns.get(0).path("column_name").asText()).isEqualTo("id");
            assertThat(columns.get(0).path("column_key").asText()).isEqualTo("PRI");
            assertThat(columns.get(1).path("is_nullable").asText()).isEqualTo("NO");
            assertThat(columns.get(2).path("is_nullable").asText()).isEqualTo("YES");

            JsonNode queryResult = call(server, """
                {"jsonrpc": "2.0", "id": 4, "method": "tools/call",
                 "params": {"name": "mysql_query", "arguments": {"sql": "SELECT id, name FROM app.users ORDER BY id"}}}
                """).path("result");
            assertThat(queryResult.path("isError").asBoolean()).isFalse();
            JsonNode report = objectMapper.readTree(queryResult.path("content").get(0).path("text").asText());
            assertThat(report.path("rows")).hasSize(2);
            assertThat(report.path("rows").get(0).path("name").asText()).isEqualTo("Ada");
            assertThat(report.path("elapsed_ms").asText()).matches("\\d+\\.\\d");
        } finally {
            server.shutdown();
        }
    }

    @Test
    @DisplayName("Writes by the read-only account come back as tool errors")
    void shouldReportDeniedWriteAsToolError() throws Exception {
        McpServer server = McpServer.startServer(config("reader", "reader-pw", "app", VerificationStrategy.GRANTS));
        try {
            TestUtils.initializeServer(server, objectMapper);

            JsonNode response = call(server, """
                {"jsonrpc": "2.0", "id": 5, "method": "tools/call",
                 "params": {"name": "mysql_query", "arguments": {"sql": "INSERT INTO app.users (id, name) VALUES (3, 'Mallory')"}}}
                """);

            assertThat(response.has("error")).isFalse();
            assertThat(response.path("result").path("isError").asBoolean()).isTrue();
            assertThat(response.path("result").path("content").get(0).path("text").asText())
                    .startsWith("SQL Error: ")
                    .contains("denied");
        } finally {
            server.shutdown();
        }
    }

    @Test
    @DisplayName("Write probe passes for the read-only account")
    void shouldPassProbeForReadOnlyAccount() throws Exception {
        McpServer server = McpServer.startServer(config("reader", "reader-pw", "app", VerificationStrategy.PROBE));
        server.shutdown();
    }

    @Test
    @DisplayName("Account with write grants is refused at startup")
    void shouldRefuseWriterByGrants() {
        StartupFault startupFault = TestUtils.withSuppressedLogging(() -> assertThrows(StartupFault.class,
                () -> McpServer.startServer(config("writer", "writer-pw", "app", VerificationStrategy.GRANTS))));

        assertThat(startupFault.getKind()).isEqualTo(StartupFault.Kind.POLICY);
        assertThat(startupFault.getGrants()).anyMatch(grant -> grant.contains("ALL PRIVILEGES"));
    }

    @Test
    @DisplayName("Account able to create tables is refused by the write probe")
    void shouldRefuseWriterByProbe() {
        StartupFault startupFault = TestUtils.withSuppressedLogging(() -> assertThrows(StartupFault.class,
                () -> McpServer.startServer(config("writer", "writer-pw", "app", VerificationStrategy.PROBE))));

        assertThat(startupFault.getKind()).isEqualTo(StartupFault.Kind.POLICY);
    }

    @Test
    @DisplayName("Wrong password is an authentication fault")
    void shouldReportWrongPassword() {
        StartupFault startupFault = TestUtils.withSuppressedLogging(() -> assertThrows(StartupFault.class,
                () -> McpServer.startServer(config("reader", "wrong", "app", VerificationStrategy.GRANTS))));

        assertThat(startupFault.getKind()).isEqualTo(StartupFault.Kind.AUTHENTICATION);
        assertThat(startupFault.getMessage()).contains("Access denied");
    }

    @Test
    @DisplayName("Missing database is a schema fault")
    void shouldReportUnknownDatabase() {
        StartupFault startupFault = TestUtils.withSuppressedLogging(() -> assertThrows(StartupFault.class,
                () -> McpServer.startServer(config("root", ROOT_PASSWORD, "no_such_db", VerificationStrategy.GRANTS))));

        assertThat(startupFault.getKind()).isEqualTo(StartupFault.Kind.SCHEMA);
    }
}
