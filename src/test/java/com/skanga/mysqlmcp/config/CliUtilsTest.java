package com.skanga.mysqlmcp.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CliUtilsTest {
    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("mysql.host");
        System.clearProperty("mysql.pass");
    }

    private ConfigParams load(Map<String, String> env, String... args) throws IOException {
        return CliUtils.loadConfiguration(args, env, tempDir.resolve(CliUtils.DOT_ENV_FILE));
    }

    private Path writeFile(String fileName, String content) throws IOException {
        Path filePath = tempDir.resolve(fileName);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
        return filePath;
    }

    @Test
    void testParseArgs_LongFormWithEquals() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"--mysql_host=db.internal", "--mysql_port=3307"});

        assertEquals("db.internal", parsed.get("MYSQL_HOST"));
        assertEquals("3307", parsed.get("MYSQL_PORT"));
    }

    @Test
    void testParseArgs_ShortFormWithSpace() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"-H", "db.internal", "-u", "reader", "-d", "shop"});

        assertEquals("db.internal", parsed.get("MYSQL_HOST"));
        assertEquals("reader", parsed.get("MYSQL_USER"));
        assertEquals("shop", parsed.get("MYSQL_DATABASE"));
    }

    @Test
    void testParseArgs_FlagWithoutValue() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"--verbose", "-r=probe"});

        assertEquals("true", parsed.get("VERBOSE"));
        assertEquals("probe", parsed.get("READONLY_CHECK"));
    }

    @Test
    void testParseArgs_UnknownShortOptionAndStrayArgumentIgnored() {
        Map<String, String> parsed = CliUtils.parseArgs(new String[]{"-x", "stray", "-P=3310"});

        assertEquals(1, parsed.size());
        assertEquals("3310", parsed.get("MYSQL_PORT"));
    }

    @Test
    void testLoadConfiguration_Defaults() throws IOException {
        ConfigParams config = load(Map.of());

        assertEquals("127.0.0.1", config.host());
        assertEquals(3306, config.port());
        assertEquals("root", config.user());
        assertEquals("", config.password());
        assertNull(config.database());
        assertEquals(10, config.maxConnections());
        assertEquals(30000, config.connectionTimeoutMs());
        assertEquals(VerificationStrategy.GRANTS, config.readOnlyCheck());
    }

    @Test
    void testLoadConfiguration_EnvironmentOnly() throws IOException {
        ConfigParams config = load(Map.of(
                "MYSQL_HOST", "db.internal",
                "MYSQL_PORT", "3307",
                "MYSQL_USER", "reader",
                "MYSQL_PASSWORD", "secret",
                "MYSQL_DATABASE", "shop"));

        assertEquals("db.internal", config.host());
        assertEquals(3307, config.port());
        assertEquals("reader", config.user());
        assertEquals("secret", config.password());
        assertEquals("shop", config.database());
    }

    @Test
    void testLoadConfiguration_CliBeatsConfigFileBeatsEnvironmentBeatsDotEnv() throws IOException {
        writeFile(".env", """
                MYSQL_HOST=dotenv-host
                MYSQL_USER=dotenv-user
                MYSQL_PASSWORD=dotenv-pass
                MYSQL_DATABASE=dotenv-db
                """);
        Path configFile = writeFile("gateway.conf", """
                MYSQL_HOST=file-host
                MYSQL_USER=file-user
                """);
        Map<String, String> env = Map.of(
                "MYSQL_HOST", "env-host",
                "MYSQL_USER", "env-user",
                "MYSQL_PASSWORD", "env-pass");

        ConfigParams config = load(env, "--config_file=" + configFile, "--mysql_host=cli-host");

        assertEquals("cli-host", config.host());
        assertEquals("file-user", config.user());
        assertEquals("env-pass", config.password());
        assertEquals("dotenv-db", config.database());
    }

    @Test
    void testLoadConfiguration_AliasesAccepted() throws IOException {
        ConfigParams config = load(Map.of("MYSQL_PASS", "aliased", "MYSQL_DB", "shop"));

        assertEquals("aliased", config.password());
        assertEquals("shop", config.database());
    }

    @Test
    void testLoadConfiguration_PrimaryNameBeatsAliasInSameSource() throws IOException {
        ConfigParams config = load(Map.of("MYSQL_PASSWORD", "primary", "MYSQL_PASS", "alias"));

        assertEquals("primary", config.password());
    }

    @Test
    void testLoadConfiguration_HigherSourceAliasBeatsLowerSourcePrimary() throws IOException {
        writeFile(".env", "MYSQL_DATABASE=from-dotenv\n");

        ConfigParams config = load(Map.of("MYSQL_DB", "from-env"));

        assertEquals("from-env", config.database());
    }

    @Test
    void testLoadConfiguration_SystemPropertyIsLowestSource() throws IOException {
        System.setProperty("mysql.host", "sysprop-host");

        assertEquals("sysprop-host", load(Map.of()).host());
        assertEquals("env-host", load(Map.of("MYSQL_HOST", "env-host")).host());
    }

    @Test
    void testLoadConfiguration_SystemPropertyAlias() throws IOException {
        System.setProperty("mysql.pass", "from-property");

        assertEquals("from-property", load(Map.of()).password());
    }

    @Test
    void testLoadConfiguration_BlankDatabaseMeansNone() throws IOException {
        assertNull(load(Map.of("MYSQL_DATABASE", "  ")).database());
    }

    @Test
    void testLoadConfiguration_PoolSettingsAndStrategy() throws IOException {
        ConfigParams config = load(Map.of(), "-C", "4", "-t", "2500", "--readonly_check", "PROBE");

        assertEquals(4, config.maxConnections());
        assertEquals(2500, config.connectionTimeoutMs());
        assertEquals(VerificationStrategy.PROBE, config.readOnlyCheck());
    }

    @Test
    void testLoadConfiguration_NonNumericPortNamesTheSetting() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> load(Map.of("MYSQL_PORT", "abc")));

        assertThat(exception.getMessage()).contains("MYSQL_PORT").contains("abc");
    }

    @Test
    void testLoadConfiguration_PortOutOfRangeNamesTheSetting() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> load(Map.of(), "--mysql_port=70000"));

        assertThat(exception.getMessage()).contains("MYSQL_PORT").contains("70000");
    }

    @Test
    void testLoadConfiguration_ShortConnectionTimeoutNamesTheSetting() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> load(Map.of(), "-t", "100"));

        assertThat(exception.getMessage()).contains("CONNECTION_TIMEOUT_MS").contains("100");
    }

    @Test
    void testLoadConfiguration_InvalidStrategyNamesTheSetting() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> load(Map.of("READONLY_CHECK", "maybe")));

        assertThat(exception.getMessage()).contains("READONLY_CHECK").contains("maybe");
    }

    @Test
    void testLoadConfiguration_MissingConfigFile() {
        Path missingFile = tempDir.resolve("missing.conf");

        IOException exception = assertThrows(IOException.class,
                () -> load(Map.of(), "--config_file=" + missingFile));

        assertThat(exception.getMessage()).contains("missing.conf");
    }

    @Test
    void testLoadConfiguration_NullEnvironmentAndDotEnvPath() throws IOException {
        ConfigParams config = CliUtils.loadConfiguration(new String[]{"-u", "reader"}, null, null);

        assertEquals("reader", config.user());
    }

    @Test
    void testLoadConfigFile_CommentsExportAndQuotes() throws IOException {
        Path configFile = writeFile("settings.env", """
                # connection
                export MYSQL_HOST=db.internal

                mysql_user = 'reader'
                MYSQL_PASSWORD="p@ss=word"
                not a setting
                =orphan
                """);

        Map<String, String> configMap = CliUtils.loadConfigFile(configFile);

        assertEquals(Map.of(
                "MYSQL_HOST", "db.internal",
                "MYSQL_USER", "reader",
                "MYSQL_PASSWORD", "p@ss=word"), new HashMap<>(configMap));
    }

    @Test
    void testHandleHelpAndVersion() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));

            assertTrue(CliUtils.handleHelpAndVersion(new String[]{"--help"}));
            assertTrue(CliUtils.handleHelpAndVersion(new String[]{"-v"}));
            assertFalse(CliUtils.handleHelpAndVersion(new String[]{"--mysql_host=db"}));
        } finally {
            System.setOut(originalOut);
        }

        String output = captured.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("--mysql_host").contains("--readonly_check");
        assertThat(output).contains("MCP Protocol Version: 2025-11-25");
    }
}
