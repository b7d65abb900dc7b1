package com.skanga.mysqlmcp.config;

import com.skanga.mysqlmcp.McpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Utility class for handling command line interface operations.
 * Provides argument parsing, help and version display, and layered configuration loading.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "mysql";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "Read-only MySQL gateway for the Model Context Protocol";

    static final String DOT_ENV_FILE = ".env";

    // Secondary names accepted for the same setting
    private static final Map<String, List<String>> KEY_ALIASES = Map.of(
            "MYSQL_PASSWORD", List.of("MYSQL_PASS"),
            "MYSQL_DATABASE", List.of("MYSQL_DB"));

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("h", "help");
        shortToLong.put("v", "version");
        shortToLong.put("c", "config_file");

        // Database connection
        shortToLong.put("H", "mysql_host");
        shortToLong.put("P", "mysql_port");
        shortToLong.put("u", "mysql_user");
        shortToLong.put("w", "mysql_password");
        shortToLong.put("d", "mysql_database");

        // Pool and startup checks
        shortToLong.put("C", "max_connections");
        shortToLong.put("t", "connection_timeout_ms");
        shortToLong.put("r", "readonly_check");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports short (-u) and long (--mysql_user) forms, each as key=value, key value, or a bare flag.
     * Keys are upper-cased for consistent lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey = null;
            String argValue;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);
                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    argKey = argParts[0];
                    argValue = argParts[1];
                } else {
                    argKey = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);
                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    argKey = shortToLong.get(argParts[0]);
                    argValue = argParts[1];
                } else {
                    argKey = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
                if (argKey == null) {
                    logger.warn("Ignoring unknown option: {}", currArg);
                }
            } else {
                logger.warn("Ignoring stray argument: {}", currArg);
                continue;
            }

            if (argKey != null) {
                argsMap.put(argKey.toUpperCase(Locale.ROOT), argValue);
            }
        }

        return argsMap;
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        System.out.println(SERVER_NAME + " MCP server v" + SERVER_VERSION);
        System.out.println("Usage: java -jar mysql-mcp-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("ARGUMENT FORMATS:");
        System.out.println("    -k=value  or  --key=value");
        System.out.println("    -k value  or  --key value");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                         Show this help message and exit");
        System.out.println("  -v, --version                      Show version information and exit");
        System.out.println("  -c, --config_file=<path>           Load KEY=VALUE settings from file");
        System.out.println();
        System.out.println("DATABASE CONNECTION:");
        System.out.println("  -H, --mysql_host=<host>            MySQL host (default: " + ConfigParams.DEFAULT_HOST + ")");
        System.out.println("  -P, --mysql_port=<port>            MySQL port (default: " + ConfigParams.DEFAULT_PORT + ")");
        System.out.println("  -u, --mysql_user=<user>            MySQL user (default: " + ConfigParams.DEFAULT_USER + ")");
        System.out.println("  -w, --mysql_password=<password>    MySQL password (default: empty, alias MYSQL_PASS)");
        System.out.println("  -d, --mysql_database=<name>        Default database (default: none, alias MYSQL_DB)");
        System.out.println();
        System.out.println("POOL AND STARTUP CHECKS:");
        System.out.println("  -C, --max_connections=<num>        Maximum pooled connections (default: " +
                ConfigParams.DEFAULT_MAX_CONNECTIONS + ")");
        System.out.println("  -t, --connection_timeout_ms=<ms>   Wait for a pooled connection (default: " +
                ConfigParams.DEFAULT_CONNECTION_TIMEOUT_MS + ")");
        System.out.println("  -r, --readonly_check=<grants|probe>  Read-only verification (default: grants)");
        System.out.println();
        System.out.println("Settings are also read from environment variables of the same name, a .env file in");
        System.out.println("the working directory, and system properties such as -Dmysql.host=db.internal");
        System.out.println();
        System.out.println("EXAMPLES:");
        System.out.println("  java -jar mysql-mcp-" + SERVER_VERSION + ".jar -H db.internal -u reader -d shop");
        System.out.println("  java -jar mysql-mcp-" + SERVER_VERSION + ".jar --mysql_port=3307 --readonly_check=probe");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " MCP server v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + McpServer.DEFAULT_PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables,
     * a {@code .env} file in the working directory, and system properties.
     * Priority order: CLI args > config file > environment > .env file > system properties > defaults.
     *
     * @param args Command line arguments
     * @return Configured ConfigParams instance
     * @throws IOException if the config file cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        return loadConfiguration(args, System.getenv(), Path.of(DOT_ENV_FILE));
    }

    static ConfigParams loadConfiguration(String[] args, Map<String, String> environment, Path dotEnvPath)
            throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = cliArgs.get("CONFIG_FILE");
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(Path.of(configFile));
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException(ResourceManager.getErrorMessage("config.file.failed", configFile), e);
            }
        }

        Map<String, String> dotEnv = null;
        if (dotEnvPath != null && Files.isRegularFile(dotEnvPath)) {
            dotEnv = loadConfigFile(dotEnvPath);
        }

        ConfigSources configSources = new ConfigSources(cliArgs, fileConfig, environment, dotEnv);

        String host = configSources.get("MYSQL_HOST", ConfigParams.DEFAULT_HOST);
        String port = configSources.get("MYSQL_PORT", String.valueOf(ConfigParams.DEFAULT_PORT));
        String user = configSources.get("MYSQL_USER", ConfigParams.DEFAULT_USER);
        String password = configSources.get("MYSQL_PASSWORD", ConfigParams.DEFAULT_PASSWORD);
        String database = configSources.get("MYSQL_DATABASE", null);
        String maxConnections = configSources.get("MAX_CONNECTIONS",
                String.valueOf(ConfigParams.DEFAULT_MAX_CONNECTIONS));
        String connectionTimeoutMs = configSources.get("CONNECTION_TIMEOUT_MS",
                String.valueOf(ConfigParams.DEFAULT_CONNECTION_TIMEOUT_MS));
        String readOnlyCheck = configSources.get("READONLY_CHECK", "grants");

        try {
            return new ConfigParams(host,
                    parseIntegerConfig("MYSQL_PORT", port),
                    user, password, database,
                    parseIntegerConfig("MAX_CONNECTIONS", maxConnections),
                    parseIntegerConfig("CONNECTION_TIMEOUT_MS", connectionTimeoutMs),
                    VerificationStrategy.fromConfigValue(readOnlyCheck));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.validation.failed", e.getMessage()), e);
        }
    }

    /**
     * The layered sources a setting can come from, consulted in priority order.
     * Each source is checked for the primary key and then its aliases before moving to the next one.
     */
    private record ConfigSources(Map<String, String> cliArgs, Map<String, String> fileConfig,
                                 Map<String, String> environment, Map<String, String> dotEnv) {

        String get(String varName, String defaultValue) {
            List<String> varNames = new ArrayList<>();
            varNames.add(varName);
            varNames.addAll(KEY_ALIASES.getOrDefault(varName, List.of()));

            for (Map<String, String> source : Arrays.asList(cliArgs, fileConfig, environment, dotEnv)) {
                String value = lookup(source, varNames);
                if (value != null) {
                    return value;
                }
            }

            // System property (VAR_NAME -> var.name)
            for (String name : varNames) {
                String propValue = System.getProperty(name.toLowerCase(Locale.ROOT).replace('_', '.'));
                if (propValue != null) {
                    return propValue;
                }
            }
            return defaultValue;
        }

        private static String lookup(Map<String, String> source, List<String> varNames) {
            if (source == null) {
                return null;
            }
            for (String name : varNames) {
                String value = source.get(name);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are comments and
     * a leading {@code export } is ignored, so shell-style {@code .env} files load too.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(Path configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = Files.newBufferedReader(configFilePath, StandardCharsets.UTF_8)) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }
                if (currLine.startsWith("export ")) {
                    currLine = currLine.substring("export ".length()).trim();
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase(Locale.ROOT);
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if (paramValue.length() >= 2 &&
                        ((paramValue.startsWith("\"") && paramValue.endsWith("\"")) ||
                         (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASS") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    private static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }
}
