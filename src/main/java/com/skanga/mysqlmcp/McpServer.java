package com.skanga.mysqlmcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.mysqlmcp.catalog.CatalogBrowser;
import com.skanga.mysqlmcp.catalog.CatalogEntry;
import com.skanga.mysqlmcp.catalog.ColumnDescriptor;
import com.skanga.mysqlmcp.config.CliUtils;
import com.skanga.mysqlmcp.config.ConfigParams;
import com.skanga.mysqlmcp.config.ResourceManager;
import com.skanga.mysqlmcp.db.ConnectionPool;
import com.skanga.mysqlmcp.db.DatabaseException;
import com.skanga.mysqlmcp.security.ReadOnlyVerifier;
import com.skanga.mysqlmcp.security.StartupDiagnostics;
import com.skanga.mysqlmcp.security.StartupFault;
import com.skanga.mysqlmcp.tools.QueryExecutor;
import com.skanga.mysqlmcp.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MCP server exposing a MySQL database read-only. Implements the Model Context Protocol over stdio:
 * one JSON-RPC message per line on stdin, one response per line on stdout.
 *
 * <p>Tables and views are published as resources ({@code mysql://<schema>/<table>}) and SQL runs
 * through the single {@code mysql_query} tool. The process refuses to start unless the configured
 * account is verified read-only.
 */
public class McpServer {
    public static final String DEFAULT_PROTOCOL_VERSION = "2025-11-25";
    public static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            DEFAULT_PROTOCOL_VERSION,
            "2025-06-18",
            "2025-03-26",
            "2024-11-05"
    );
    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = JsonUtils.objectMapper();
    private static final long WORKER_DRAIN_LOG_SECONDS = 30;

    final ConnectionPool connectionPool;
    private final CatalogBrowser catalogBrowser;
    private final QueryExecutor queryExecutor;
    private final int workerThreads;

    // Lifecycle management
    private enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;

    /**
     * Creates a server bound to an open connection pool. The server owns the pool from here on
     * and closes it on {@link #shutdown()}.
     *
     * @param connectionPool pool shared by every request
     * @param workerThreads  how many gateway requests may run at once on stdio
     */
    public McpServer(ConnectionPool connectionPool, int workerThreads) {
        this.connectionPool = connectionPool;
        this.catalogBrowser = new CatalogBrowser(connectionPool);
        this.queryExecutor = new QueryExecutor(connectionPool);
        this.workerThreads = Math.max(1, workerThreads);
    }

    public McpServer(ConnectionPool connectionPool) {
        this(connectionPool, ConfigParams.DEFAULT_MAX_CONNECTIONS);
    }

    /**
     * Processes an MCP request and returns the appropriate response.
     *
     * @param requestNode The parsed JSON-RPC request
     * @return JSON response node, or null for notifications (requests without id)
     */
    public JsonNode handleRequest(JsonNode requestNode) {
        if (!isWellFormedRequest(requestNode)) {
            return rejectMalformedRequest(requestNode);
        }

        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");

        // A notification has no id field at all
        boolean isNotification = !requestNode.has("id");
        JsonNode requestId = isNotification ? null : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            enforceLifecycleRules(requestMethod);
            McpMethod mcpMethod = McpMethod.fromWireName(requestMethod)
                    .orElseThrow(() -> new UnsupportedOperationException(
                            ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod)));
            JsonNode resultNode = executeMethod(mcpMethod, requestParams);

            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            return handleRequestException(e, requestMethod, isNotification, requestId);
        }
    }

    private static boolean isWellFormedRequest(JsonNode requestNode) {
        return requestNode.isObject() && requestNode.path("method").isTextual();
    }

    /**
     * Answers JSON that is not a single request object with a string method. Batches and scalars
     * get an invalid-request error with a null id; a method-less object without an id is dropped
     * like any other notification.
     *
     * @return the error response, or null when no answer is due
     */
    private JsonNode rejectMalformedRequest(JsonNode requestNode) {
        if (!requestNode.isObject()) {
            logger.warn("Rejecting non-object request of type {}", requestNode.getNodeType());
            return createErrorResponse("invalid_request",
                    ResourceManager.getErrorMessage("protocol.request.not.object", requestNode.getNodeType()), null);
        }
        if (requestNode.has("id")) {
            return createErrorResponse("invalid_request",
                    ResourceManager.getErrorMessage("protocol.request.method.missing"), requestNode.get("id"));
        }
        logger.warn("Dropping notification without a method");
        return null;
    }

    /**
     * Enforces server lifecycle rules for method execution.
     *
     * @throws IllegalStateException if the method is not allowed in the current state
     */
    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.SHUTDOWN) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.shutdown"));
        }

        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals(McpMethod.INITIALIZE.wireName())) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.not.initialized"));
        }

        if (serverState == ServerState.INITIALIZING && !requestMethod.equals(McpMethod.INITIALIZE.wireName()) &&
                !requestMethod.equals(McpMethod.INITIALIZED.wireName())) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.initializing"));
        }
    }

    private JsonNode executeMethod(McpMethod mcpMethod, JsonNode requestParams) throws Exception {
        return switch (mcpMethod) {
            case INITIALIZE -> handleInitialize(requestParams);
            case INITIALIZED -> handleNotificationInitialized();
            case PING -> handlePing();
            case LIST_RESOURCES -> handleListResources();
            case READ_RESOURCE -> handleReadResource(requestParams);
            case LIST_TOOLS -> handleListTools();
            case CALL_TOOL -> handleCallTool(requestParams);
        };
    }

    /**
     * Maps a failed request to its JSON-RPC error. Notifications never get a response.
     */
    private JsonNode handleRequestException(Exception theException, String requestMethod, boolean isNotification,
                                            JsonNode requestId) {
        if (isNotification) {
            logExceptionForNotification(theException, requestMethod);
            return null;
        }

        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse("invalid_request", theException.getMessage(), requestId);
        }

        if (theException instanceof UnsupportedOperationException) {
            logger.warn("Method not found: {}", requestMethod);
            return createErrorResponse("method_not_found", theException.getMessage(), requestId);
        }

        if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid request parameters: {}", theException.getMessage());
            return createErrorResponse("invalid_params", theException.getMessage(), requestId);
        }

        if (theException instanceof DatabaseException databaseException) {
            logger.warn("Database error handling {} ({}): {}", requestMethod, databaseException.getKind(),
                    databaseException.getMessage());
            return createErrorResponse("database_error",
                    ResourceManager.getErrorMessage("protocol.database.error", databaseException.getMessage()), requestId);
        }

        logger.error("Unexpected error handling request", theException);
        return createErrorResponse("internal_error",
                ResourceManager.getErrorMessage("protocol.internal.error", theException.getMessage()), requestId);
    }

    private void logExceptionForNotification(Exception theException, String requestMethod) {
        if (theException instanceof IllegalStateException || theException instanceof IllegalArgumentException ||
                theException instanceof UnsupportedOperationException) {
            logger.warn("Invalid notification {}: {}", requestMethod, theException.getMessage());
        } else {
            logger.error("Unexpected error in notification {}", requestMethod, theException);
        }
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        if (serverState != ServerState.UNINITIALIZED) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.already.initialized", serverState));
        }

        serverState = ServerState.INITIALIZING;
        logger.info("Server initializing...");

        if (requestParams.has("clientInfo")) {
            logger.info("Client: {}", requestParams.get("clientInfo"));
        }

        String clientProtocolVersion = requestParams.path("protocolVersion").asText("unknown");

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", negotiateProtocolVersion(clientProtocolVersion));
        resultNode.set("capabilities", createCapabilities());
        resultNode.set("serverInfo", createServerInfo());
        return resultNode;
    }

    /**
     * Echoes the client's version when supported, otherwise offers the newest one this server speaks
     * and leaves it to the client to disconnect.
     */
    private String negotiateProtocolVersion(String clientProtocolVersion) {
        if (SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)) {
            return clientProtocolVersion;
        }

        logger.warn("Protocol version mismatch. Client: {}, Supported: {}. Offering {}",
                clientProtocolVersion, String.join(", ", SUPPORTED_PROTOCOL_VERSIONS), DEFAULT_PROTOCOL_VERSION);
        return DEFAULT_PROTOCOL_VERSION;
    }

    private JsonNode handleNotificationInitialized() {
        if (serverState != ServerState.INITIALIZING) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("lifecycle.unexpected.initialized", serverState));
        }

        serverState = ServerState.INITIALIZED;
        logger.info("Server initialized and ready for operation");
        return null;
    }

    private JsonNode handlePing() {
        return objectMapper.createObjectNode();
    }

    private ObjectNode createCapabilities() {
        ObjectNode capabilitiesNode = objectMapper.createObjectNode();

        ObjectNode resourcesNode = objectMapper.createObjectNode();
        resourcesNode.put("subscribe", false);
        resourcesNode.put("listChanged", false);
        capabilitiesNode.set("resources", resourcesNode);

        ObjectNode toolsNode = objectMapper.createObjectNode();
        toolsNode.put("listChanged", false);
        capabilitiesNode.set("tools", toolsNode);

        return capabilitiesNode;
    }

    private ObjectNode createServerInfo() {
        ObjectNode serverInfo = objectMapper.createObjectNode();
        serverInfo.put("name", CliUtils.SERVER_NAME);
        serverInfo.put("version", CliUtils.SERVER_VERSION);
        return serverInfo;
    }

    // ==== Resources ====

    private JsonNode handleListResources() throws DatabaseException {
        ArrayNode resourceArray = objectMapper.createArrayNode();
        for (CatalogEntry catalogEntry : catalogBrowser.listEntries()) {
            ObjectNode resourceNode = objectMapper.createObjectNode();
            resourceNode.put("uri", catalogEntry.locator());
            resourceNode.put("name", catalogEntry.displayName());
            resourceNode.put("mimeType", CatalogEntry.MIME_TYPE);
            resourceArray.add(resourceNode);
        }

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("resources", resourceArray);
        return resultNode;
    }

    /**
     * Handles the resources/read MCP method: the columns of one table as a JSON document.
     *
     * @throws IllegalArgumentException if the uri is missing or malformed
     * @throws DatabaseException if the catalog query fails
     */
    JsonNode handleReadResource(JsonNode paramsNode) throws DatabaseException, JsonProcessingException {
        String uri = paramsNode.path("uri").asText("");
        if (uri.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("protocol.resource.uri.missing"));
        }

        List<ColumnDescriptor> columnDescriptors = catalogBrowser.describeEntry(uri);

        ObjectNode contentNode = objectMapper.createObjectNode();
        contentNode.put("uri", uri);
        contentNode.put("mimeType", CatalogEntry.MIME_TYPE);
        contentNode.put("text", JsonUtils.toPrettyJson(columnDescriptors));

        ArrayNode contentsArray = objectMapper.createArrayNode();
        contentsArray.add(contentNode);

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("contents", contentsArray);
        return resultNode;
    }

    // ==== Tools ====

    private JsonNode handleListTools() {
        ArrayNode toolsNode = objectMapper.createArrayNode();
        toolsNode.add(listToolMysqlQuery());

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", toolsNode);
        return resultNode;
    }

    private static ObjectNode listToolMysqlQuery() {
        ObjectNode sqlProperty = objectMapper.createObjectNode();
        sqlProperty.put("type", "string");
        sqlProperty.put("description", "SQL query to execute");

        ObjectNode queryProperties = objectMapper.createObjectNode();
        queryProperties.set("sql", sqlProperty);

        ArrayNode requiredNode = objectMapper.createArrayNode();
        requiredNode.add("sql");

        ObjectNode querySchema = objectMapper.createObjectNode();
        querySchema.put("type", "object");
        querySchema.set("properties", queryProperties);
        querySchema.set("required", requiredNode);

        ObjectNode queryTool = objectMapper.createObjectNode();
        queryTool.put("name", QueryExecutor.TOOL_NAME);
        queryTool.put("description", "Run a SQL query against the MySQL database");
        queryTool.set("inputSchema", querySchema);
        return queryTool;
    }

    /**
     * Handles the tools/call MCP method. Unknown tools and bad arguments come back as error
     * results rather than protocol errors, as do database failures.
     */
    JsonNode handleCallTool(JsonNode paramsNode) {
        String toolName = paramsNode.path("name").asText();
        JsonNode arguments = paramsNode.path("arguments");

        ToolResult toolResult = switch (toolName) {
            case QueryExecutor.TOOL_NAME -> execToolMysqlQuery(arguments);
            default -> {
                logger.warn("Unknown tool requested: {}", toolName);
                yield ToolResult.error(ResourceManager.getErrorMessage("protocol.tool.unknown", toolName));
            }
        };
        return toolResult.toJson();
    }

    private ToolResult execToolMysqlQuery(JsonNode argsNode) {
        JsonNode sqlNode = argsNode.path("sql");
        if (!sqlNode.isTextual() || sqlNode.asText().isBlank()) {
            return ToolResult.error(ResourceManager.getErrorMessage("query.sql.missing"));
        }
        return queryExecutor.runQuery(sqlNode.asText());
    }

    // ==== JSON-RPC envelopes ====

    private JsonNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        setRespId(requestId, responseNode);
        responseNode.set("result", resultNode != null ? resultNode : objectMapper.createObjectNode());
        return responseNode;
    }

    /**
     * Creates a JSON-RPC error response with the specified error details.
     *
     * @param code      Error code string (mapped to numeric codes)
     * @param message   Error message description
     * @param requestId The request ID from the original request
     */
    JsonNode createErrorResponse(String code, String message, JsonNode requestId) {
        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("code", getErrorCode(code));
        errorNode.put("message", message);

        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        setRespId(requestId, responseNode);
        responseNode.set("error", errorNode);
        return responseNode;
    }

    // The id is echoed exactly as received, whatever its JSON type
    private static void setRespId(JsonNode requestId, ObjectNode responseNode) {
        if (requestId == null) {
            responseNode.putNull("id");
        } else {
            responseNode.set("id", requestId);
        }
    }

    static int getErrorCode(String codeString) {
        return switch (codeString) {
            case "parse_error" -> -32700;
            case "invalid_request" -> -32600;
            case "method_not_found" -> -32601;
            case "invalid_params" -> -32602;
            case "database_error" -> -32000;
            default -> -32603;
        };
    }

    // ==== stdio transport ====

    /**
     * Serves requests from stdin until it is closed.
     *
     * @throws IOException if stdin cannot be read
     */
    public void startStdioMode() throws IOException {
        serve(System.in, System.out);
    }

    /**
     * Serves newline-delimited JSON-RPC requests from {@code input} and writes responses to {@code output}.
     * Session messages are handled in arrival order on the calling thread; catalog and query requests run
     * on a worker pool so several can wait on the database at once. Returns once input ends and every
     * accepted request has been answered.
     *
     * @throws IOException if the input cannot be read
     */
    public void serve(InputStream input, OutputStream output) throws IOException {
        logger.info("Starting MySQL MCP server in stdio mode...");
        PrintWriter printWriter = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8), false);
        ExecutorService workerPool = Executors.newFixedThreadPool(workerThreads, newWorkerThreadFactory());

        try (BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String currLine;
            while ((currLine = bufferedReader.readLine()) != null) {
                if (!currLine.isBlank()) {
                    processStdioRequest(currLine, printWriter, workerPool);
                }
            }
        } finally {
            drainWorkers(workerPool);
            printWriter.flush();
        }

        logger.info("MySQL MCP server stopped reading input.");
    }

    private void processStdioRequest(String requestLine, PrintWriter printWriter, ExecutorService workerPool) {
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.warn("Could not parse request line: {}", e.getOriginalMessage());
            writeResponse(printWriter, createErrorResponse("parse_error",
                    ResourceManager.getErrorMessage("protocol.parse.error", e.getOriginalMessage()), null));
            return;
        }

        boolean isGatewayOperation = McpMethod.fromWireName(requestNode.path("method").asText())
                .map(McpMethod::isGatewayOperation)
                .orElse(false);
        if (!isGatewayOperation) {
            writeResponse(printWriter, handleRequest(requestNode));
            return;
        }

        try {
            workerPool.execute(() -> writeResponse(printWriter, handleRequest(requestNode)));
        } catch (RejectedExecutionException e) {
            logger.warn("Worker pool rejected request: {}", e.getMessage());
            writeResponse(printWriter, handleRequest(requestNode));
        }
    }

    private void writeResponse(PrintWriter printWriter, JsonNode responseNode) {
        if (responseNode == null) {
            return;
        }
        String responseJson;
        try {
            responseJson = objectMapper.writeValueAsString(responseNode);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize response", e);
            responseJson = "{\"jsonrpc\":\"2.0\",\"id\":" + responseNode.path("id") +
                    ",\"error\":{\"code\":-32603,\"message\":\"Critical internal error\"}}";
        }
        synchronized (printWriter) {
            printWriter.println(responseJson);
            printWriter.flush();
        }
    }

    private void drainWorkers(ExecutorService workerPool) {
        workerPool.shutdown();
        try {
            while (!workerPool.awaitTermination(WORKER_DRAIN_LOG_SECONDS, TimeUnit.SECONDS)) {
                logger.info("Waiting for in-flight requests to finish...");
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for in-flight requests; abandoning them");
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory newWorkerThreadFactory() {
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread workerThread = new Thread(runnable, "mcp-worker-" + threadCounter.incrementAndGet());
            workerThread.setDaemon(true);
            return workerThread;
        };
    }

    String getServerState() {
        return serverState.toString();
    }

    /**
     * Gracefully shuts down the server and closes the connection pool.
     * This method is idempotent and safe to call multiple times.
     */
    public synchronized void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }

        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;
        if (connectionPool != null) {
            connectionPool.close();
        }
        logger.info("MCP server shutdown complete");
    }

    /**
     * Main entry point. Loads configuration, opens the pool, verifies the account is read-only and
     * then serves stdio until input ends. Exits with status 1 on any startup fault.
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }
        System.exit(run(args));
    }

    static int run(String[] args) {
        ConfigParams configParams;
        try {
            configParams = CliUtils.loadConfiguration(args);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("{}", ResourceManager.getErrorMessage("startup.config.error.title"));
            logger.error("{}", e.getMessage());
            return 1;
        }
        logger.debug("Loaded configuration: {}", configParams);

        McpServer mcpServer;
        try {
            mcpServer = startServer(configParams);
        } catch (StartupFault e) {
            StartupDiagnostics.report(e, configParams);
            return 1;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during startup", e);
            logger.error("{}", ResourceManager.getErrorMessage("startup.upstream.error", e.getMessage()));
            return 1;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(mcpServer::shutdown, "mcp-shutdown"));
        try {
            mcpServer.startStdioMode();
            return 0;
        } catch (IOException e) {
            logger.error("Failed reading from stdin: {}", e.getMessage(), e);
            return 1;
        } finally {
            mcpServer.shutdown();
        }
    }

    /**
     * Opens the pool and runs the configured read-only check. The pool is closed again if the check fails.
     *
     * @throws StartupFault if the server cannot be reached or the account is not read-only
     */
    static McpServer startServer(ConfigParams configParams) throws StartupFault {
        ConnectionPool connectionPool;
        try {
            connectionPool = ConnectionPool.open(configParams);
        } catch (DatabaseException e) {
            throw StartupFault.from(e);
        }

        try {
            ReadOnlyVerifier.forStrategy(configParams.readOnlyCheck(), connectionPool).verifyReadOnly();
        } catch (StartupFault | RuntimeException e) {
            connectionPool.close();
            throw e;
        }

        logger.info("Connected to {} as {} (database: {})",
                configParams.endpoint(), configParams.user(), configParams.databaseOrNone());
        return new McpServer(connectionPool, configParams.maxConnections());
    }
}
