package com.skanga.mysqlmcp;

import java.util.Arrays;
import java.util.Optional;

/**
 * JSON-RPC methods understood by the server.
 */
public enum McpMethod {
    INITIALIZE("initialize", false),
    INITIALIZED("notifications/initialized", false),
    PING("ping", false),
    LIST_RESOURCES("resources/list", true),
    READ_RESOURCE("resources/read", true),
    LIST_TOOLS("tools/list", true),
    CALL_TOOL("tools/call", true);

    private final String wireName;
    private final boolean gatewayOperation;

    McpMethod(String wireName, boolean gatewayOperation) {
        this.wireName = wireName;
        this.gatewayOperation = gatewayOperation;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether the method serves catalog or query traffic, as opposed to session housekeeping.
     * Gateway operations may run concurrently; housekeeping runs in arrival order.
     */
    public boolean isGatewayOperation() {
        return gatewayOperation;
    }

    public static Optional<McpMethod> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(method -> method.wireName.equals(wireName))
                .findFirst();
    }
}
