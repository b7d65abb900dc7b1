package com.skanga.mysqlmcp.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.mysqlmcp.JsonUtils;

/**
 * Envelope returned for every tool call. Tool failures travel as successful protocol responses
 * with {@code isError} set, so the calling model can read and react to them.
 *
 * @param text    payload shown to the client
 * @param isError whether the payload describes a failure
 */
public record ToolResult(String text, boolean isError) {

    public static ToolResult success(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(text, true);
    }

    public ObjectNode toJson() {
        ObjectNode textContent = JsonUtils.objectMapper().createObjectNode();
        textContent.put("type", "text");
        textContent.put("text", text);

        ArrayNode contentNode = JsonUtils.objectMapper().createArrayNode();
        contentNode.add(textContent);

        ObjectNode responseNode = JsonUtils.objectMapper().createObjectNode();
        responseNode.set("content", contentNode);
        responseNode.put("isError", isError);
        return responseNode;
    }
}
