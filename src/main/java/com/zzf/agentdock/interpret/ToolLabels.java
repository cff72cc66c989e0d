package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Display labels for Codex tool names and event families.
 */
public final class ToolLabels {
    private ToolLabels() {}

    public static String label(String rawName) {
        if (rawName == null || rawName.isEmpty()) {
            return null;
        }
        switch (rawName.toLowerCase(Locale.ROOT)) {
            case "exec_command":
            case "shell":
            case "local_shell":
                return "Shell";
            case "patch_apply":
            case "apply_patch":
                return "Edit";
            case "web_search":
                return "WebSearch";
            case "view_image":
                return "ViewImage";
            case "mcp_tool_call":
                return "MCP";
            default:
                return rawName;
        }
    }

    /**
     * Label for a {@code *_begin}/{@code *_end} event type such as {@code exec_command_end}.
     */
    public static String forEvent(String eventType, JsonNode payload) {
        if (eventType.startsWith("mcp_tool_call")) {
            return mcpLabel(payload.path("invocation"));
        }
        if (eventType.equals("view_image_tool_call")) {
            return "ViewImage";
        }
        String family = eventType.replaceFirst("_(begin|end)$", "");
        return label(family);
    }

    static String mcpLabel(JsonNode invocation) {
        String server = invocation.path("server").asText("");
        String tool = invocation.path("tool").asText("");
        if (server.isEmpty() && tool.isEmpty()) {
            return "MCP";
        }
        return "MCP:" + server + "/" + tool;
    }
}
