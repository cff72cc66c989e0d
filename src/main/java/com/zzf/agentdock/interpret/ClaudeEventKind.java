package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;

public enum ClaudeEventKind {
    USER_PROMPT,
    TOOL_RESULT,
    ASSISTANT,
    SUMMARY,
    UNKNOWN;

    public static ClaudeEventKind classify(JsonNode root) {
        if (root.path("isMeta").asBoolean(false)) {
            return UNKNOWN;
        }
        String type = root.path("type").asText("");
        switch (type) {
            case "user": {
                JsonNode content = root.path("message").path("content");
                if (content.isArray() && content.size() > 0
                        && "tool_result".equals(content.get(0).path("type").asText())) {
                    return TOOL_RESULT;
                }
                return USER_PROMPT;
            }
            case "assistant":
                return ASSISTANT;
            case "summary":
                return SUMMARY;
            default:
                return UNKNOWN;
        }
    }
}
