package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Rollout line vocabulary. The outer {@code type} picks the family, {@code payload.type} the event.
 */
public enum CodexEventKind {
    SESSION_META("session_meta"),
    TURN_CONTEXT("turn_context"),
    TASK_STARTED("event_msg", "task_started", "turn_started"),
    TASK_COMPLETE("event_msg", "task_complete", "turn_complete", "turn_aborted"),
    USER_MESSAGE("event_msg", "user_message"),
    AGENT_MESSAGE("event_msg", "agent_message"),
    AGENT_REASONING("event_msg", "agent_reasoning"),
    TOOL_BEGIN("event_msg", "exec_command_begin", "patch_apply_begin", "mcp_tool_call_begin", "web_search_begin"),
    TOOL_END("event_msg", "exec_command_end", "patch_apply_end", "mcp_tool_call_end", "web_search_end"),
    TOOL_INSTANT("event_msg", "view_image_tool_call"),
    EXEC_APPROVAL("event_msg", "exec_approval_request"),
    PATCH_APPROVAL("event_msg", "apply_patch_approval_request"),
    USER_INPUT_REQUEST("event_msg", "request_user_input"),
    ELICITATION_REQUEST("event_msg", "elicitation_request"),
    TOKEN_COUNT("event_msg", "token_count"),
    THREAD_NAME("event_msg", "thread_name_updated"),
    FUNCTION_CALL("response_item", "function_call", "custom_tool_call"),
    FUNCTION_CALL_OUTPUT("response_item", "function_call_output", "custom_tool_call_output"),
    UNKNOWN("");

    private static final Map<String, CodexEventKind> BY_TAG = new HashMap<>();

    static {
        for (CodexEventKind k : values()) {
            if (k.payloadTypes.length == 0) {
                BY_TAG.put(k.outerType, k);
            }
            for (String inner : k.payloadTypes) {
                BY_TAG.put(k.outerType + "/" + inner, k);
            }
        }
    }

    private final String outerType;
    private final String[] payloadTypes;

    CodexEventKind(String outerType, String... payloadTypes) {
        this.outerType = outerType;
        this.payloadTypes = payloadTypes;
    }

    public static CodexEventKind classify(JsonNode root) {
        String outer = root.path("type").asText("");
        CodexEventKind direct = BY_TAG.get(outer);
        if (direct != null && direct != UNKNOWN) {
            return direct;
        }
        String inner = root.path("payload").path("type").asText("");
        return BY_TAG.getOrDefault(outer + "/" + inner, UNKNOWN);
    }
}
