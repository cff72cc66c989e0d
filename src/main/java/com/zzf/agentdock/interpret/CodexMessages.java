package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.zzf.agentdock.model.ImageAttachment;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.MessageType;
import com.zzf.agentdock.model.UsageStats;
import com.zzf.agentdock.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message construction for Codex rollout lines, shared by the incremental interpreter and the full
 * parser. Tool messages come from {@code response_item} calls; their result is the first of the
 * matching {@code *_end} event or {@code function_call_output}.
 */
public final class CodexMessages {
    private static final Pattern DATA_URL = Pattern.compile("^data:([^;,]+);base64,(.*)$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public CodexMessages(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Messages produced by a line, with tool results taken from {@code calls}.
     */
    public List<Message> messages(DecodedLine<CodexEventKind> line, String sessionId, CallCorrelation calls) {
        List<Message> out = new ArrayList<>();
        JsonNode payload = line.getBody();
        switch (line.getKind()) {
            case USER_MESSAGE: {
                String text = JsonUtils.textOrNull(payload, "message");
                List<ImageAttachment> images = images(payload.path("images"));
                if (text != null || !images.isEmpty()) {
                    out.add(base(line, sessionId, MessageType.USER, text == null ? "" : text).images(images).build());
                }
                break;
            }
            case AGENT_MESSAGE: {
                String text = JsonUtils.textOrNull(payload, "message");
                if (text != null) {
                    out.add(base(line, sessionId, MessageType.ASSISTANT, text).build());
                }
                break;
            }
            case AGENT_REASONING: {
                String text = JsonUtils.textOrNull(payload, "text");
                if (text != null) {
                    out.add(base(line, sessionId, MessageType.THINKING, text).build());
                }
                break;
            }
            case FUNCTION_CALL: {
                Message tool = toolCall(line, sessionId);
                if (tool != null) {
                    String callId = JsonUtils.textOrNull(payload, "call_id");
                    ToolResult result = calls.resultOf(callId);
                    out.add(result == null ? tool : ClaudeMessages.complete(tool, calls.startOf(callId), result));
                }
                break;
            }
            default:
                break;
        }
        return out;
    }

    public Message toolCall(DecodedLine<CodexEventKind> line, String sessionId) {
        JsonNode payload = line.getBody();
        String callId = JsonUtils.textOrNull(payload, "call_id");
        String name = JsonUtils.textOrNull(payload, "name");
        if (callId == null || name == null) {
            return null;
        }
        String rawInput = JsonUtils.textOrNull(payload, "arguments", "input");
        JsonNode input = parseLoosely(rawInput);
        return Message.builder()
                .id(ClaudeMessages.toolMessageId(line, callId, 0))
                .sessionId(sessionId)
                .type(MessageType.TOOL)
                .content(ToolSummaries.summarize(name, input))
                .timestamp(line.getTimestamp())
                .toolName(ToolLabels.label(name))
                .toolInput(rawInput)
                .inProgress(true)
                .build();
    }

    /**
     * Result carried by a call-end line, or null for any other line.
     */
    public ToolResult result(DecodedLine<CodexEventKind> line) {
        JsonNode payload = line.getBody();
        switch (line.getKind()) {
            case FUNCTION_CALL_OUTPUT:
                return new ToolResult(outputText(payload.path("output")), line.getTimestamp());
            case TOOL_END: {
                String out = JsonUtils.textOrNull(payload, "aggregated_output", "formatted_output", "stdout");
                if (out == null && payload.path("result").isObject()) {
                    out = payload.path("result").toString();
                }
                return new ToolResult(out, line.getTimestamp());
            }
            default:
                return null;
        }
    }

    public static String callId(DecodedLine<CodexEventKind> line) {
        return JsonUtils.textOrNull(line.getBody(), "call_id");
    }

    /**
     * {@code total_token_usage} of a token_count event is cumulative, so it replaces the stats totals.
     */
    public static boolean applyTokenCount(DecodedLine<CodexEventKind> line, UsageStats stats) {
        JsonNode info = line.getBody().path("info");
        JsonNode total = info.path("total_token_usage");
        if (!total.isObject()) {
            return false;
        }
        long cached = JsonUtils.longOrZero(total, "cached_input_tokens");
        stats.setInputTokens(Math.max(0, JsonUtils.longOrZero(total, "input_tokens") - cached));
        stats.setCacheReadTokens(cached);
        stats.setOutputTokens(JsonUtils.longOrZero(total, "output_tokens"));
        JsonNode last = info.path("last_token_usage");
        if (last.isObject()) {
            long used = JsonUtils.longOrZero(last, "input_tokens");
            if (used > 0) {
                stats.setContextUsed(used);
            }
        }
        long window = JsonUtils.longOrZero(info, "model_context_window");
        if (window > 0) {
            stats.setContextLimit(window);
        }
        return true;
    }

    public static long reportedTotal(DecodedLine<CodexEventKind> line) {
        return JsonUtils.longOrZero(line.getBody().path("info").path("total_token_usage"), "total_tokens");
    }

    private static Message.MessageBuilder base(DecodedLine<CodexEventKind> line, String sessionId,
                                               MessageType type, String content) {
        return Message.builder()
                .id(line.getLineId())
                .sessionId(sessionId)
                .type(type)
                .content(content)
                .timestamp(line.getTimestamp());
    }

    private String outputText(JsonNode output) {
        if (output.isMissingNode() || output.isNull()) {
            return null;
        }
        if (output.isObject()) {
            return output.has("output") ? output.path("output").asText() : output.toString();
        }
        String raw = output.asText();
        JsonNode parsed = parseLoosely(raw);
        if (parsed.isObject() && parsed.path("output").isTextual()) {
            return parsed.path("output").asText();
        }
        return raw;
    }

    private JsonNode parseLoosely(String raw) {
        if (raw == null) {
            return TextNode.valueOf("");
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException ignored) {
                return TextNode.valueOf(raw);
            }
        }
        return TextNode.valueOf(raw);
    }

    private static List<ImageAttachment> images(JsonNode node) {
        List<ImageAttachment> images = new ArrayList<>();
        if (!node.isArray()) {
            return images;
        }
        for (JsonNode n : node) {
            Matcher m = DATA_URL.matcher(n.asText(""));
            if (m.matches()) {
                images.add(new ImageAttachment(m.group(1), m.group(2)));
            }
        }
        return images;
    }
}
