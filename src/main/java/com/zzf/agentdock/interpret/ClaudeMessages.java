package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.agentdock.model.ImageAttachment;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.MessageType;
import com.zzf.agentdock.model.UsageStats;
import com.zzf.agentdock.util.JsonUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message construction for Claude transcript lines, shared by the incremental interpreter and the
 * full parser so both produce the same ids and content.
 */
public final class ClaudeMessages {
    static final String ASK_USER_QUESTION = "AskUserQuestion";

    private ClaudeMessages() {}

    public static Message userPrompt(DecodedLine<ClaudeEventKind> line, String sessionId) {
        JsonNode content = line.getBody().path("content");
        String text = JsonUtils.joinedText(content, "text");
        List<ImageAttachment> images = images(content);
        if ((text == null || text.isEmpty()) && images.isEmpty()) {
            return null;
        }
        return Message.builder()
                .id(line.getLineId())
                .sessionId(sessionId)
                .type(MessageType.USER)
                .content(text == null ? "" : text)
                .timestamp(line.getTimestamp())
                .images(images)
                .build();
    }

    /**
     * Text (with any thinking attached) or a thinking-only message, then one message per tool_use block.
     * A call without a result in {@code calls} stays in progress.
     */
    public static List<Message> assistant(DecodedLine<ClaudeEventKind> line, String sessionId,
                                          CallCorrelation calls) {
        List<Message> out = new ArrayList<>();
        JsonNode message = line.getBody();
        JsonNode content = message.path("content");
        String text = JsonUtils.joinedText(content, "text");
        String thinking = thinking(content);
        JsonNode usage = message.path("usage");
        Integer input = JsonUtils.intOrNull(usage, "input_tokens", "inputTokens");
        Integer output = JsonUtils.intOrNull(usage, "output_tokens", "outputTokens");

        if (text != null) {
            out.add(Message.builder()
                    .id(line.getLineId() + "-text")
                    .sessionId(sessionId)
                    .type(MessageType.ASSISTANT)
                    .content(text)
                    .timestamp(line.getTimestamp())
                    .inputTokens(input)
                    .outputTokens(output)
                    .thinking(thinking)
                    .build());
        } else if (thinking != null) {
            out.add(Message.builder()
                    .id(line.getLineId() + "-thinking")
                    .sessionId(sessionId)
                    .type(MessageType.THINKING)
                    .content(thinking)
                    .timestamp(line.getTimestamp())
                    .build());
        }

        if (content.isArray()) {
            int index = 0;
            for (JsonNode block : content) {
                if ("tool_use".equals(block.path("type").asText())) {
                    Message tool = toolUse(line, sessionId, block, index);
                    String callId = JsonUtils.textOrNull(block, "id");
                    ToolResult result = callId == null ? null : calls.resultOf(callId);
                    out.add(result == null ? tool : complete(tool, calls.startOf(callId), result));
                }
                index++;
            }
        }
        return out;
    }

    public static List<JsonNode> toolUseBlocks(DecodedLine<ClaudeEventKind> line) {
        List<JsonNode> blocks = new ArrayList<>();
        JsonNode content = line.getBody().path("content");
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("tool_use".equals(block.path("type").asText())) {
                    blocks.add(block);
                }
            }
        }
        return blocks;
    }

    /**
     * tool_use_id to result for every tool_result block on a user line.
     */
    public static Map<String, ToolResult> toolResults(DecodedLine<ClaudeEventKind> line) {
        Map<String, ToolResult> out = new LinkedHashMap<>();
        JsonNode content = line.getBody().path("content");
        if (!content.isArray()) {
            return out;
        }
        for (JsonNode block : content) {
            if (!"tool_result".equals(block.path("type").asText())) {
                continue;
            }
            String id = JsonUtils.textOrNull(block, "tool_use_id");
            if (id != null) {
                out.putIfAbsent(id, new ToolResult(JsonUtils.joinedText(block.path("content"), "text"),
                        line.getTimestamp()));
            }
        }
        return out;
    }

    public static Message complete(Message tool, Instant startedAt, ToolResult result) {
        return tool.toBuilder()
                .toolOutput(result.getOutput())
                .toolDuration(durationSeconds(startedAt, result.getTimestamp()))
                .inProgress(false)
                .build();
    }

    public static String model(DecodedLine<ClaudeEventKind> line) {
        String model = JsonUtils.textOrNull(line.getBody(), "model");
        return model != null ? model : JsonUtils.textOrNull(line.getRoot(), "model");
    }

    public static void accumulateUsage(DecodedLine<ClaudeEventKind> line, UsageStats stats) {
        JsonNode usage = line.getBody().path("usage");
        if (!usage.isObject()) {
            return;
        }
        stats.accumulate(
                JsonUtils.longOrZero(usage, "input_tokens"),
                JsonUtils.longOrZero(usage, "output_tokens"),
                JsonUtils.longOrZero(usage, "cache_read_input_tokens"),
                JsonUtils.longOrZero(usage, "cache_creation_input_tokens"));
    }

    public static String toolMessageId(DecodedLine<?> line, String callId, int index) {
        return callId != null ? "tool-" + callId : line.getLineId() + "-tool-" + index;
    }

    static Double durationSeconds(Instant start, Instant end) {
        if (start == null || end == null) {
            return null;
        }
        long millis = Duration.between(start, end).toMillis();
        return millis > 0 ? millis / 1000.0 : null;
    }

    private static Message toolUse(DecodedLine<ClaudeEventKind> line, String sessionId, JsonNode block, int index) {
        String name = block.path("name").asText("tool");
        JsonNode input = block.path("input");
        return Message.builder()
                .id(toolMessageId(line, JsonUtils.textOrNull(block, "id"), index))
                .sessionId(sessionId)
                .type(MessageType.TOOL)
                .content(ToolSummaries.summarize(name, input))
                .timestamp(line.getTimestamp())
                .toolName(name)
                .toolInput(input.isMissingNode() ? null : input.toString())
                .inProgress(true)
                .build();
    }

    private static String thinking(JsonNode content) {
        if (!content.isArray()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            if ("thinking".equals(block.path("type").asText())) {
                String t = block.path("thinking").asText("").trim();
                if (!t.isEmpty()) {
                    parts.add(t);
                }
            }
        }
        return parts.isEmpty() ? null : String.join("\n\n", parts);
    }

    private static List<ImageAttachment> images(JsonNode content) {
        List<ImageAttachment> images = new ArrayList<>();
        if (!content.isArray()) {
            return images;
        }
        for (JsonNode block : content) {
            JsonNode source = block.path("source");
            if ("image".equals(block.path("type").asText()) && "base64".equals(source.path("type").asText())) {
                String data = JsonUtils.textOrNull(source, "data");
                if (data != null) {
                    images.add(new ImageAttachment(source.path("media_type").asText("image/png"), data));
                }
            }
        }
        return images;
    }
}
