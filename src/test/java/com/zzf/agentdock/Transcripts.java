package com.zzf.agentdock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Hand-built transcript lines for tests.
 */
public final class Transcripts {
    public static final String SID = "11111111-2222-3333-4444-555555555555";
    public static final String CWD = "/home/dev/work/demo";

    private Transcripts() {}

    public static String claudeUser(String uuid, String ts, String text) {
        return "{\"type\":\"user\",\"uuid\":\"" + uuid + "\",\"sessionId\":\"" + SID + "\",\"cwd\":\"" + CWD
                + "\",\"timestamp\":\"" + ts + "\",\"message\":{\"role\":\"user\",\"content\":\"" + text + "\"}}";
    }

    public static String claudeToolUse(String uuid, String ts, String callId, String name, String inputJson) {
        return "{\"type\":\"assistant\",\"uuid\":\"" + uuid + "\",\"sessionId\":\"" + SID + "\",\"timestamp\":\"" + ts
                + "\",\"message\":{\"role\":\"assistant\",\"model\":\"claude-sonnet-4-5\",\"stop_reason\":\"tool_use\","
                + "\"usage\":{\"input_tokens\":100,\"output_tokens\":20},"
                + "\"content\":[{\"type\":\"tool_use\",\"id\":\"" + callId + "\",\"name\":\"" + name
                + "\",\"input\":" + inputJson + "}]}}";
    }

    public static String claudeToolResult(String uuid, String ts, String callId, String output) {
        return "{\"type\":\"user\",\"uuid\":\"" + uuid + "\",\"sessionId\":\"" + SID + "\",\"timestamp\":\"" + ts
                + "\",\"message\":{\"role\":\"user\",\"content\":[{\"type\":\"tool_result\",\"tool_use_id\":\""
                + callId + "\",\"content\":\"" + output + "\"}]}}";
    }

    public static String claudeText(String uuid, String ts, String text) {
        return "{\"type\":\"assistant\",\"uuid\":\"" + uuid + "\",\"sessionId\":\"" + SID + "\",\"timestamp\":\"" + ts
                + "\",\"message\":{\"role\":\"assistant\",\"model\":\"claude-sonnet-4-5\",\"stop_reason\":\"end_turn\","
                + "\"usage\":{\"input_tokens\":50,\"output_tokens\":10},"
                + "\"content\":[{\"type\":\"text\",\"text\":\"" + text + "\"}]}}";
    }

    public static String codexMeta(String id, String ts) {
        return "{\"timestamp\":\"" + ts + "\",\"type\":\"session_meta\",\"payload\":{\"id\":\"" + id
                + "\",\"timestamp\":\"" + ts + "\",\"cwd\":\"" + CWD + "\",\"model_provider\":\"openai\"}}";
    }

    public static String codexEvent(String ts, String type, String extraJson) {
        return "{\"timestamp\":\"" + ts + "\",\"type\":\"event_msg\",\"payload\":{\"type\":\"" + type + "\""
                + (extraJson.isEmpty() ? "" : "," + extraJson) + "}}";
    }

    public static String codexItem(String ts, String type, String extraJson) {
        return "{\"timestamp\":\"" + ts + "\",\"type\":\"response_item\",\"payload\":{\"type\":\"" + type + "\""
                + (extraJson.isEmpty() ? "" : "," + extraJson) + "}}";
    }

    public static String codexTurnContext(String ts, String model) {
        return "{\"timestamp\":\"" + ts + "\",\"type\":\"turn_context\",\"payload\":{\"model\":\"" + model
                + "\",\"cwd\":\"" + CWD + "\"}}";
    }

    public static void write(Path file, String... lines) throws IOException {
        Files.write(file, (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public static void append(Path file, String... lines) throws IOException {
        Files.write(file, (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
