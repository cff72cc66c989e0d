package com.zzf.agentdock.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class JsonUtils {

    private JsonUtils() {}

    /**
     * Text of the first key holding a non-blank string, or null.
     */
    public static String textOrNull(JsonNode node, String... keys) {
        if (node == null || keys == null) {
            return null;
        }
        for (String key : keys) {
            JsonNode v = node.path(key);
            if (v.isTextual() && !v.asText().trim().isEmpty()) {
                return v.asText();
            }
        }
        return null;
    }

    public static long longOrZero(JsonNode node, String key) {
        if (node == null) {
            return 0L;
        }
        JsonNode v = node.path(key);
        if (v.isNumber()) {
            return v.asLong();
        }
        if (v.isTextual()) {
            try {
                return Long.parseLong(v.asText().trim());
            } catch (NumberFormatException ignored) {
                return 0L;
            }
        }
        return 0L;
    }

    public static Integer intOrNull(JsonNode node, String k1, String k2) {
        if (node == null) {
            return null;
        }
        JsonNode n1 = node.path(k1);
        if (n1.isNumber()) {
            return n1.asInt();
        }
        JsonNode n2 = node.path(k2);
        if (n2.isNumber()) {
            return n2.asInt();
        }
        return null;
    }

    /**
     * ISO-8601 instant, or null when absent or unparseable.
     */
    public static Instant instantOrNull(JsonNode node, String key) {
        String raw = textOrNull(node, key);
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * A content field that is either a plain string or an array of typed blocks. Text of blocks whose
     * {@code type} is one of {@code blockTypes} is trimmed and joined with a newline.
     */
    public static String joinedText(JsonNode content, String... blockTypes) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            String type = block.path("type").asText("");
            for (String wanted : blockTypes) {
                if (wanted.equals(type)) {
                    String text = block.path("text").asText("").trim();
                    if (!text.isEmpty()) {
                        parts.add(text);
                    }
                    break;
                }
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }
}
