package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.agentdock.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One-line summaries of tool invocations, keyed on the lower-cased tool name.
 */
public final class ToolSummaries {
    static final int COMMAND_LIMIT = 60;
    static final int PROMPT_LIMIT = 50;

    private static final String ADD_FILE = "*** Add File:";
    private static final String UPDATE_FILE = "*** Update File:";

    private ToolSummaries() {}

    public static String summarize(String toolName, JsonNode input) {
        if (toolName == null) {
            return "";
        }
        if (input == null || input.isMissingNode() || input.isNull()) {
            return toolName;
        }
        String summary = null;
        switch (toolName.toLowerCase(Locale.ROOT)) {
            case "read":
            case "write":
            case "notebookedit":
                summary = shortenPath(JsonUtils.textOrNull(input, "file_path", "notebook_path"));
                break;
            case "edit":
            case "multiedit":
            case "apply_patch":
                summary = shortenPath(JsonUtils.textOrNull(input, "file_path"));
                if (summary == null) {
                    summary = shortenPath(patchTarget(patchBody(input)));
                }
                break;
            case "bash":
            case "shell":
            case "exec_command":
            case "local_shell":
                summary = truncate(commandText(input), COMMAND_LIMIT);
                if (summary != null) {
                    summary = summary.replace('\n', ' ');
                }
                break;
            case "glob":
                summary = JsonUtils.textOrNull(input, "pattern");
                break;
            case "grep": {
                String pattern = JsonUtils.textOrNull(input, "pattern");
                summary = pattern == null ? null : "Pattern: " + pattern;
                break;
            }
            case "task":
                summary = truncate(JsonUtils.textOrNull(input, "prompt"), PROMPT_LIMIT);
                break;
            case "webfetch":
            case "web_search":
            case "websearch":
                summary = JsonUtils.textOrNull(input, "url", "query");
                break;
            default:
                break;
        }
        return summary != null ? summary : toolName;
    }

    public static String shortenPath(String path) {
        if (path == null) {
            return null;
        }
        String[] parts = path.split("/", -1);
        if (parts.length > 3) {
            return ".../" + parts[parts.length - 2] + "/" + parts[parts.length - 1];
        }
        return path;
    }

    /**
     * Path from the first {@code *** Add File:} or {@code *** Update File:} header of a patch body.
     */
    public static String patchTarget(String patch) {
        if (patch == null) {
            return null;
        }
        for (String line : patch.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith(ADD_FILE)) {
                return emptyToNull(trimmed.substring(ADD_FILE.length()).trim());
            }
            if (trimmed.startsWith(UPDATE_FILE)) {
                return emptyToNull(trimmed.substring(UPDATE_FILE.length()).trim());
            }
        }
        return null;
    }

    private static String patchBody(JsonNode input) {
        if (input.isTextual()) {
            return input.asText();
        }
        String patch = JsonUtils.textOrNull(input, "patch", "input");
        if (patch != null) {
            return patch;
        }
        return commandText(input);
    }

    private static String commandText(JsonNode input) {
        for (String key : new String[] {"command", "cmd"}) {
            JsonNode node = input.path(key);
            if (node.isTextual()) {
                return node.asText();
            }
            if (node.isArray()) {
                List<String> parts = new ArrayList<>();
                node.forEach(n -> parts.add(n.asText()));
                return String.join(" ", parts);
            }
        }
        return null;
    }

    private static String truncate(String text, int limit) {
        if (text == null) {
            return null;
        }
        if (text.codePointCount(0, text.length()) <= limit) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, limit)) + "...";
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}
