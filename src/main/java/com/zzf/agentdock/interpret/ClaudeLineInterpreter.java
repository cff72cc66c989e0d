package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.util.JsonUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Claude project transcripts: {@code user} and {@code assistant} lines carrying content blocks.
 */
@Component
public class ClaudeLineInterpreter extends AbstractLineInterpreter<ClaudeEventKind> {

    public ClaudeLineInterpreter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public TranscriptFormat format() {
        return TranscriptFormat.CLAUDE;
    }

    @Override
    protected ClaudeEventKind classify(JsonNode root) {
        return ClaudeEventKind.classify(root);
    }

    @Override
    protected JsonNode body(JsonNode root) {
        return root.path("message");
    }

    @Override
    public List<Message> apply(DecodedLine<ClaudeEventKind> line, SessionState state) {
        Instant at = line.getTimestamp();
        JsonNode root = line.getRoot();
        String sessionId = JsonUtils.textOrNull(root, "sessionId");
        if (sessionId != null) {
            state.bindIdentity(sessionId, JsonUtils.textOrNull(root, "cwd"), at);
        }
        switch (line.getKind()) {
            case USER_PROMPT:
                return userPrompt(line, state, at);
            case TOOL_RESULT:
                return toolResults(line, state, at);
            case ASSISTANT:
                return assistant(line, state, at);
            case SUMMARY: {
                String summary = JsonUtils.textOrNull(root, "summary");
                if (summary != null) {
                    state.summarize(summary);
                }
                return Collections.emptyList();
            }
            case UNKNOWN:
            default:
                return Collections.emptyList();
        }
    }

    private List<Message> userPrompt(DecodedLine<ClaudeEventKind> line, SessionState state, Instant at) {
        state.touch(at);
        Message message = ClaudeMessages.userPrompt(line, state.session(at).getId());
        if (message == null) {
            return Collections.emptyList();
        }
        state.promptSubmitted(message.getContent(), at);
        return Collections.singletonList(message);
    }

    private List<Message> toolResults(DecodedLine<ClaudeEventKind> line, SessionState state, Instant at) {
        state.touch(at);
        List<Message> out = new ArrayList<>();
        for (Map.Entry<String, ToolResult> e : ClaudeMessages.toolResults(line).entrySet()) {
            PendingToolCall call = state.takePending(e.getKey());
            if (call == null) {
                continue;
            }
            state.toolCompleted(call.getCallId(), call.getToolName(), at);
            if (call.getMessage() != null) {
                out.add(ClaudeMessages.complete(call.getMessage(), call.getStartedAt(), e.getValue()));
            }
        }
        return out;
    }

    private List<Message> assistant(DecodedLine<ClaudeEventKind> line, SessionState state, Instant at) {
        state.touch(at);
        String model = ClaudeMessages.model(line);
        if (model != null) {
            state.session(at).setModel(model);
            if (state.getUsage().getModel() == null) {
                state.getUsage().setModel(model);
            }
        }
        if (line.getBody().path("usage").isObject()) {
            ClaudeMessages.accumulateUsage(line, state.getUsage());
            state.tokensReported(state.getUsage().totalTokens());
        }

        String sessionId = state.session(at).getId();
        List<Message> messages = ClaudeMessages.assistant(line, sessionId, CallCorrelation.NONE);
        List<JsonNode> toolUses = ClaudeMessages.toolUseBlocks(line);
        for (JsonNode block : toolUses) {
            String callId = JsonUtils.textOrNull(block, "id");
            String name = block.path("name").asText("tool");
            if (callId != null) {
                Message inProgress = findById(messages, "tool-" + callId);
                state.toolStarted(new PendingToolCall(callId, name, at, inProgress), at);
            } else {
                state.markWorking(name, at);
            }
            if (ClaudeMessages.ASK_USER_QUESTION.equals(name)) {
                state.questionRequested(firstQuestion(block.path("input")), at);
            }
        }

        boolean hasText = JsonUtils.joinedText(line.getBody().path("content"), "text") != null;
        String stopReason = line.getBody().path("stop_reason").asText("");
        if (toolUses.isEmpty() && hasText && !"tool_use".equals(stopReason)) {
            state.markWaiting(at);
        }
        return messages;
    }

    private static Message findById(List<Message> messages, String id) {
        for (Message m : messages) {
            if (id.equals(m.getId())) {
                return m;
            }
        }
        return null;
    }

    private static String firstQuestion(JsonNode input) {
        JsonNode first = input.path("questions").path(0);
        String q = JsonUtils.textOrNull(first, "question", "header");
        return q != null ? q : JsonUtils.textOrNull(input, "question");
    }
}
