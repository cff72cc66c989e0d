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

/**
 * Codex rollout files: {@code session_meta}, {@code turn_context}, {@code event_msg} and
 * {@code response_item} lines.
 */
@Component
public class CodexLineInterpreter extends AbstractLineInterpreter<CodexEventKind> {
    private final CodexMessages messages;

    public CodexLineInterpreter(ObjectMapper objectMapper) {
        super(objectMapper);
        this.messages = new CodexMessages(objectMapper);
    }

    @Override
    public TranscriptFormat format() {
        return TranscriptFormat.CODEX;
    }

    @Override
    protected CodexEventKind classify(JsonNode root) {
        return CodexEventKind.classify(root);
    }

    @Override
    protected JsonNode body(JsonNode root) {
        return root.path("payload");
    }

    public CodexMessages messages() {
        return messages;
    }

    @Override
    public List<Message> apply(DecodedLine<CodexEventKind> line, SessionState state) {
        Instant at = line.getTimestamp();
        JsonNode payload = line.getBody();
        CodexEventKind kind = line.getKind();
        if (kind == CodexEventKind.UNKNOWN) {
            return Collections.emptyList();
        }
        if (kind == CodexEventKind.SESSION_META) {
            sessionMeta(payload, state, at);
            return Collections.emptyList();
        }
        state.touch(at);
        switch (kind) {
            case TURN_CONTEXT: {
                String model = JsonUtils.textOrNull(payload, "model");
                if (model != null) {
                    state.session(at).setModel(model);
                    state.getUsage().setModel(model);
                }
                String cwd = JsonUtils.textOrNull(payload, "cwd");
                if (cwd != null) {
                    state.session(at).setProjectPath(cwd);
                    state.session(at).setProjectName(SessionState.projectName(cwd));
                }
                break;
            }
            case TASK_STARTED:
                state.markWorking(null, at);
                state.clearPending();
                break;
            case TASK_COMPLETE:
            case AGENT_MESSAGE:
                state.markWaiting(at);
                break;
            case USER_MESSAGE:
                state.promptSubmitted(JsonUtils.textOrNull(payload, "message"), at);
                break;
            case TOOL_BEGIN: {
                String label = ToolLabels.forEvent(payload.path("type").asText(), payload);
                String callId = CodexMessages.callId(line);
                if (callId != null && state.pending(callId) == null) {
                    state.toolStarted(new PendingToolCall(callId, label, at, null), at);
                } else {
                    state.markWorking(label, at);
                }
                break;
            }
            case TOOL_END:
                return toolEnd(line, state, ToolLabels.forEvent(payload.path("type").asText(), payload), at);
            case TOOL_INSTANT:
                state.toolCompleted(CodexMessages.callId(line), "ViewImage", at);
                break;
            case EXEC_APPROVAL:
                state.permissionRequested("ExecCommand", payload.toString(), at);
                break;
            case PATCH_APPROVAL:
                state.permissionRequested("ApplyPatch", payload.toString(), at);
                break;
            case USER_INPUT_REQUEST: {
                JsonNode first = payload.path("questions").path(0);
                state.questionRequested(JsonUtils.textOrNull(first, "question", "header"), at);
                break;
            }
            case ELICITATION_REQUEST:
                state.questionRequested(JsonUtils.textOrNull(payload, "message", "server_name"), at);
                break;
            case TOKEN_COUNT:
                CodexMessages.applyTokenCount(line, state.getUsage());
                if (payload.path("info").path("total_token_usage").has("total_tokens")) {
                    state.tokensReported(CodexMessages.reportedTotal(line));
                }
                break;
            case THREAD_NAME: {
                String name = JsonUtils.textOrNull(payload, "thread_name");
                if (name != null) {
                    state.session(at).setCustomName(name);
                }
                break;
            }
            case FUNCTION_CALL:
                return functionCall(line, state, at);
            case FUNCTION_CALL_OUTPUT:
                return toolEnd(line, state, null, at);
            default:
                break;
        }
        return messages.messages(line, state.session(at).getId(), CallCorrelation.NONE);
    }

    private void sessionMeta(JsonNode payload, SessionState state, Instant at) {
        String id = JsonUtils.textOrNull(payload, "id");
        if (id == null) {
            return;
        }
        Instant startedAt = JsonUtils.instantOrNull(payload, "timestamp");
        state.bindIdentity(id, JsonUtils.textOrNull(payload, "cwd"), startedAt != null ? startedAt : at);
        String provider = JsonUtils.textOrNull(payload, "model_provider");
        if (provider != null) {
            state.session(at).setModelProvider(provider);
        }
        state.touch(at);
    }

    private List<Message> functionCall(DecodedLine<CodexEventKind> line, SessionState state, Instant at) {
        Message tool = messages.toolCall(line, state.session(at).getId());
        if (tool == null) {
            return Collections.emptyList();
        }
        String callId = CodexMessages.callId(line);
        state.toolStarted(new PendingToolCall(callId, tool.getToolName(), at, tool), at);
        return Collections.singletonList(tool);
    }

    /**
     * The first end signal for a call completes its message; later ones only refresh status fields.
     */
    private List<Message> toolEnd(DecodedLine<CodexEventKind> line, SessionState state, String label, Instant at) {
        String callId = CodexMessages.callId(line);
        PendingToolCall call = state.takePending(callId);
        if (call == null) {
            if (label != null) {
                state.toolCompleted(callId, label, at);
            }
            return Collections.emptyList();
        }
        state.toolCompleted(callId, label != null ? label : call.getToolName(), at);
        List<Message> out = new ArrayList<>(1);
        if (call.getMessage() != null) {
            out.add(ClaudeMessages.complete(call.getMessage(), call.getStartedAt(), messages.result(line)));
        }
        return out;
    }
}
