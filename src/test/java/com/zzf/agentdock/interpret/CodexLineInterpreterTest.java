package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.model.AttentionReason;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.MessageType;
import com.zzf.agentdock.model.Session;
import com.zzf.agentdock.model.SessionStatus;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.model.WorkStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

import static com.zzf.agentdock.Transcripts.*;
import static org.junit.jupiter.api.Assertions.*;

class CodexLineInterpreterTest {
    private static final String SHELL_ARGS = "\"name\":\"shell\",\"call_id\":\"c1\","
            + "\"arguments\":\"{\\\"command\\\":[\\\"bash\\\",\\\"-lc\\\",\\\"ls\\\"]}\"";

    private CodexLineInterpreter interpreter;
    private SessionState state;
    private long offset;

    @BeforeEach
    void setUp() {
        interpreter = new CodexLineInterpreter(new ObjectMapper());
        state = new SessionState(TranscriptFormat.CODEX, Paths.get("/tmp/sessions/rollout-2025-01-01-abc.jsonl"));
    }

    @Test
    void sessionMetaAndTurnContextSetIdentity() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexTurnContext("2025-01-01T00:00:01Z", "gpt-5-codex"));
        Session s = state.currentSession();
        assertEquals("codex-1", s.getId());
        assertEquals(CWD, s.getProjectPath());
        assertEquals("openai", s.getModelProvider());
        assertEquals("gpt-5-codex", s.getModel());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), s.getStartedAt());
    }

    @Test
    void commandLifecycleCountsOneTool() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        List<Message> user = apply(codexEvent("2025-01-01T00:00:01Z", "user_message", "\"message\":\"run ls\""));
        assertEquals(MessageType.USER, user.get(0).getType());
        assertEquals(1, state.currentSession().getPromptCount());

        List<Message> call = apply(codexItem("2025-01-01T00:00:02Z", "function_call", SHELL_ARGS));
        assertEquals(1, call.size());
        assertEquals("tool-c1", call.get(0).getId());
        assertEquals("Shell", call.get(0).getToolName());
        assertEquals("bash -lc ls", call.get(0).getContent());
        assertTrue(call.get(0).isInProgress());

        assertTrue(apply(codexEvent("2025-01-01T00:00:02Z", "exec_command_begin", "\"call_id\":\"c1\"")).isEmpty());
        assertEquals(WorkStatus.WORKING, state.currentSession().getWorkStatus());

        List<Message> end = apply(codexEvent("2025-01-01T00:00:04Z", "exec_command_end",
                "\"call_id\":\"c1\",\"aggregated_output\":\"a.txt\",\"exit_code\":0"));
        assertEquals(1, end.size());
        assertEquals("tool-c1", end.get(0).getId());
        assertEquals("a.txt", end.get(0).getToolOutput());
        assertEquals(2.0, end.get(0).getToolDuration(), 1e-9);
        assertFalse(end.get(0).isInProgress());

        assertTrue(apply(codexItem("2025-01-01T00:00:04Z", "function_call_output",
                "\"call_id\":\"c1\",\"output\":\"{\\\"output\\\":\\\"a.txt\\\"}\"")).isEmpty());
        assertEquals(1, state.currentSession().getToolCount());
        assertEquals("Shell", state.currentSession().getLastTool());
    }

    @Test
    void functionCallOutputCompletesCallWithoutEndEvent() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexItem("2025-01-01T00:00:01Z", "function_call", SHELL_ARGS));
        List<Message> out = apply(codexItem("2025-01-01T00:00:02Z", "function_call_output",
                "\"call_id\":\"c1\",\"output\":\"{\\\"output\\\":\\\"a.txt\\\",\\\"metadata\\\":{}}\""));
        assertEquals(1, out.size());
        assertEquals("a.txt", out.get(0).getToolOutput());
        assertEquals(1, state.currentSession().getToolCount());
    }

    @Test
    void approvalRequestsNeedPermission() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexEvent("2025-01-01T00:00:01Z", "exec_approval_request",
                "\"call_id\":\"c9\",\"command\":[\"rm\",\"-rf\",\"build\"]"));
        Session s = state.currentSession();
        assertEquals(WorkStatus.PERMISSION, s.getWorkStatus());
        assertEquals(AttentionReason.AWAITING_PERMISSION, s.getAttentionReason());
        assertEquals("ExecCommand", s.getPendingToolName());
        assertTrue(s.getPendingToolInput().contains("rm"));

        apply(codexEvent("2025-01-01T00:00:02Z", "task_started", ""));
        assertEquals(WorkStatus.WORKING, s.getWorkStatus());
        assertNull(s.getPendingToolName());

        apply(codexEvent("2025-01-01T00:00:03Z", "apply_patch_approval_request", "\"call_id\":\"c10\""));
        assertEquals("ApplyPatch", s.getPendingToolName());
    }

    @Test
    void finishedCallClearsPermissionRequest() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexEvent("2025-01-01T00:00:01Z", "exec_approval_request",
                "\"call_id\":\"c9\",\"command\":[\"rm\",\"-rf\",\"build\"]"));
        apply(codexEvent("2025-01-01T00:00:03Z", "exec_command_end", "\"call_id\":\"c9\",\"exit_code\":0"));
        Session s = state.currentSession();
        assertEquals(AttentionReason.NONE, s.getAttentionReason());
        assertEquals(WorkStatus.PERMISSION, s.getWorkStatus());
        assertNull(s.getPendingToolName());
        assertEquals("Shell", s.getLastTool());
        assertEquals(1, s.getToolCount());
    }

    @Test
    void agentMessageAndTaskCompleteWaitForReply() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        List<Message> reply = apply(codexEvent("2025-01-01T00:00:01Z", "agent_message", "\"message\":\"All good\""));
        assertEquals(MessageType.ASSISTANT, reply.get(0).getType());
        assertEquals("All good", reply.get(0).getContent());
        assertEquals(WorkStatus.WAITING, state.currentSession().getWorkStatus());
        assertEquals(AttentionReason.AWAITING_REPLY, state.currentSession().getAttentionReason());

        apply(codexEvent("2025-01-01T00:00:02Z", "task_started", ""));
        apply(codexEvent("2025-01-01T00:00:03Z", "task_complete", ""));
        assertEquals(WorkStatus.WAITING, state.currentSession().getWorkStatus());
    }

    @Test
    void tokenCountReplacesTotals() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexEvent("2025-01-01T00:00:01Z", "token_count", "\"info\":{"
                + "\"total_token_usage\":{\"input_tokens\":1000,\"cached_input_tokens\":200,\"output_tokens\":300,"
                + "\"total_tokens\":1300},\"last_token_usage\":{\"input_tokens\":900},\"model_context_window\":272000}"));
        assertEquals(1300, state.currentSession().getTotalTokens());
        assertEquals(800, state.getUsage().getInputTokens());
        assertEquals(200, state.getUsage().getCacheReadTokens());
        assertEquals(900, state.getUsage().getContextUsed());
        assertEquals(272000, state.getUsage().getContextLimit());

        apply(codexEvent("2025-01-01T00:00:02Z", "token_count", "\"info\":null"));
        assertEquals(1300, state.currentSession().getTotalTokens());
    }

    @Test
    void mcpCallsAreLabelledByServerAndTool() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexEvent("2025-01-01T00:00:01Z", "mcp_tool_call_begin",
                "\"call_id\":\"m1\",\"invocation\":{\"server\":\"github\",\"tool\":\"search\"}"));
        assertEquals("MCP:github/search", state.currentSession().getLastTool());
        apply(codexEvent("2025-01-01T00:00:02Z", "mcp_tool_call_end",
                "\"call_id\":\"m1\",\"invocation\":{\"server\":\"github\",\"tool\":\"search\"}"));
        assertEquals(1, state.currentSession().getToolCount());
    }

    @Test
    void threadRenameAndQuestions() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexEvent("2025-01-01T00:00:01Z", "thread_name_updated", "\"thread_name\":\"Fix flaky tests\""));
        assertEquals("Fix flaky tests", state.currentSession().displayName());

        apply(codexEvent("2025-01-01T00:00:02Z", "request_user_input",
                "\"questions\":[{\"header\":\"Scope\",\"question\":\"Only unit tests?\"}]"));
        assertEquals(AttentionReason.AWAITING_QUESTION, state.currentSession().getAttentionReason());
        assertEquals("Only unit tests?", state.currentSession().getPendingQuestion());
    }

    @Test
    void endedSessionDropsPendingCallsAndReactivatesOnActivity() {
        apply(codexMeta("codex-1", "2025-01-01T00:00:00Z"));
        apply(codexItem("2025-01-01T00:00:01Z", "function_call", SHELL_ARGS));
        state.end("timeout", Instant.parse("2025-01-01T01:00:00Z"));
        assertEquals(SessionStatus.ENDED, state.currentSession().getStatus());
        assertTrue(state.pendingCalls().isEmpty());

        assertTrue(apply(codexEvent("2025-01-01T01:00:05Z", "exec_command_end", "\"call_id\":\"c1\"")).isEmpty());
        assertEquals(SessionStatus.ACTIVE, state.currentSession().getStatus());
        assertNull(state.currentSession().getEndReason());
    }

    private List<Message> apply(String raw) {
        long at = offset;
        offset += raw.length() + 1;
        return interpreter.apply(interpreter.decode(raw, at).orElseThrow(), state);
    }
}
