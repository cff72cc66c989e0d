package com.zzf.agentdock.interpret;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.agentdock.model.AttentionReason;
import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.MessageType;
import com.zzf.agentdock.model.Session;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.model.WorkStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static com.zzf.agentdock.Transcripts.*;
import static org.junit.jupiter.api.Assertions.*;

class ClaudeLineInterpreterTest {

    private ClaudeLineInterpreter interpreter;
    private SessionState state;
    private long offset;

    @BeforeEach
    void setUp() {
        interpreter = new ClaudeLineInterpreter(new ObjectMapper());
        state = new SessionState(TranscriptFormat.CLAUDE, Paths.get("/tmp/projects/demo/" + SID + ".jsonl"));
    }

    @Test
    void promptToolCallResultAndReply() {
        List<Message> user = apply(claudeUser("u1", "2025-01-01T00:00:00Z", "fix bug"));
        assertEquals(1, user.size());
        assertEquals("u1", user.get(0).getId());
        assertEquals(MessageType.USER, user.get(0).getType());
        Session s = state.currentSession();
        assertEquals(SID, s.getId());
        assertEquals(CWD, s.getProjectPath());
        assertEquals("demo", s.getProjectName());
        assertEquals(1, s.getPromptCount());
        assertEquals("fix bug", s.getFirstPrompt());
        assertEquals(WorkStatus.WORKING, s.getWorkStatus());

        List<Message> call = apply(claudeToolUse("a1", "2025-01-01T00:00:01Z", "toolu_1", "Bash", "{\"command\":\"ls\"}"));
        assertEquals(1, call.size());
        Message tool = call.get(0);
        assertEquals("tool-toolu_1", tool.getId());
        assertEquals("ls", tool.getContent());
        assertEquals("Bash", tool.getToolName());
        assertTrue(tool.isInProgress());
        assertEquals(1, state.pendingCalls().size());
        assertEquals("Bash", s.getLastTool());
        assertEquals("claude-sonnet-4-5", s.getModel());
        assertEquals(120, s.getTotalTokens());

        List<Message> result = apply(claudeToolResult("u2", "2025-01-01T00:00:03Z", "toolu_1", "a.txt"));
        assertEquals(1, result.size());
        Message done = result.get(0);
        assertEquals("tool-toolu_1", done.getId());
        assertFalse(done.isInProgress());
        assertEquals("a.txt", done.getToolOutput());
        assertEquals(2.0, done.getToolDuration(), 1e-9);
        assertEquals(1, s.getToolCount());
        assertTrue(state.pendingCalls().isEmpty());

        List<Message> reply = apply(claudeText("a2", "2025-01-01T00:00:04Z", "done"));
        assertEquals("a2-text", reply.get(0).getId());
        assertEquals(MessageType.ASSISTANT, reply.get(0).getType());
        assertEquals(WorkStatus.WAITING, s.getWorkStatus());
        assertEquals(AttentionReason.AWAITING_REPLY, s.getAttentionReason());
        assertEquals(180, s.getTotalTokens());
    }

    @Test
    void resultForUnknownCallIsIgnored() {
        apply(claudeUser("u1", "2025-01-01T00:00:00Z", "hi"));
        assertTrue(apply(claudeToolResult("u2", "2025-01-01T00:00:01Z", "toolu_missing", "x")).isEmpty());
        assertEquals(0, state.currentSession().getToolCount());
    }

    @Test
    void askUserQuestionWaitsForAnswer() {
        apply(claudeUser("u1", "2025-01-01T00:00:00Z", "set up db"));
        apply(claudeToolUse("a1", "2025-01-01T00:00:01Z", "toolu_q", "AskUserQuestion",
                "{\"questions\":[{\"question\":\"Which database?\"}]}"));
        Session s = state.currentSession();
        assertEquals(WorkStatus.WAITING, s.getWorkStatus());
        assertEquals(AttentionReason.AWAITING_QUESTION, s.getAttentionReason());
        assertEquals("Which database?", s.getPendingQuestion());

        apply(claudeUser("u2", "2025-01-01T00:00:05Z", "postgres"));
        assertNull(s.getPendingQuestion());
        assertEquals(WorkStatus.WORKING, s.getWorkStatus());
    }

    @Test
    void summaryBeforeIdentityIsKept() {
        apply("{\"type\":\"summary\",\"summary\":\"Refactor parser\",\"leafUuid\":\"x\"}");
        assertFalse(state.hasSession());
        apply(claudeUser("u1", "2025-01-01T00:00:00Z", "go"));
        assertEquals(SID, state.currentSession().getId());
        assertEquals("Refactor parser", state.currentSession().getSummary());
        assertEquals("Refactor parser", state.currentSession().displayName());
    }

    @Test
    void metaAndUnknownLinesProduceNothing() {
        assertTrue(apply("{\"type\":\"user\",\"isMeta\":true,\"sessionId\":\"" + SID
                + "\",\"message\":{\"content\":\"<command-name>\"}}").isEmpty());
        assertTrue(apply("{\"type\":\"file-history-snapshot\",\"snapshot\":{}}").isEmpty());
        assertEquals(0, state.currentSession().getPromptCount());
    }

    @Test
    void malformedLinesAreSkipped() {
        assertTrue(interpreter.decode("{\"type\":\"user\",", 0).isEmpty());
        assertTrue(interpreter.decode("[1,2,3]", 0).isEmpty());
        assertTrue(interpreter.decode("   ", 0).isEmpty());
    }

    @Test
    void lineWithoutUuidIsIdentifiedByItsOffset() {
        String raw = "{\"type\":\"user\",\"sessionId\":\"" + SID + "\",\"message\":{\"content\":\"hello\"}}";
        assertEquals("line-120", interpreter.decode(raw, 120).orElseThrow().getLineId());
        assertEquals("line-120", interpreter.decode(raw, 120).orElseThrow().getLineId());
        assertEquals("u1", interpreter.decode(claudeUser("u1", "2025-01-01T00:00:00Z", "hi"), 7)
                .orElseThrow().getLineId());
    }

    @Test
    void identicalLinesWithoutUuidStayDistinct() {
        String yes = "{\"type\":\"user\",\"sessionId\":\"" + SID + "\",\"message\":{\"content\":\"yes\"}}";
        List<Message> first = apply(yes);
        List<Message> second = apply(yes);
        assertNotEquals(first.get(0).getId(), second.get(0).getId());
        assertEquals(2, state.currentSession().getPromptCount());
    }

    @Test
    void answeredQuestionClearsAttention() {
        apply(claudeUser("u1", "2025-01-01T00:00:00Z", "set up db"));
        apply(claudeToolUse("a1", "2025-01-01T00:00:01Z", "toolu_q", "AskUserQuestion",
                "{\"questions\":[{\"question\":\"Which database?\"}]}"));
        apply(claudeToolResult("u2", "2025-01-01T00:00:04Z", "toolu_q", "postgres"));
        Session s = state.currentSession();
        assertEquals(AttentionReason.NONE, s.getAttentionReason());
        assertEquals(1, s.getToolCount());
    }

    @Test
    void sessionWithoutMetadataUsesFileName() {
        apply("{\"type\":\"user\",\"uuid\":\"u1\",\"message\":{\"content\":\"hello\"}}");
        assertEquals(SID, state.currentSession().getId());
        assertNull(state.currentSession().getStartedAt());
    }

    private List<Message> apply(String raw) {
        long at = offset;
        offset += raw.length() + 1;
        return interpreter.apply(interpreter.decode(raw, at).orElseThrow(), state);
    }
}
