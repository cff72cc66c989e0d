package com.zzf.agentdock.interpret;

import com.zzf.agentdock.model.AttentionReason;
import com.zzf.agentdock.model.Session;
import com.zzf.agentdock.model.SessionStatus;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.model.UsageStats;
import com.zzf.agentdock.model.WorkStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mutable per-transcript state the interpreters drive: the session row plus in-flight tool calls.
 * Not thread-safe; one transcript is processed by one thread at a time.
 */
public final class SessionState {
    private static final Pattern TRAILING_UUID =
            Pattern.compile("([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})$");

    private final TranscriptFormat format;
    private final Path transcriptPath;
    private final Map<String, PendingToolCall> pendingCalls = new LinkedHashMap<>();
    private final Set<String> countedCallIds = new HashSet<>();
    private final UsageStats usage = new UsageStats();
    private Session session;
    private String deferredSummary;

    public SessionState(TranscriptFormat format, Path transcriptPath) {
        this.format = format;
        this.transcriptPath = transcriptPath;
    }

    public TranscriptFormat getFormat() {
        return format;
    }

    public Path getTranscriptPath() {
        return transcriptPath;
    }

    public UsageStats getUsage() {
        return usage;
    }

    public boolean hasSession() {
        return session != null;
    }

    /**
     * The session row, created under the file-derived id when no metadata line has named it yet.
     */
    public Session session(Instant at) {
        if (session == null) {
            bindIdentity(fallbackSessionId(transcriptPath), null, at);
        }
        return session;
    }

    public Session currentSession() {
        return session;
    }

    /**
     * Creates the session on its first metadata event. A later, different id does not replace it.
     */
    public Session bindIdentity(String sessionId, String projectPath, Instant at) {
        if (session == null) {
            session = Session.builder()
                    .id(sessionId)
                    .format(format)
                    .projectPath(projectPath)
                    .projectName(projectName(projectPath))
                    .transcriptPath(transcriptPath == null ? null : transcriptPath.toString())
                    .startedAt(at)
                    .lastActivityAt(at)
                    .summary(deferredSummary)
                    .build();
            deferredSummary = null;
        } else if (projectPath != null && session.getProjectPath() == null) {
            session.setProjectPath(projectPath);
            session.setProjectName(projectName(projectPath));
        }
        return session;
    }

    /**
     * Sets the summary, holding it until the session exists when no line has identified it yet.
     */
    public void summarize(String summary) {
        if (session == null) {
            deferredSummary = summary;
        } else {
            session.setSummary(summary);
        }
    }

    public void restore(Session stored) {
        this.session = stored;
    }

    public void touch(Instant at) {
        Session s = session(at);
        if (s.getStatus() == SessionStatus.ENDED) {
            s.setStatus(SessionStatus.ACTIVE);
            s.setEndedAt(null);
            s.setEndReason(null);
        }
        if (at != null && (s.getLastActivityAt() == null || at.isAfter(s.getLastActivityAt()))) {
            s.setLastActivityAt(at);
        }
        if (s.getStartedAt() == null) {
            s.setStartedAt(at);
        }
    }

    public void markWorking(String tool, Instant at) {
        Session s = session(at);
        s.setWorkStatus(WorkStatus.WORKING);
        s.setAttentionReason(AttentionReason.NONE);
        if (tool != null) {
            s.setLastTool(tool);
            s.setLastToolAt(at);
        }
    }

    public void markWaiting(Instant at) {
        Session s = session(at);
        s.setWorkStatus(WorkStatus.WAITING);
        s.setAttentionReason(AttentionReason.AWAITING_REPLY);
        clearPending();
        ensureName();
    }

    public void clearPending() {
        Session s = session(null);
        s.setPendingToolName(null);
        s.setPendingToolInput(null);
        s.setPendingQuestion(null);
    }

    public void promptSubmitted(String prompt, Instant at) {
        Session s = session(at);
        s.setPromptCount(s.getPromptCount() + 1);
        if (s.getFirstPrompt() == null) {
            s.setFirstPrompt(SessionNames.firstPrompt(prompt));
        }
        s.setWorkStatus(WorkStatus.WORKING);
        s.setAttentionReason(AttentionReason.NONE);
        s.setPendingQuestion(null);
    }

    /**
     * Registers an in-flight call. A second begin for the same id replaces the first.
     */
    public void toolStarted(PendingToolCall call, Instant at) {
        pendingCalls.put(call.getCallId(), call);
        markWorking(call.getToolName(), at);
    }

    /**
     * Counts a finished call once per call id, however many end events report it. A finished call no
     * longer needs the user, so any attention request is cleared; the work status is left alone.
     */
    public void toolCompleted(String callId, String label, Instant at) {
        Session s = session(at);
        if (callId == null || countedCallIds.add(callId)) {
            s.setToolCount(s.getToolCount() + 1);
        }
        s.setPendingToolName(null);
        s.setPendingToolInput(null);
        s.setAttentionReason(AttentionReason.NONE);
        if (label != null) {
            s.setLastTool(label);
            s.setLastToolAt(at);
        }
    }

    public PendingToolCall pending(String callId) {
        return callId == null ? null : pendingCalls.get(callId);
    }

    public PendingToolCall takePending(String callId) {
        return callId == null ? null : pendingCalls.remove(callId);
    }

    public Collection<PendingToolCall> pendingCalls() {
        return Collections.unmodifiableCollection(pendingCalls.values());
    }

    public void permissionRequested(String toolName, String serializedInput, Instant at) {
        Session s = session(at);
        s.setWorkStatus(WorkStatus.PERMISSION);
        s.setAttentionReason(AttentionReason.AWAITING_PERMISSION);
        s.setPendingToolName(toolName);
        s.setPendingToolInput(serializedInput);
    }

    public void questionRequested(String question, Instant at) {
        Session s = session(at);
        s.setWorkStatus(WorkStatus.WAITING);
        s.setAttentionReason(AttentionReason.AWAITING_QUESTION);
        s.setPendingQuestion(question);
    }

    public void tokensReported(long totalTokens) {
        session(null).setTotalTokens(totalTokens);
    }

    /**
     * Ends the session; calls still in flight are discarded and never complete.
     */
    public void end(String reason, Instant at) {
        Session s = session(at);
        s.setStatus(SessionStatus.ENDED);
        s.setEndedAt(at);
        s.setEndReason(reason);
        pendingCalls.clear();
    }

    public void ensureName() {
        Session s = session(null);
        if (s.getCustomName() == null && s.getSummary() == null && s.getFirstPrompt() == null) {
            s.setCustomName(SessionNames.slug(s.getId()));
        }
    }

    public static String fallbackSessionId(Path path) {
        if (path == null || path.getFileName() == null) {
            return "unknown";
        }
        String stem = path.getFileName().toString();
        if (stem.endsWith(".jsonl")) {
            stem = stem.substring(0, stem.length() - ".jsonl".length());
        }
        Matcher m = TRAILING_UUID.matcher(stem);
        return m.find() ? m.group(1) : stem;
    }

    public static String projectName(String projectPath) {
        if (projectPath == null) {
            return null;
        }
        String trimmed = projectPath.endsWith("/") && projectPath.length() > 1
                ? projectPath.substring(0, projectPath.length() - 1)
                : projectPath;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
