package com.zzf.agentdock.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Derived state of one agent session (对齐 sessions 表)。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {
    private String id;
    private TranscriptFormat format;
    private String projectPath;
    private String projectName;
    private String model;
    private String modelProvider;
    private String customName;
    private String summary;
    private String firstPrompt;
    private String transcriptPath;
    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;
    @Builder.Default
    private WorkStatus workStatus = WorkStatus.UNKNOWN;
    @Builder.Default
    private AttentionReason attentionReason = AttentionReason.NONE;
    private String pendingToolName;
    private String pendingToolInput;
    private String pendingQuestion;
    private int promptCount;
    private int toolCount;
    private long totalTokens;
    private double totalCostUsd;
    private String lastTool;
    private Instant lastToolAt;
    private Instant startedAt;
    private Instant lastActivityAt;
    private Instant endedAt;
    private String endReason;

    public String displayName() {
        if (customName != null) {
            return customName;
        }
        if (summary != null) {
            return summary;
        }
        if (firstPrompt != null) {
            return firstPrompt;
        }
        return id;
    }
}
