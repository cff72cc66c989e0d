package com.zzf.agentdock.parse;

import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.TranscriptFormat;
import com.zzf.agentdock.model.UsageStats;
import lombok.Value;

import java.util.List;

/**
 * Everything derived from one full pass over a transcript. Messages are ordered by sequence.
 */
@Value
public class ParseResult {
    TranscriptFormat format;
    String sessionId;
    String projectPath;
    List<Message> messages;
    UsageStats stats;
    String lastUserPrompt;
    String lastTool;
    double estimatedCostUsd;
}
