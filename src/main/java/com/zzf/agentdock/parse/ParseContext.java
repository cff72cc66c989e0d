package com.zzf.agentdock.parse;

import com.zzf.agentdock.model.Message;
import com.zzf.agentdock.model.UsageStats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulator for one parse. Messages are keyed by id so a repeated id keeps its first position and
 * takes the latest content.
 */
final class ParseContext {
    final CorrelationIndex index = new CorrelationIndex();
    final UsageStats stats = new UsageStats();
    private final Map<String, Message> messages = new LinkedHashMap<>();
    String sessionId;
    String projectPath;
    String lastUserPrompt;
    String lastTool;

    void identify(String id, String path) {
        if (sessionId == null && id != null) {
            sessionId = id;
        }
        if (projectPath == null && path != null) {
            projectPath = path;
        }
    }

    void emit(List<Message> batch) {
        for (Message m : batch) {
            messages.put(m.getId(), m);
        }
    }

    List<Message> sequencedMessages() {
        List<Message> out = new ArrayList<>(messages.size());
        int sequence = 0;
        for (Message m : messages.values()) {
            out.add(m.toBuilder().sequence(sequence++).build());
        }
        return out;
    }
}
