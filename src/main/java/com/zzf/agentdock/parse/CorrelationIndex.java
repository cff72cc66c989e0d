package com.zzf.agentdock.parse;

import com.zzf.agentdock.interpret.CallCorrelation;
import com.zzf.agentdock.interpret.ToolResult;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Pass-one maps of call starts and results. A repeated start overwrites the earlier timestamp; the
 * first result reported for a call wins.
 */
final class CorrelationIndex implements CallCorrelation {
    private final Map<String, Instant> starts = new HashMap<>();
    private final Map<String, ToolResult> results = new HashMap<>();

    void started(String callId, Instant at) {
        if (callId != null) {
            starts.put(callId, at);
        }
    }

    void finished(String callId, ToolResult result) {
        if (callId != null && result != null) {
            results.putIfAbsent(callId, result);
        }
    }

    @Override
    public Instant startOf(String callId) {
        return callId == null ? null : starts.get(callId);
    }

    @Override
    public ToolResult resultOf(String callId) {
        return callId == null ? null : results.get(callId);
    }

    int startCount() {
        return starts.size();
    }

    int resultCount() {
        return results.size();
    }
}
