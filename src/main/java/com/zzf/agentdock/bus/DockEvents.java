package com.zzf.agentdock.bus;

import lombok.Value;

import java.nio.file.Path;

/**
 * Change signals. Observers re-query the store; payloads only say what changed.
 */
public final class DockEvents {

    public static final AgentBus.Topic<SessionChanged> SESSION_UPDATED =
            new AgentBus.Topic<>("session.updated", SessionChanged.class);

    public static final AgentBus.Topic<TranscriptChanged> TRANSCRIPT_UPDATED =
            new AgentBus.Topic<>("transcript.updated", TranscriptChanged.class);

    private DockEvents() {}

    @Value
    public static class SessionChanged {
        /** Null asks observers to refresh everything. */
        String sessionId;

        public boolean isBroadcast() {
            return sessionId == null;
        }
    }

    @Value
    public static class TranscriptChanged {
        Path path;
    }
}
