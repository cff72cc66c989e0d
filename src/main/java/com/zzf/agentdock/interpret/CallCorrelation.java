package com.zzf.agentdock.interpret;

import java.time.Instant;

/**
 * Lookup of call start times and results by call id.
 */
public interface CallCorrelation {

    CallCorrelation NONE = new CallCorrelation() {
        @Override
        public Instant startOf(String callId) {
            return null;
        }

        @Override
        public ToolResult resultOf(String callId) {
            return null;
        }
    };

    Instant startOf(String callId);

    ToolResult resultOf(String callId);
}
