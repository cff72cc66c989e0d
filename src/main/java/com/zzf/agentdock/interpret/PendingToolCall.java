package com.zzf.agentdock.interpret;

import com.zzf.agentdock.model.Message;
import lombok.Value;

import java.time.Instant;

/**
 * A tool call seen starting but not yet answered. Holds the in-progress message so the result can
 * complete it under the same id.
 */
@Value
public class PendingToolCall {
    String callId;
    String toolName;
    Instant startedAt;
    Message message;
}
