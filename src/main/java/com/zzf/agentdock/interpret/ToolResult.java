package com.zzf.agentdock.interpret;

import lombok.Value;

import java.time.Instant;

/**
 * Output of a finished tool call and when it was reported.
 */
@Value
public class ToolResult {
    String output;
    Instant timestamp;
}
