package com.zzf.agentdock.model;

public enum MessageType {
    USER,
    ASSISTANT,
    TOOL,
    TOOL_RESULT,
    THINKING,
    SYSTEM
}
