package com.zzf.agentdock.model;

public enum AttentionReason {
    NONE,
    AWAITING_PERMISSION,
    AWAITING_QUESTION,
    AWAITING_REPLY
}
