package com.zzf.agentdock.model;

public enum SessionStatus {
    ACTIVE,
    ENDED
}
